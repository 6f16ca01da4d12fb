package org.abstractica.sockjs.impl.session;

import org.abstractica.sockjs.CloseCode;

/**
 * Failure of an acquire request.
 */
public abstract class AcquireException extends RuntimeException
{
    protected AcquireException(String message)
    {
        super(message);
    }

    /**
     * Returns the close code to send to the client that asked.
     *
     * @return the close code
     */
    public abstract CloseCode getCloseCode();
}
