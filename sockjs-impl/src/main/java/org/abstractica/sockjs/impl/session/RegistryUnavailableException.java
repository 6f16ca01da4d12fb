package org.abstractica.sockjs.impl.session;

import org.abstractica.sockjs.CloseCode;

/**
 * The registry is shut down and accepts no more requests.
 */
public class RegistryUnavailableException extends AcquireException
{
    public RegistryUnavailableException()
    {
        super("Session registry is not available");
    }

    @Override
    public CloseCode getCloseCode()
    {
        return CloseCode.INTERNAL_ERROR;
    }
}
