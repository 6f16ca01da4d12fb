package org.abstractica.sockjs.impl.session;

import org.abstractica.sockjs.CloseCode;

/**
 * Another transport is attached to the session and has not released it.
 */
public class SessionBusyException extends AcquireException
{
    private final String sessionId;

    public SessionBusyException(String sessionId)
    {
        super("Session " + sessionId + " is attached to another connection");
        this.sessionId = sessionId;
    }

    public String getSessionId()
    {
        return sessionId;
    }

    @Override
    public CloseCode getCloseCode()
    {
        return CloseCode.ALREADY_OPEN;
    }
}
