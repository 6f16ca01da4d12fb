package org.abstractica.sockjs.handlers;

import org.abstractica.sockjs.Session;

/**
 * Application logic for one session.
 *
 * <p>Each session owns its own handler instance. Callbacks for one session
 * are never invoked concurrently and arrive in order; callbacks for
 * different sessions may run in parallel. Handlers must not block.</p>
 */
public interface SessionHandler
{
    /**
     * Called once, when the first transport attaches to the session.
     *
     * @param session the session
     */
    default void onOpen(Session session)
    {
    }

    /**
     * Called for each message received from the client.
     *
     * @param session the session
     * @param message the decoded message payload
     */
    void onMessage(Session session, String message);

    /**
     * Called once, when the session is closed, interrupted or expired.
     *
     * @param session the session
     */
    default void onClose(Session session)
    {
    }
}
