package org.abstractica.sockjs.handlers;

/**
 * Creates the handler for a new session.
 */
@FunctionalInterface
public interface SessionHandlerFactory
{
    /**
     * Creates a handler.
     *
     * @param sessionId the identifier of the session being created
     * @return a new handler, never null
     */
    SessionHandler create(String sessionId);
}
