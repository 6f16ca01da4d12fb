package org.abstractica.sockjs.handlers;

import org.abstractica.sockjs.Session;

/**
 * Handles exceptions thrown by session handlers.
 *
 * <p>When a session handler throws, the broker catches the exception and
 * invokes this handler. The session keeps running; one buggy handler should
 * not take the broker down.</p>
 */
@FunctionalInterface
public interface ErrorHandler
{
    /**
     * Handles an exception thrown by a session handler.
     *
     * @param session   the session where the error occurred
     * @param message   the inbound message being handled, or null for lifecycle callbacks
     * @param exception the exception thrown by the handler
     */
    void handle(Session session, String message, Exception exception);
}
