package org.abstractica.sockjs;

import java.util.Collection;
import java.util.Optional;

/**
 * Owns the session registry and attaches transports to sessions.
 *
 * <p>The HTTP layer routes each WebSocket upgrade to
 * {@link #openWebSocket(String, WebSocketConnection)} and feeds the returned
 * listener with the connection's inbound events.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Broker broker = brokerFactory.builder()
 *     .handlerFactory(sessionId -> new EchoHandler())
 *     .heartbeatInterval(Duration.ofSeconds(25))
 *     .build();
 * broker.start();
 *
 * WebSocketListener listener = broker.openWebSocket(sessionId, connection);
 * }</pre>
 */
public interface Broker extends AutoCloseable
{
    /**
     * Starts the broker and its maintenance tick.
     */
    void start();

    /**
     * Closes every open session and stops the broker.
     */
    @Override
    void close();

    /**
     * Attaches a WebSocket connection to the named session.
     *
     * <p>The session is created if it does not exist. The attach completes
     * asynchronously; the returned listener accepts events immediately.</p>
     *
     * @param sessionId  the session identifier taken from the request
     * @param connection the physical connection
     * @return the listener for inbound events on this connection
     * @throws IllegalStateException if the broker is not running
     */
    WebSocketListener openWebSocket(String sessionId, WebSocketConnection connection);

    /**
     * Sends a message to every running session.
     *
     * @param message the message payload
     */
    void broadcast(String message);

    /**
     * Returns all sessions held by the broker.
     *
     * @return unmodifiable collection of sessions
     */
    Collection<Session> getSessions();

    /**
     * Finds a session by its identifier.
     *
     * @param sessionId the session identifier
     * @return the session, or empty if unknown
     */
    Optional<Session> getSession(String sessionId);

    /**
     * Returns broker statistics.
     *
     * @return current statistics
     */
    BrokerStats getStats();
}
