package org.abstractica.sockjs;

import java.util.Optional;

/**
 * A logical conversation between a client and the broker.
 *
 * <p>Sessions outlive physical connections. While no transport is attached,
 * messages sent to the session are buffered and replayed, in order, when a
 * transport attaches again.</p>
 */
public interface Session
{
    /**
     * Returns the session identifier.
     *
     * @return session ID
     */
    String getId();

    /**
     * Returns the current lifecycle state.
     *
     * @return session state
     */
    SessionState getState();

    /**
     * Sends a message to the client.
     *
     * @param message the message payload
     * @throws IllegalStateException if the session is closed or interrupted
     */
    void send(String message);

    /**
     * Attempts to send a message to the client.
     *
     * <p>Queueing is best-effort. A return of true means the session was
     * still running when the message was handed over; if it ends before the
     * message is enqueued, the message is dropped and the drop is logged at
     * debug level with the session id.</p>
     *
     * @param message the message payload
     * @return true if handed over for queueing, false if the session is
     *         already closed or interrupted
     */
    boolean trySend(String message);

    /**
     * Closes the session with {@link CloseCode#GO_AWAY}.
     */
    void close();

    /**
     * Closes the session with the given code.
     *
     * <p>If a transport is attached, the close frame is sent to the client.
     * Closing a session that is already closed has no effect.</p>
     *
     * @param code the close code to send
     */
    void close(CloseCode code);

    /**
     * Returns the application attachment if set.
     *
     * @return the attachment, or empty if none set
     */
    Optional<Object> getAttachment();

    /**
     * Sets the application attachment.
     *
     * @param attachment the attachment to set (may be null)
     */
    void setAttachment(Object attachment);
}
