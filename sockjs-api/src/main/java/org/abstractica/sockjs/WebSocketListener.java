package org.abstractica.sockjs;

/**
 * Receives inbound events from a WebSocket connection.
 *
 * <p>The HTTP layer calls these methods from its I/O threads. None of them
 * block.</p>
 */
public interface WebSocketListener
{
    /**
     * A text message arrived.
     *
     * @param text the message text
     */
    void onText(String text);

    /**
     * A binary message arrived.
     *
     * @param data the message bytes
     */
    void onBinary(byte[] data);

    /**
     * A ping arrived.
     *
     * @param data the ping payload
     */
    void onPing(byte[] data);

    /**
     * The peer closed the connection cleanly.
     */
    void onClose();

    /**
     * The connection failed with a framing or I/O error.
     *
     * @param cause the failure
     */
    void onError(Throwable cause);
}
