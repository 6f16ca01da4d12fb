package org.abstractica.sockjs;

/**
 * The physical WebSocket connection, provided by the HTTP layer.
 *
 * <p>Implementations must be safe to call from any thread.</p>
 */
public interface WebSocketConnection
{
    /**
     * Sends a text message.
     *
     * @param text the text to send
     * @throws java.io.UncheckedIOException if the write fails
     */
    void sendText(String text);

    /**
     * Answers a ping.
     *
     * @param data the ping payload to echo
     */
    void sendPong(byte[] data);

    /**
     * Starts the closing handshake.
     *
     * @param code   the WebSocket close code
     * @param reason the close reason
     */
    void close(int code, String reason);

    /**
     * Returns whether the connection can still carry messages.
     *
     * @return true if open
     */
    boolean isOpen();
}
