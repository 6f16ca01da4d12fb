package org.abstractica.sockjs.impl.protocol;

import org.abstractica.sockjs.CloseCode;

import java.util.List;
import java.util.Objects;

/**
 * A unit of the server-to-client protocol.
 *
 * <p>This sealed interface covers the complete frame vocabulary; see
 * {@link FrameCodec} for the WebSocket text encoding.</p>
 */
public sealed interface Frame
{
    /**
     * Shared heartbeat instance.
     */
    Heartbeat HEARTBEAT = new Heartbeat();

    /**
     * Shared open instance.
     */
    Open OPEN = new Open();

    /**
     * Keep-alive with no payload.
     */
    record Heartbeat() implements Frame {}

    /**
     * Session start notice. Sent exactly once per session, before any message.
     */
    record Open() implements Frame {}

    /**
     * A single application message.
     *
     * @param payload the message text
     */
    record Message(String payload) implements Frame
    {
        public Message
        {
            Objects.requireNonNull(payload, "payload");
        }
    }

    /**
     * An ordered batch of application messages.
     *
     * @param payloads the message texts
     */
    record MessageBatch(List<String> payloads) implements Frame
    {
        public MessageBatch
        {
            payloads = List.copyOf(payloads);
        }
    }

    /**
     * Raw bytes. Reserved; never emitted by the text transports.
     *
     * @param data the bytes
     */
    record MessageBlob(byte[] data) implements Frame
    {
        public MessageBlob
        {
            Objects.requireNonNull(data, "data");
        }
    }

    /**
     * Session closing notice.
     *
     * @param code the close code
     */
    record Close(CloseCode code) implements Frame
    {
        public Close
        {
            Objects.requireNonNull(code, "code");
        }
    }
}
