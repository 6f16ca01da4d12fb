package org.abstractica.sockjs.impl.transport;

import org.abstractica.sockjs.CloseCode;
import org.abstractica.sockjs.WebSocketConnection;
import org.abstractica.sockjs.WebSocketListener;
import org.abstractica.sockjs.impl.protocol.Frame;
import org.abstractica.sockjs.impl.protocol.FrameCodec;
import org.abstractica.sockjs.impl.protocol.MalformedPayloadException;
import org.abstractica.sockjs.impl.session.DefaultBrokerStats;
import org.abstractica.sockjs.impl.session.SessionRecord;
import org.abstractica.sockjs.impl.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * SockJS over a raw WebSocket connection.
 *
 * <p>Outbound frames are written as SockJS text frames. Inbound text is a
 * JSON array of messages, each forwarded to the session handler in order.
 * Binary messages are not part of the protocol and are ignored.</p>
 */
public class WebSocketTransport extends AbstractTransport implements WebSocketListener
{
    private static final Logger LOG = LoggerFactory.getLogger(WebSocketTransport.class);

    private static final int NORMAL_CLOSURE = 1000;

    private final WebSocketConnection connection;
    private final DefaultBrokerStats stats;

    /**
     * Creates a WebSocket transport. Call {@link #init()} to attach.
     *
     * @param sessionId  the session to attach to
     * @param connection the physical connection
     * @param registry   the session registry
     * @param executor   executor for the transport mailbox
     * @param stats      counters to update
     */
    public WebSocketTransport(
            String sessionId,
            WebSocketConnection connection,
            SessionRegistry registry,
            Executor executor,
            DefaultBrokerStats stats
    )
    {
        super(sessionId, registry, executor);
        this.connection = Objects.requireNonNull(connection, "connection");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    // ========== Outbound ==========

    @Override
    protected SendResult send(Frame frame, SessionRecord record)
    {
        if (frame instanceof Frame.MessageBlob)
        {
            LOG.warn("Binary frames cannot be sent over a SockJS WebSocket, dropping (session={})", getSessionId());
            return SendResult.CONTINUE;
        }
        if (frame instanceof Frame.Close)
        {
            record.close();
        }
        if (!connection.isOpen())
        {
            return SendResult.STOP;
        }

        try
        {
            connection.sendText(FrameCodec.encode(frame));
            stats.recordFrameSent();
        }
        catch (RuntimeException e)
        {
            LOG.debug("Write failed for session {}", getSessionId(), e);
            return SendResult.STOP;
        }

        return frame instanceof Frame.Close ? SendResult.STOP : SendResult.CONTINUE;
    }

    @Override
    protected void sendClose(CloseCode code)
    {
        if (!connection.isOpen())
        {
            return;
        }
        try
        {
            connection.sendText(FrameCodec.encode(new Frame.Close(code)));
            stats.recordFrameSent();
        }
        catch (RuntimeException e)
        {
            LOG.debug("Failed to send close frame for session {}", getSessionId(), e);
        }
    }

    @Override
    protected boolean isOpen()
    {
        return connection.isOpen();
    }

    @Override
    protected void stop(CloseCode code)
    {
        if (!connection.isOpen())
        {
            return;
        }
        int wsCode = code != null ? code.getCode() : NORMAL_CLOSURE;
        String reason = code != null ? code.getReason() : "";
        LOG.debug("Closing WebSocket for session {} ({})", getSessionId(), wsCode);
        try
        {
            connection.close(wsCode, reason);
        }
        catch (RuntimeException e)
        {
            LOG.debug("Failed to close WebSocket for session {}", getSessionId(), e);
        }
    }

    // ========== Inbound ==========

    @Override
    public void onText(String text)
    {
        Objects.requireNonNull(text, "text");
        whenAttached(() -> handleText(text));
    }

    private void handleText(String text)
    {
        List<String> payloads;
        try
        {
            payloads = FrameCodec.decode(text);
        }
        catch (MalformedPayloadException e)
        {
            LOG.warn("Malformed message on session {}: {}", getSessionId(), e.getMessage());
            release(ReleaseMode.INTERRUPT, CloseCode.INVALID_PAYLOAD);
            return;
        }

        for (String payload : payloads)
        {
            deliver(payload);
        }
    }

    @Override
    public void onBinary(byte[] data)
    {
        LOG.error("Binary messages are not supported (session={})", getSessionId());
    }

    @Override
    public void onPing(byte[] data)
    {
        if (!connection.isOpen())
        {
            return;
        }
        try
        {
            connection.sendPong(data);
        }
        catch (RuntimeException e)
        {
            LOG.debug("Failed to answer ping for session {}", getSessionId(), e);
        }
    }

    @Override
    public void onClose()
    {
        LOG.debug("Peer closed WebSocket for session {}", getSessionId());
        whenAttached(() -> release(ReleaseMode.CLOSE, null));
    }

    @Override
    public void onError(Throwable cause)
    {
        LOG.warn("WebSocket error on session {}: {}", getSessionId(), cause.toString());
        whenAttached(() -> release(ReleaseMode.INTERRUPT, null));
    }
}
