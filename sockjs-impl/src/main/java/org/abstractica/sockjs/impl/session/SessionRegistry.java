package org.abstractica.sockjs.impl.session;

import org.abstractica.sockjs.impl.protocol.Frame;

import java.util.concurrent.CompletableFuture;

/**
 * Owner of all session records, and the only writer of session state.
 *
 * <p>Operations on one session are applied one at a time, in the order they
 * were issued. Operations on different sessions run concurrently.</p>
 */
public interface SessionRegistry
{
    /**
     * Attaches a sink to a session, creating the session if needed.
     *
     * <p>On success the future holds the transport's copy of the record. For
     * a terminal session the copy is unbound and the transport is expected
     * to send the close frame and release it. For a live session the sink
     * then receives frames and, once, {@link FrameSink#onReady()}.</p>
     *
     * @param sessionId the session identifier
     * @param sink      the sink for live frames
     * @return the record copy, or a future failed with {@link SessionBusyException}
     *         or {@link RegistryUnavailableException}
     */
    CompletableFuture<SessionRecord> acquire(String sessionId, FrameSink sink);

    /**
     * Ends an attachment and takes back the record copy.
     *
     * <p>Live frames forwarded to the sink beyond
     * {@link SessionRecord#getFramesSeen()} are put back in the buffer,
     * after the copy's own frames and before anything enqueued later.
     * Has no effect if the copy is unbound or its attachment already ended.</p>
     *
     * @param record the copy handed out by {@link #acquire}
     */
    void release(SessionRecord record);

    /**
     * Confirms that a transport has taken live frames from its sink, so the
     * registry no longer needs to keep them for replay.
     *
     * <p>Has no effect if the attachment already ended.</p>
     *
     * @param sessionId  the session identifier
     * @param attachment the attachment of the transport's copy
     * @param framesSeen frames taken since the attachment began
     */
    void acknowledge(String sessionId, long attachment, long framesSeen);

    /**
     * Enqueues a frame to every running session.
     *
     * @param frame the frame
     */
    void broadcast(Frame frame);

    /**
     * Routes an inbound message to the handler of a session.
     *
     * @param sessionId the session identifier
     * @param payload   the decoded message
     */
    void deliver(String sessionId, String payload);
}
