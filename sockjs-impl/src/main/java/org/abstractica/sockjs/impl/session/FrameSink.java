package org.abstractica.sockjs.impl.session;

import org.abstractica.sockjs.impl.protocol.Frame;

/**
 * Receives the live frame stream of an attached session.
 *
 * <p>Implemented by transports. The registry calls these methods from its
 * own threads, in the order it enqueued the frames; implementations must
 * hand the work to their own mailbox and return without blocking.</p>
 */
public interface FrameSink
{
    /**
     * A frame for the attached session.
     *
     * @param frame the frame
     */
    void onFrame(Frame frame);

    /**
     * The registry has finished its attach-time work. Frames received
     * before this signal must be buffered, not transmitted.
     */
    void onReady();

    /**
     * Returns whether this sink can still take frames. While false, the
     * registry buffers frames in the session record instead.
     *
     * @return true if connected
     */
    boolean isConnected();
}
