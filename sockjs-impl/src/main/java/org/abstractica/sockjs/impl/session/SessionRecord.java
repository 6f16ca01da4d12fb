package org.abstractica.sockjs.impl.session;

import org.abstractica.sockjs.SessionState;
import org.abstractica.sockjs.impl.protocol.Frame;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Per-session state: identity, lifecycle state and the buffer of frames not
 * yet delivered to a transport.
 *
 * <p>The registry holds the live record. On acquire it hands the attaching
 * transport a copy that takes over the buffered frames; the transport
 * mutates only that copy and hands it back on release, where the registry
 * merges it into the live record.</p>
 *
 * <p>Terminal states are sticky: once {@link SessionState#INTERRUPTED} or
 * {@link SessionState#CLOSED}, {@link #close()} and {@link #interrupt()}
 * leave the state unchanged.</p>
 */
public final class SessionRecord
{
    private final String sessionId;
    private final long attachment;
    private final Deque<Frame> buffer;
    private volatile SessionState state;
    private long framesSeen;

    /**
     * Creates a new record in state {@link SessionState#NEW}.
     *
     * @param sessionId the session identifier
     */
    public SessionRecord(String sessionId)
    {
        this(sessionId, SessionState.NEW, 0, new ArrayDeque<>());
    }

    private SessionRecord(String sessionId, SessionState state, long attachment, Deque<Frame> buffer)
    {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.state = state;
        this.attachment = attachment;
        this.buffer = buffer;
    }

    /**
     * Returns the session identifier.
     */
    public String getSessionId()
    {
        return sessionId;
    }

    /**
     * Returns the lifecycle state.
     */
    public SessionState getState()
    {
        return state;
    }

    /**
     * Returns the attachment this copy belongs to, or 0 if unbound.
     */
    public long getAttachment()
    {
        return attachment;
    }

    // ========== Lifecycle ==========

    /**
     * Moves a new session to running.
     *
     * @throws IllegalStateException if the session is not new
     */
    public void open()
    {
        if (state != SessionState.NEW)
        {
            throw new IllegalStateException("Session " + sessionId + " cannot open from " + state);
        }
        state = SessionState.RUNNING;
    }

    /**
     * Marks the session closed unless it is already terminal.
     */
    public void close()
    {
        if (!state.isTerminal())
        {
            state = SessionState.CLOSED;
        }
    }

    /**
     * Marks the session interrupted unless it is already terminal.
     */
    public void interrupt()
    {
        if (!state.isTerminal())
        {
            state = SessionState.INTERRUPTED;
        }
    }

    /**
     * Returns how many live frames the transport took from its sink while
     * holding this copy.
     */
    public long getFramesSeen()
    {
        return framesSeen;
    }

    /**
     * Records how many live frames the transport took from its sink. Frames
     * forwarded beyond this count are returned to the buffer on release.
     *
     * @param count frames taken since the attachment began
     */
    public void setFramesSeen(long count)
    {
        if (count < 0)
        {
            throw new IllegalArgumentException("count must be >= 0: " + count);
        }
        this.framesSeen = count;
    }

    // ========== Buffer ==========

    /**
     * Appends a frame to the buffer.
     *
     * @param frame the frame
     */
    public void add(Frame frame)
    {
        buffer.addLast(Objects.requireNonNull(frame, "frame"));
    }

    /**
     * Removes and returns the oldest buffered frame.
     *
     * @return the frame, or null if the buffer is empty
     */
    public Frame poll()
    {
        return buffer.pollFirst();
    }

    /**
     * Returns the number of buffered frames.
     */
    public int bufferSize()
    {
        return buffer.size();
    }

    /**
     * Returns whether the buffer is empty.
     */
    public boolean isBufferEmpty()
    {
        return buffer.isEmpty();
    }

    // ========== Hand-off ==========

    /**
     * Creates the copy handed to an attaching transport.
     *
     * <p>The copy takes over every buffered frame; this record's buffer is
     * left empty.</p>
     *
     * @param attachment the attachment identifier, non-zero
     * @return the transport's copy
     */
    SessionRecord handOff(long attachment)
    {
        if (attachment == 0)
        {
            throw new IllegalArgumentException("attachment must be non-zero");
        }
        Deque<Frame> moved = new ArrayDeque<>(buffer);
        buffer.clear();
        return new SessionRecord(sessionId, state, attachment, moved);
    }

    /**
     * Creates an unbound copy for a terminal session.
     *
     * @return a copy with attachment 0 and an empty buffer
     */
    SessionRecord snapshot()
    {
        return new SessionRecord(sessionId, state, 0, new ArrayDeque<>());
    }

    /**
     * Takes back a copy returned on release.
     *
     * <p>The returned copy's frames go ahead of any frames buffered here
     * while the copy was out. The state only moves forward, and never away
     * from a terminal state.</p>
     *
     * @param returned the copy returned by the transport
     */
    void merge(SessionRecord returned)
    {
        if (!sessionId.equals(returned.sessionId))
        {
            throw new IllegalArgumentException(
                    "Cannot merge session " + returned.sessionId + " into " + sessionId);
        }

        Deque<Frame> merged = new ArrayDeque<>(returned.buffer.size() + buffer.size());
        merged.addAll(returned.buffer);
        merged.addAll(buffer);
        buffer.clear();
        buffer.addAll(merged);

        if (!state.isTerminal() && returned.state.ordinal() > state.ordinal())
        {
            state = returned.state;
        }
    }

    @Override
    public String toString()
    {
        return "SessionRecord[" + sessionId + ", " + state + ", buffered=" + buffer.size() + "]";
    }
}
