package org.abstractica.sockjs.impl.transport;

import org.abstractica.sockjs.CloseCode;
import org.abstractica.sockjs.impl.concurrent.SerialExecutor;
import org.abstractica.sockjs.impl.protocol.Frame;
import org.abstractica.sockjs.impl.session.AcquireException;
import org.abstractica.sockjs.impl.session.FrameSink;
import org.abstractica.sockjs.impl.session.SessionRecord;
import org.abstractica.sockjs.impl.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Attach/detach handshake shared by every transport.
 *
 * <p>A transport serves one physical connection and binds to one session
 * record at a time. Its life runs through three attach states:</p>
 * <ul>
 *   <li>{@code PENDING}: acquire sent, or record held but the registry has
 *       not signalled ready. Frames go into the record buffer.</li>
 *   <li>{@code READY}: backlog flushed; live frames are written directly.</li>
 *   <li>{@code RELEASED}: the record went back to the registry. Terminal.</li>
 * </ul>
 *
 * <p>All state is touched only from the transport's own mailbox. Every path
 * out of the attachment goes through {@link #release(ReleaseMode, CloseCode)},
 * which hands the record back exactly once.</p>
 */
public abstract class AbstractTransport implements FrameSink
{
    private static final Logger LOG = LoggerFactory.getLogger(AbstractTransport.class);

    private static final int ACK_BATCH = 32;

    /**
     * How the session is left when its record goes back to the registry.
     */
    protected enum ReleaseMode
    {
        /**
         * Connection still usable; detach only, the session keeps running.
         */
        DETACH,

        /**
         * Connection closed cleanly by the peer or the application.
         */
        CLOSE,

        /**
         * Connection dropped or broke the protocol.
         */
        INTERRUPT
    }

    private enum AttachState
    {
        PENDING,
        READY,
        RELEASED
    }

    private final String sessionId;
    private final SessionRegistry registry;
    private final SerialExecutor mailbox;

    // Work that arrived before the acquire round trip resolved
    private final Deque<Frame> earlyFrames;
    private final List<Runnable> deferred;
    private boolean earlyReady;
    private boolean acquired;

    private SessionRecord record;
    private AttachState attachState;
    private boolean releaseRequested;
    private long framesSeen;
    private long framesAcked;
    private boolean stopped;
    private volatile boolean released;

    /**
     * Creates a transport.
     *
     * @param sessionId the session to attach to
     * @param registry  the session registry
     * @param executor  executor for this transport's mailbox
     */
    protected AbstractTransport(String sessionId, SessionRegistry registry, Executor executor)
    {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.mailbox = new SerialExecutor(Objects.requireNonNull(executor, "executor"), "transport-" + sessionId);

        this.earlyFrames = new ArrayDeque<>();
        this.deferred = new ArrayList<>();
        this.attachState = AttachState.PENDING;
    }

    /**
     * Returns the session this transport serves.
     */
    public String getSessionId()
    {
        return sessionId;
    }

    /**
     * Returns whether the record has gone back to the registry.
     */
    public boolean isReleased()
    {
        return released;
    }

    // ========== Transport Contract ==========

    /**
     * Encodes and writes one frame.
     *
     * <p>Writing a {@link Frame.Close} must mark {@code record} closed before
     * the frame is transmitted.</p>
     *
     * @param frame  the frame
     * @param record the attached record
     * @return whether the transport can keep sending
     */
    protected abstract SendResult send(Frame frame, SessionRecord record);

    /**
     * Writes a close frame when no record is attached.
     *
     * @param code the close code
     */
    protected abstract void sendClose(CloseCode code);

    /**
     * Returns whether the physical connection is still open.
     */
    protected abstract boolean isOpen();

    /**
     * Shuts down the physical connection. Called once.
     *
     * @param code the close code to report, or null for a normal closure
     */
    protected abstract void stop(CloseCode code);

    // ========== Handshake ==========

    /**
     * Issues the acquire request. Until it resolves, inbound work passed to
     * {@link #whenAttached(Runnable)} is held back.
     */
    public void init()
    {
        post(() ->
        {
            LOG.debug("Acquiring session {}", sessionId);
            registry.acquire(sessionId, this)
                    .whenComplete((rec, error) -> post(() -> onAcquired(rec, error)));
        });
    }

    @Override
    public void onFrame(Frame frame)
    {
        post(() -> handleFrame(frame));
    }

    @Override
    public void onReady()
    {
        post(this::handleReady);
    }

    @Override
    public boolean isConnected()
    {
        return !released && isOpen();
    }

    private void onAcquired(SessionRecord rec, Throwable error)
    {
        acquired = true;

        if (error != null)
        {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            CloseCode code = cause instanceof AcquireException
                    ? ((AcquireException) cause).getCloseCode()
                    : CloseCode.INTERNAL_ERROR;
            LOG.warn("Acquire of session {} failed: {}", sessionId, cause.getMessage());

            released = true;
            attachState = AttachState.RELEASED;
            deferred.clear();
            earlyFrames.clear();
            sendClose(code);
            stopOnce(null);
            return;
        }

        LOG.debug("Acquired session {} in state {}", sessionId, rec.getState());

        switch (rec.getState())
        {
            case NEW ->
            {
                rec.open();
                if (send(Frame.OPEN, rec) == SendResult.STOP || sendBuffered(rec) == SendResult.STOP)
                {
                    releaseRequested = true;
                }
                record = rec;
            }
            case RUNNING ->
            {
                if (sendBuffered(rec) == SendResult.STOP)
                {
                    releaseRequested = true;
                }
                record = rec;
            }
            case INTERRUPTED ->
            {
                send(new Frame.Close(CloseCode.INTERRUPTED), rec);
                record = rec;
                release(ReleaseMode.DETACH, null);
                return;
            }
            case CLOSED ->
            {
                send(new Frame.Close(CloseCode.GO_AWAY), rec);
                record = rec;
                release(ReleaseMode.DETACH, null);
                return;
            }
        }

        while (!earlyFrames.isEmpty())
        {
            rec.add(earlyFrames.pollFirst());
        }
        if (earlyReady)
        {
            handleReady();
        }

        List<Runnable> work = new ArrayList<>(deferred);
        deferred.clear();
        for (Runnable task : work)
        {
            if (attachState == AttachState.RELEASED)
            {
                break;
            }
            task.run();
        }
    }

    private void handleFrame(Frame frame)
    {
        if (attachState == AttachState.RELEASED)
        {
            // Not counted as seen, so the registry replays it
            LOG.debug("Leaving {} for session {} to the registry", frame.getClass().getSimpleName(), sessionId);
            return;
        }

        framesSeen++;
        if (!acquired)
        {
            earlyFrames.addLast(frame);
            return;
        }
        if (record == null)
        {
            return;
        }

        if (attachState == AttachState.READY)
        {
            if (send(frame, record) == SendResult.STOP)
            {
                release();
            }
        }
        else
        {
            record.add(frame);
        }

        if (record != null && framesSeen - framesAcked >= ACK_BATCH)
        {
            registry.acknowledge(sessionId, record.getAttachment(), framesSeen);
            framesAcked = framesSeen;
        }
    }

    private void handleReady()
    {
        if (!acquired)
        {
            earlyReady = true;
            return;
        }
        if (record == null)
        {
            return;
        }

        if (sendBuffered(record) == SendResult.STOP)
        {
            release();
            return;
        }
        if (releaseRequested)
        {
            release();
        }
        else
        {
            attachState = AttachState.READY;
            LOG.debug("Session {} ready", sessionId);
        }
    }

    /**
     * Writes buffered frames in order. A frame taken from the buffer is
     * never put back, even if writing it fails.
     */
    private SendResult sendBuffered(SessionRecord rec)
    {
        Frame frame;
        while ((frame = rec.poll()) != null)
        {
            if (send(frame, rec) == SendResult.STOP)
            {
                return SendResult.STOP;
            }
        }
        return SendResult.CONTINUE;
    }

    // ========== Inbound ==========

    /**
     * Runs inbound work on the mailbox once the acquire round trip has
     * resolved. Work posted after release is dropped.
     *
     * @param task the work
     */
    protected final void whenAttached(Runnable task)
    {
        post(() ->
        {
            if (attachState == AttachState.RELEASED)
            {
                return;
            }
            if (!acquired)
            {
                deferred.add(task);
                return;
            }
            task.run();
        });
    }

    /**
     * Forwards a decoded client message to the session handler. Must run on
     * the mailbox.
     *
     * @param payload the message
     */
    protected final void deliver(String payload)
    {
        if (record != null)
        {
            registry.deliver(sessionId, payload);
        }
    }

    // ========== Release ==========

    /**
     * Releases the record, classifying the disconnect by the connection's
     * health: detach if still open, interrupted otherwise.
     */
    protected final void release()
    {
        release(isOpen() ? ReleaseMode.DETACH : ReleaseMode.INTERRUPT, null);
    }

    /**
     * Hands the record back to the registry and stops the connection. Only
     * the first call has any effect on the record; must run on the mailbox.
     *
     * @param mode      how to leave the session
     * @param closeCode close code reported when stopping, or null for a normal closure
     */
    protected final void release(ReleaseMode mode, CloseCode closeCode)
    {
        if (record != null)
        {
            SessionRecord rec = record;
            record = null;

            switch (mode)
            {
                case CLOSE -> rec.close();
                case INTERRUPT -> rec.interrupt();
                case DETACH ->
                {
                }
            }

            rec.setFramesSeen(framesSeen);
            LOG.debug("Releasing session {} ({}, {})", sessionId, mode, rec.getState());
            registry.release(rec);
        }

        released = true;
        attachState = AttachState.RELEASED;
        earlyFrames.clear();
        deferred.clear();
        stopOnce(closeCode);
    }

    private void stopOnce(CloseCode closeCode)
    {
        if (stopped)
        {
            return;
        }
        stopped = true;
        stop(closeCode);
    }

    /**
     * Runs a task on this transport's mailbox.
     *
     * @param task the task
     */
    protected final void post(Runnable task)
    {
        try
        {
            mailbox.execute(task);
        }
        catch (RejectedExecutionException e)
        {
            LOG.debug("Transport for session {} is shut down, dropping task", sessionId);
        }
    }
}
