package org.abstractica.sockjs.impl.session;

import org.abstractica.sockjs.CloseCode;
import org.abstractica.sockjs.Session;
import org.abstractica.sockjs.SessionState;
import org.abstractica.sockjs.handlers.ErrorHandler;
import org.abstractica.sockjs.handlers.SessionHandler;
import org.abstractica.sockjs.handlers.SessionHandlerFactory;
import org.abstractica.sockjs.impl.concurrent.SerialExecutor;
import org.abstractica.sockjs.impl.protocol.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Default implementation of the SessionRegistry.
 *
 * <p>Sessions are spread over a fixed number of shards by identifier. Each
 * shard owns its records and runs every operation on them through its own
 * {@link SerialExecutor}, so one session's operations are applied strictly
 * one at a time while different shards run in parallel. Nothing outside a
 * shard's mailbox touches its records.</p>
 */
public class DefaultSessionRegistry implements SessionRegistry
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultSessionRegistry.class);

    private final SessionHandlerFactory handlerFactory;
    private final ErrorHandler errorHandler;
    private final DefaultBrokerStats stats;
    private final Shard[] shards;
    private final Map<String, DefaultSession> sessions;

    private volatile boolean closed;

    /**
     * Creates a registry.
     *
     * @param handlerFactory creates the handler of each new session
     * @param errorHandler   handles session handler exceptions, or null to log them
     * @param executor       runs the shard mailboxes
     * @param shardCount     number of shards
     * @param stats          counters to update
     */
    public DefaultSessionRegistry(
            SessionHandlerFactory handlerFactory,
            ErrorHandler errorHandler,
            Executor executor,
            int shardCount,
            DefaultBrokerStats stats
    )
    {
        Objects.requireNonNull(executor, "executor");
        if (shardCount <= 0)
        {
            throw new IllegalArgumentException("shardCount must be positive: " + shardCount);
        }

        this.handlerFactory = Objects.requireNonNull(handlerFactory, "handlerFactory");
        this.errorHandler = errorHandler;
        this.stats = Objects.requireNonNull(stats, "stats");
        this.sessions = new ConcurrentHashMap<>();
        this.shards = new Shard[shardCount];
        for (int i = 0; i < shardCount; i++)
        {
            shards[i] = new Shard(new SerialExecutor(executor, "registry-" + i));
        }
        this.closed = false;
    }

    // ========== Registry Contract ==========

    @Override
    public CompletableFuture<SessionRecord> acquire(String sessionId, FrameSink sink)
    {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(sink, "sink");

        CompletableFuture<SessionRecord> result = new CompletableFuture<>();
        Shard shard = shardFor(sessionId);
        if (!submit(shard, () -> doAcquire(shard, sessionId, sink, result)))
        {
            result.completeExceptionally(new RegistryUnavailableException());
        }
        return result;
    }

    @Override
    public void release(SessionRecord record)
    {
        Objects.requireNonNull(record, "record");

        Shard shard = shardFor(record.getSessionId());
        if (!submit(shard, () -> doRelease(shard, record)))
        {
            LOG.debug("Registry unavailable, dropping release of session {}", record.getSessionId());
        }
    }

    @Override
    public void acknowledge(String sessionId, long attachment, long framesSeen)
    {
        Objects.requireNonNull(sessionId, "sessionId");

        Shard shard = shardFor(sessionId);
        if (!submit(shard, () -> doAcknowledge(shard, sessionId, attachment, framesSeen)))
        {
            LOG.debug("Registry unavailable, dropping acknowledgement for session {}", sessionId);
        }
    }

    @Override
    public void broadcast(Frame frame)
    {
        Objects.requireNonNull(frame, "frame");

        for (Shard shard : shards)
        {
            if (!submit(shard, () -> doBroadcast(shard, frame)))
            {
                LOG.warn("Registry unavailable, dropping broadcast of {}", frame.getClass().getSimpleName());
                return;
            }
        }
    }

    @Override
    public void deliver(String sessionId, String payload)
    {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(payload, "payload");

        Shard shard = shardFor(sessionId);
        if (!submit(shard, () -> doDeliver(shard, sessionId, payload)))
        {
            LOG.debug("Registry unavailable, dropping message for session {}", sessionId);
        }
    }

    // ========== Session Operations ==========

    /**
     * Enqueues a frame for one running session: forwarded to the attached
     * sink, or buffered while detached.
     *
     * @param sessionId the session identifier
     * @param frame     the frame
     */
    void send(String sessionId, Frame frame)
    {
        Shard shard = shardFor(sessionId);
        if (!submit(shard, () -> doSend(shard, sessionId, frame)))
        {
            LOG.debug("Registry unavailable, dropping frame for session {}", sessionId);
        }
    }

    /**
     * Closes a session on behalf of the application.
     *
     * @param sessionId the session identifier
     * @param code      the close code sent to an attached transport
     */
    void close(String sessionId, CloseCode code)
    {
        Shard shard = shardFor(sessionId);
        if (!submit(shard, () -> doClose(shard, sessionId, code)))
        {
            LOG.debug("Registry unavailable, ignoring close of session {}", sessionId);
        }
    }

    /**
     * Sends a heartbeat to every attached session. Detached sessions do not
     * buffer heartbeats.
     */
    public void heartbeat()
    {
        for (Shard shard : shards)
        {
            if (!submit(shard, () -> doHeartbeat(shard)))
            {
                return;
            }
        }
    }

    /**
     * Removes detached sessions idle for longer than the timeout.
     *
     * <p>A running session removed this way is closed and its handler
     * notified.</p>
     *
     * @param nowMs   current time in milliseconds
     * @param timeout how long a detached session may stay idle
     * @return future holding the number of sessions removed
     */
    public CompletableFuture<Integer> expireSessions(long nowMs, Duration timeout)
    {
        Objects.requireNonNull(timeout, "timeout");
        long timeoutMs = timeout.toMillis();

        List<CompletableFuture<Integer>> parts = new ArrayList<>(shards.length);
        for (Shard shard : shards)
        {
            parts.add(callOn(shard, () -> doExpire(shard, nowMs, timeoutMs)));
        }
        return sum(parts);
    }

    /**
     * Closes every live session and rejects further requests.
     *
     * <p>Acquire requests issued afterwards fail with
     * {@link RegistryUnavailableException}.</p>
     *
     * @return future holding the number of sessions closed
     */
    public CompletableFuture<Integer> shutdown()
    {
        closed = true;
        LOG.info("Session registry shutting down");

        List<CompletableFuture<Integer>> parts = new ArrayList<>(shards.length);
        for (Shard shard : shards)
        {
            parts.add(callOn(shard, () -> doCloseAll(shard)));
        }
        return sum(parts);
    }

    /**
     * Returns whether the registry has been shut down.
     */
    public boolean isClosed()
    {
        return closed;
    }

    // ========== Lookup ==========

    /**
     * Returns all sessions.
     *
     * @return unmodifiable view of the sessions
     */
    public Collection<Session> getSessions()
    {
        return Collections.unmodifiableCollection(sessions.values());
    }

    /**
     * Finds a session by identifier.
     *
     * @param sessionId the session identifier
     * @return the session, or empty if unknown
     */
    public Optional<Session> findSession(String sessionId)
    {
        Objects.requireNonNull(sessionId, "sessionId");
        return Optional.ofNullable(sessions.get(sessionId));
    }

    // ========== Shard Tasks ==========

    private void doAcquire(Shard shard, String sessionId, FrameSink sink, CompletableFuture<SessionRecord> result)
    {
        SessionEntry found = shard.entries.get(sessionId);
        if (found == null)
        {
            try
            {
                found = createEntry(shard, sessionId);
            }
            catch (RuntimeException e)
            {
                LOG.error("Failed to create session {}", sessionId, e);
                result.completeExceptionally(e);
                return;
            }
        }
        SessionEntry entry = found;

        if (entry.sink != null)
        {
            LOG.debug("Session {} is busy, rejecting acquire", sessionId);
            result.completeExceptionally(new SessionBusyException(sessionId));
            return;
        }

        SessionRecord live = entry.record;
        if (live.getState().isTerminal())
        {
            LOG.debug("Session {} is {}, handing out terminal record", sessionId, live.getState());
            entry.touch();
            result.complete(live.snapshot());
            return;
        }

        boolean opening = live.getState() == SessionState.NEW;
        long attachment = shard.nextAttachment++;
        SessionRecord handed = live.handOff(attachment);
        if (opening)
        {
            live.open();
        }
        entry.sink = sink;
        entry.attachment = attachment;
        entry.forwarded.clear();
        entry.acked = 0;
        entry.touch();
        stats.recordAttached();

        LOG.debug("Session {} attached (attachment={}, buffered={})",
                sessionId, attachment, handed.bufferSize());

        result.complete(handed);

        if (opening)
        {
            invoke(entry, null, handler -> handler.onOpen(entry.session));
        }
        sink.onReady();
    }

    private void doRelease(Shard shard, SessionRecord record)
    {
        String sessionId = record.getSessionId();
        SessionEntry entry = shard.entries.get(sessionId);
        if (entry == null || record.getAttachment() == 0 || entry.attachment != record.getAttachment())
        {
            LOG.debug("Ignoring release of unbound session {}", sessionId);
            return;
        }

        trimForwarded(entry, record.getFramesSeen());
        int replayed = 0;
        for (Frame frame : entry.forwarded)
        {
            // The live record already reflects a forwarded close
            if (!(frame instanceof Frame.Heartbeat) && !(frame instanceof Frame.Close))
            {
                record.add(frame);
                replayed++;
            }
        }
        if (replayed > 0)
        {
            LOG.debug("Session {}: {} forwarded frames were not taken, keeping them for replay",
                    sessionId, replayed);
        }

        boolean wasTerminal = entry.record.getState().isTerminal();
        entry.record.merge(record);
        entry.sink = null;
        entry.attachment = 0;
        entry.forwarded.clear();
        entry.acked = 0;
        entry.touch();
        stats.recordDetached();

        LOG.debug("Session {} released ({}, buffered={})",
                sessionId, entry.record.getState(), entry.record.bufferSize());

        if (!wasTerminal && entry.record.getState().isTerminal())
        {
            LOG.info("Session {} ended: {}", sessionId, entry.record.getState());
            notifyClosed(entry);
        }
    }

    private void doAcknowledge(Shard shard, String sessionId, long attachment, long framesSeen)
    {
        SessionEntry entry = shard.entries.get(sessionId);
        if (entry == null || attachment == 0 || entry.attachment != attachment)
        {
            return;
        }
        trimForwarded(entry, framesSeen);
    }

    private void doBroadcast(Shard shard, Frame frame)
    {
        for (SessionEntry entry : shard.entries.values())
        {
            if (entry.record.getState() == SessionState.RUNNING)
            {
                enqueue(entry, frame);
            }
        }
    }

    private void doDeliver(Shard shard, String sessionId, String payload)
    {
        SessionEntry entry = shard.entries.get(sessionId);
        if (entry == null)
        {
            LOG.debug("Dropping message for unknown session {}", sessionId);
            return;
        }
        if (entry.record.getState().isTerminal())
        {
            LOG.debug("Dropping message for {} session {}", entry.record.getState(), sessionId);
            return;
        }

        entry.touch();
        stats.recordMessageDelivered();
        invoke(entry, payload, handler -> handler.onMessage(entry.session, payload));
    }

    private void doSend(Shard shard, String sessionId, Frame frame)
    {
        SessionEntry entry = shard.entries.get(sessionId);
        if (entry == null || entry.record.getState() != SessionState.RUNNING)
        {
            LOG.debug("Dropping frame for session {} that is not running", sessionId);
            return;
        }
        enqueue(entry, frame);
    }

    private void doClose(Shard shard, String sessionId, CloseCode code)
    {
        SessionEntry entry = shard.entries.get(sessionId);
        if (entry == null)
        {
            LOG.debug("Ignoring close of unknown session {}", sessionId);
            return;
        }
        closeEntry(entry, code);
    }

    private void doHeartbeat(Shard shard)
    {
        for (SessionEntry entry : shard.entries.values())
        {
            if (entry.sink != null
                    && entry.sink.isConnected()
                    && !entry.record.getState().isTerminal())
            {
                forward(entry, Frame.HEARTBEAT);
            }
        }
    }

    private int doExpire(Shard shard, long nowMs, long timeoutMs)
    {
        int count = 0;
        Iterator<SessionEntry> it = shard.entries.values().iterator();
        while (it.hasNext())
        {
            SessionEntry entry = it.next();
            if (entry.sink != null || nowMs - entry.lastActivityMs <= timeoutMs)
            {
                continue;
            }

            it.remove();
            sessions.remove(entry.session.getId());
            stats.recordSessionRemoved();
            count++;

            boolean wasLive = !entry.record.getState().isTerminal();
            entry.record.close();
            LOG.info("Session {} expired", entry.session.getId());
            if (wasLive)
            {
                notifyClosed(entry);
            }
        }
        return count;
    }

    private int doCloseAll(Shard shard)
    {
        int count = 0;
        for (SessionEntry entry : shard.entries.values())
        {
            if (closeEntry(entry, CloseCode.GO_AWAY))
            {
                count++;
            }
        }
        return count;
    }

    // ========== Internal ==========

    private SessionEntry createEntry(Shard shard, String sessionId)
    {
        SessionHandler handler = Objects.requireNonNull(
                handlerFactory.create(sessionId), "handlerFactory returned null");

        SessionRecord record = new SessionRecord(sessionId);
        DefaultSession session = new DefaultSession(record, this);
        SessionEntry entry = new SessionEntry(record, handler, session);

        shard.entries.put(sessionId, entry);
        sessions.put(sessionId, session);
        stats.recordSessionCreated();

        LOG.info("Session created: id={}", sessionId);
        return entry;
    }

    private boolean closeEntry(SessionEntry entry, CloseCode code)
    {
        if (entry.record.getState().isTerminal())
        {
            return false;
        }

        entry.record.close();
        LOG.info("Session {} closed: {} {}", entry.session.getId(), code.getCode(), code.getReason());

        if (entry.sink != null && entry.sink.isConnected())
        {
            forward(entry, new Frame.Close(code));
        }
        notifyClosed(entry);
        return true;
    }

    private void enqueue(SessionEntry entry, Frame frame)
    {
        if (entry.sink != null && entry.sink.isConnected())
        {
            forward(entry, frame);
        }
        else
        {
            entry.record.add(frame);
        }
    }

    /**
     * Hands a frame to the attached sink, keeping it until the transport
     * confirms it took it.
     */
    private void forward(SessionEntry entry, Frame frame)
    {
        entry.forwarded.addLast(frame);
        entry.sink.onFrame(frame);
    }

    private void trimForwarded(SessionEntry entry, long framesSeen)
    {
        while (entry.acked < framesSeen && entry.forwarded.pollFirst() != null)
        {
            entry.acked++;
        }
    }

    private void notifyClosed(SessionEntry entry)
    {
        invoke(entry, null, handler -> handler.onClose(entry.session));
    }

    private void invoke(SessionEntry entry, String message, Consumer<SessionHandler> call)
    {
        try
        {
            call.accept(entry.handler);
        }
        catch (Exception e)
        {
            if (errorHandler != null)
            {
                try
                {
                    errorHandler.handle(entry.session, message, e);
                }
                catch (Exception e2)
                {
                    LOG.error("Error handler threw exception", e2);
                }
            }
            else
            {
                LOG.error("Session handler exception: session={}", entry.session.getId(), e);
            }
        }
    }

    private Shard shardFor(String sessionId)
    {
        return shards[Math.floorMod(sessionId.hashCode(), shards.length)];
    }

    private boolean submit(Shard shard, Runnable task)
    {
        if (closed)
        {
            return false;
        }
        try
        {
            shard.mailbox.execute(task);
            return true;
        }
        catch (RejectedExecutionException e)
        {
            return false;
        }
    }

    private <T> CompletableFuture<T> callOn(Shard shard, Supplier<T> task)
    {
        CompletableFuture<T> result = new CompletableFuture<>();
        try
        {
            shard.mailbox.execute(() ->
            {
                try
                {
                    result.complete(task.get());
                }
                catch (RuntimeException e)
                {
                    result.completeExceptionally(e);
                }
            });
        }
        catch (RejectedExecutionException e)
        {
            result.completeExceptionally(new RegistryUnavailableException());
        }
        return result;
    }

    private static CompletableFuture<Integer> sum(List<CompletableFuture<Integer>> parts)
    {
        return CompletableFuture.allOf(parts.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> parts.stream().mapToInt(CompletableFuture::join).sum());
    }

    /**
     * One slice of the registry. Only touched from its mailbox.
     */
    private static final class Shard
    {
        private final SerialExecutor mailbox;
        private final Map<String, SessionEntry> entries;
        private long nextAttachment;

        private Shard(SerialExecutor mailbox)
        {
            this.mailbox = mailbox;
            this.entries = new HashMap<>();
            this.nextAttachment = 1;
        }
    }

    /**
     * The registry-held side of a session: the live record, the handler it
     * owns, and the sink currently attached.
     */
    private static final class SessionEntry
    {
        private final SessionRecord record;
        private final SessionHandler handler;
        private final DefaultSession session;
        private final Deque<Frame> forwarded;
        private FrameSink sink;
        private long attachment;
        private long acked;
        private long lastActivityMs;

        private SessionEntry(SessionRecord record, SessionHandler handler, DefaultSession session)
        {
            this.record = record;
            this.handler = handler;
            this.session = session;
            this.forwarded = new ArrayDeque<>();
            this.lastActivityMs = System.currentTimeMillis();
        }

        private void touch()
        {
            lastActivityMs = System.currentTimeMillis();
        }
    }
}
