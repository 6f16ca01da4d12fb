package org.abstractica.sockjs.impl.transport;

import org.abstractica.sockjs.CloseCode;
import org.abstractica.sockjs.Session;
import org.abstractica.sockjs.SessionState;
import org.abstractica.sockjs.impl.protocol.Frame;
import org.abstractica.sockjs.impl.session.DefaultBrokerStats;
import org.abstractica.sockjs.impl.session.DefaultSessionRegistry;
import org.abstractica.sockjs.impl.session.FrameSink;
import org.abstractica.sockjs.impl.session.RecordingHandler;
import org.abstractica.sockjs.impl.session.SessionRecord;
import org.abstractica.sockjs.impl.session.SessionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link WebSocketTransport}.
 */
class WebSocketTransportTest
{
    private Map<String, RecordingHandler> handlers;
    private DefaultBrokerStats stats;
    private DefaultSessionRegistry registry;
    private Executor executor;

    @BeforeEach
    void setUp()
    {
        handlers = new HashMap<>();
        stats = new DefaultBrokerStats();
        executor = Runnable::run;
        registry = newRegistry(executor);
    }

    private DefaultSessionRegistry newRegistry(Executor exec)
    {
        return new DefaultSessionRegistry(
                id -> handlers.computeIfAbsent(id, k -> new RecordingHandler()),
                null,
                exec,
                2,
                stats
        );
    }

    private WebSocketTransport open(String sessionId, RecordingConnection connection)
    {
        WebSocketTransport transport = new WebSocketTransport(sessionId, connection, registry, executor, stats);
        transport.init();
        return transport;
    }

    private Session session(String id)
    {
        return registry.findSession(id).orElseThrow();
    }

    // ========== Attach ==========

    @Test
    void newSession_sendsOpenFrame()
    {
        RecordingConnection connection = new RecordingConnection();

        open("abc123", connection);

        assertEquals(List.of("o"), connection.sent);
        assertEquals(List.of("open"), handlers.get("abc123").events);
        assertEquals(SessionState.RUNNING, session("abc123").getState());
        assertTrue(connection.isOpen());
    }

    @Test
    void busySession_rejectsSecondConnection()
    {
        RecordingConnection first = new RecordingConnection();
        RecordingConnection second = new RecordingConnection();
        open("s1", first);

        WebSocketTransport rejected = open("s1", second);

        assertEquals(List.of("c[2010,\"Another connection still open\"]"), second.sent);
        assertFalse(second.isOpen());
        assertTrue(rejected.isReleased());

        session("s1").send("still here");
        assertEquals(List.of("o", "a[\"still here\"]"), first.sent);
    }

    // ========== Inbound ==========

    @Test
    void inboundArray_deliveredToHandler()
    {
        WebSocketTransport transport = open("s1", new RecordingConnection());

        transport.onText("[\"hello\"]");
        transport.onText("[\"a\",\"b\"]");

        assertEquals(List.of("open", "message:hello", "message:a", "message:b"), handlers.get("s1").events);
    }

    @Test
    void inboundEmptyArray_isIgnored()
    {
        RecordingConnection connection = new RecordingConnection();
        WebSocketTransport transport = open("s1", connection);

        transport.onText("[]");

        assertEquals(List.of("open"), handlers.get("s1").events);
        assertTrue(connection.isOpen());
    }

    @Test
    void malformedInbound_interruptsSessionAndClosesConnection()
    {
        RecordingConnection connection = new RecordingConnection();
        WebSocketTransport transport = open("s1", connection);

        transport.onText("[\"unterminated");

        assertEquals(SessionState.INTERRUPTED, session("s1").getState());
        assertEquals(List.of("open", "close"), handlers.get("s1").events);
        assertFalse(connection.isOpen());
        assertEquals(CloseCode.INVALID_PAYLOAD, CloseCode.fromCode(connection.getCloseCode()));
        assertEquals("Broken JSON encoding", connection.getCloseReason());
        assertTrue(transport.isReleased());
    }

    @Test
    void textAfterRelease_isDropped()
    {
        WebSocketTransport transport = open("s1", new RecordingConnection());
        transport.onText("[\"broken");

        transport.onText("[\"after\"]");

        assertEquals(List.of("open", "close"), handlers.get("s1").events);
    }

    @Test
    void binaryInbound_isIgnored()
    {
        RecordingConnection connection = new RecordingConnection();
        WebSocketTransport transport = open("s1", connection);

        transport.onBinary(new byte[]{1, 2, 3});

        assertEquals(List.of("o"), connection.sent);
        assertEquals(List.of("open"), handlers.get("s1").events);
        assertEquals(SessionState.RUNNING, session("s1").getState());
        assertTrue(connection.isOpen());
    }

    @Test
    void ping_isAnsweredWithPong()
    {
        RecordingConnection connection = new RecordingConnection();
        WebSocketTransport transport = open("s1", connection);
        byte[] data = {9, 8, 7};

        transport.onPing(data);

        assertEquals(1, connection.pongs.size());
        assertArrayEquals(data, connection.pongs.get(0));
    }

    @Test
    void inboundBeforeAttach_isDeliveredAfterOpen()
    {
        ManualExecutor manual = new ManualExecutor();
        executor = manual;
        registry = newRegistry(manual);
        RecordingConnection connection = new RecordingConnection();

        WebSocketTransport transport = open("s1", connection);
        transport.onText("[\"early\"]");
        manual.runAll();

        assertEquals(List.of("open", "message:early"), handlers.get("s1").events);
        assertEquals(List.of("o"), connection.sent);
    }

    @Test
    void liveFrameBeforeReady_waitsForReady()
    {
        StubRegistry stub = new StubRegistry();
        RecordingConnection connection = new RecordingConnection();
        WebSocketTransport transport = new WebSocketTransport("s1", connection, stub, executor, stats);
        transport.init();

        SessionRecord record = new SessionRecord("s1");
        record.add(new Frame.Message("m1"));
        stub.pending.complete(record);
        transport.onFrame(new Frame.Message("live"));

        assertEquals(List.of("o", "a[\"m1\"]"), connection.sent);

        transport.onReady();
        transport.onFrame(new Frame.Message("after"));

        assertEquals(List.of("o", "a[\"m1\"]", "a[\"live\"]", "a[\"after\"]"), connection.sent);

        transport.onClose();

        assertEquals(1, stub.released.size());
        assertEquals(SessionState.CLOSED, stub.released.get(0).getState());
        assertEquals(2, stub.released.get(0).getFramesSeen());
    }

    // ========== Outbound ==========

    @Test
    void applicationMessages_reachClientInOrder()
    {
        RecordingConnection connection = new RecordingConnection();
        open("s1", connection);

        session("s1").send("one");
        session("s1").send("two");

        assertEquals(List.of("o", "a[\"one\"]", "a[\"two\"]"), connection.sent);
        assertEquals(3, stats.getFramesSent());
    }

    @Test
    void heartbeat_reachesEveryAttachedConnection()
    {
        RecordingConnection a = new RecordingConnection();
        RecordingConnection b = new RecordingConnection();
        open("a", a);
        open("b", b);

        registry.heartbeat();

        assertEquals(List.of("o", "h"), a.sent);
        assertEquals(List.of("o", "h"), b.sent);
    }

    @Test
    void broadcastHeartbeat_reachesSessionsAAndB()
    {
        RecordingConnection a = new RecordingConnection();
        RecordingConnection b = new RecordingConnection();
        open("a", a);
        open("b", b);

        registry.broadcast(Frame.HEARTBEAT);

        assertEquals(List.of("o", "h"), a.sent);
        assertEquals(List.of("o", "h"), b.sent);
    }

    @Test
    void applicationClose_sendsGoAwayAndClosesConnection()
    {
        RecordingConnection connection = new RecordingConnection();
        WebSocketTransport transport = open("s1", connection);

        session("s1").close();

        assertEquals(List.of("o", "c[3000,\"Go away!\"]"), connection.sent);
        assertFalse(connection.isOpen());
        assertEquals(1000, connection.getCloseCode());
        assertEquals(SessionState.CLOSED, session("s1").getState());
        assertEquals(1, handlers.get("s1").count("close"));
        assertTrue(transport.isReleased());
    }

    @Test
    void failedBacklogFlush_releasesWithoutRequeue()
    {
        SessionRecord detached = registry.acquire("s1", new NullSink()).join();
        detached.open();
        registry.release(detached);
        session("s1").send("m1");
        session("s1").send("m2");
        session("s1").send("m3");

        RecordingConnection flaky = new RecordingConnection()
        {
            private int writes;

            @Override
            public void sendText(String text)
            {
                if (++writes > 1)
                {
                    throw new UncheckedIOException(new IOException("write failed"));
                }
                super.sendText(text);
            }
        };
        WebSocketTransport transport = open("s1", flaky);

        assertEquals(List.of("a[\"m1\"]"), flaky.sent);
        assertTrue(transport.isReleased());
        assertEquals(SessionState.RUNNING, session("s1").getState());

        SessionRecord next = registry.acquire("s1", new NullSink()).join();
        assertTrue(next.isBufferEmpty());
    }

    @Test
    void reattach_sendsBacklogBeforeLiveFrames()
    {
        ManualExecutor shardThread = new ManualExecutor();
        ManualExecutor transportThread = new ManualExecutor();
        registry = newRegistry(shardThread);
        executor = transportThread;

        CompletableFuture<SessionRecord> detaching = registry.acquire("s1", new NullSink());
        shardThread.runAll();
        SessionRecord detached = detaching.join();
        detached.open();
        registry.release(detached);
        session("s1").send("m1");
        session("s1").send("m2");
        session("s1").send("m3");
        shardThread.runAll();

        RecordingConnection connection = new RecordingConnection();
        open("s1", connection);
        transportThread.runAll();
        shardThread.runAll();

        // Bound on the shard, but the transport has not seen the backlog yet
        session("s1").send("live");
        shardThread.runAll();
        assertTrue(connection.sent.isEmpty());

        transportThread.runAll();

        assertEquals(List.of("a[\"m1\"]", "a[\"m2\"]", "a[\"m3\"]", "a[\"live\"]"), connection.sent);
    }

    @Test
    void failedLiveWrite_laterQueuedFramesAreKeptForNextAttach()
    {
        ManualExecutor manual = new ManualExecutor();
        executor = manual;
        registry = newRegistry(manual);

        RecordingConnection first = new RecordingConnection()
        {
            private int writes;

            @Override
            public void sendText(String text)
            {
                if (++writes > 1)
                {
                    throw new UncheckedIOException(new IOException("write failed"));
                }
                super.sendText(text);
            }
        };
        WebSocketTransport transport = open("s1", first);
        manual.runAll();

        session("s1").send("m1");
        session("s1").send("m2");
        manual.runAll();

        assertEquals(List.of("o"), first.sent);
        assertTrue(transport.isReleased());
        assertEquals(SessionState.RUNNING, session("s1").getState());

        RecordingConnection second = new RecordingConnection();
        open("s1", second);
        manual.runAll();

        assertEquals(List.of("a[\"m2\"]"), second.sent);
        assertTrue(second.isOpen());
    }

    // ========== Disconnect ==========

    @Test
    void droppedConnection_reconnectGetsInterruptedClose()
    {
        RecordingConnection first = new RecordingConnection();
        WebSocketTransport transport = open("s1", first);

        first.drop();
        transport.onError(new IOException("connection reset"));

        assertEquals(SessionState.INTERRUPTED, session("s1").getState());
        assertEquals(1, handlers.get("s1").count("close"));

        RecordingConnection second = new RecordingConnection();
        open("s1", second);

        assertEquals(List.of("c[1002,\"Connection interrupted\"]"), second.sent);
        assertFalse(second.isOpen());
        assertEquals(SessionState.INTERRUPTED, session("s1").getState());
        assertEquals(1, handlers.get("s1").count("close"));
    }

    @Test
    void peerClose_closesSessionAndReconnectGetsGoAway()
    {
        RecordingConnection first = new RecordingConnection();
        WebSocketTransport transport = open("s1", first);

        transport.onClose();

        assertEquals(SessionState.CLOSED, session("s1").getState());
        assertEquals(1, handlers.get("s1").count("close"));

        RecordingConnection second = new RecordingConnection();
        open("s1", second);

        assertEquals(List.of("c[3000,\"Go away!\"]"), second.sent);
        assertFalse(second.isOpen());
    }

    @Test
    void releaseHappensOnce()
    {
        RecordingConnection connection = new RecordingConnection();
        WebSocketTransport transport = open("s1", connection);

        transport.onClose();
        transport.onError(new IOException("late"));
        transport.onClose();

        assertEquals(SessionState.CLOSED, session("s1").getState());
        assertEquals(1, handlers.get("s1").count("close"));
        assertEquals(0, stats.getAttachedCount());
    }

    /**
     * Sink that accepts and discards everything.
     */
    private static final class NullSink implements FrameSink
    {
        @Override
        public void onFrame(Frame frame)
        {
        }

        @Override
        public void onReady()
        {
        }

        @Override
        public boolean isConnected()
        {
            return false;
        }
    }

    /**
     * Registry whose acquire is completed by the test.
     */
    private static final class StubRegistry implements SessionRegistry
    {
        final CompletableFuture<SessionRecord> pending = new CompletableFuture<>();
        final List<SessionRecord> released = new ArrayList<>();

        @Override
        public CompletableFuture<SessionRecord> acquire(String sessionId, FrameSink sink)
        {
            return pending;
        }

        @Override
        public void release(SessionRecord record)
        {
            released.add(record);
        }

        @Override
        public void acknowledge(String sessionId, long attachment, long framesSeen)
        {
        }

        @Override
        public void broadcast(Frame frame)
        {
        }

        @Override
        public void deliver(String sessionId, String payload)
        {
        }
    }

    /**
     * Executor that queues tasks until told to run them.
     */
    private static final class ManualExecutor implements Executor
    {
        private final Deque<Runnable> tasks = new ArrayDeque<>();

        @Override
        public void execute(Runnable task)
        {
            tasks.addLast(task);
        }

        void runAll()
        {
            Runnable task;
            while ((task = tasks.pollFirst()) != null)
            {
                task.run();
            }
        }
    }
}
