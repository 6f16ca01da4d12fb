package org.abstractica.sockjs.impl.session;

import org.abstractica.sockjs.Broker;
import org.abstractica.sockjs.Session;
import org.abstractica.sockjs.SessionState;
import org.abstractica.sockjs.WebSocketListener;
import org.abstractica.sockjs.handlers.SessionHandler;
import org.abstractica.sockjs.impl.transport.RecordingConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests running the broker on real worker threads.
 */
class BrokerEndToEndTest
{
    private Broker broker;
    private CountDownLatch closed;

    @BeforeEach
    void setUp()
    {
        closed = new CountDownLatch(1);

        broker = new DefaultBrokerFactory().builder()
                .handlerFactory(id -> new EchoHandler())
                .heartbeatInterval(Duration.ofMillis(100))
                .sessionTimeout(Duration.ofMillis(300))
                .shards(2)
                .build();
        broker.start();
    }

    @AfterEach
    void tearDown()
    {
        broker.close();
    }

    private static void await(BooleanSupplier condition, String message) throws InterruptedException
    {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean())
        {
            if (System.currentTimeMillis() > deadline)
            {
                fail(message);
            }
            Thread.sleep(10);
        }
    }

    @Test
    void echo_roundTrip() throws Exception
    {
        RecordingConnection connection = new RecordingConnection();
        WebSocketListener listener = broker.openWebSocket("echo", connection);

        await(() -> connection.sent.contains("o"), "Client should receive open frame");

        listener.onText("[\"ping\"]");

        await(() -> connection.sent.contains("a[\"ping\"]"), "Client should receive echo");
        assertEquals("o", connection.sent.get(0));
    }

    @Test
    void heartbeat_sentWhileAttached() throws Exception
    {
        RecordingConnection connection = new RecordingConnection();
        broker.openWebSocket("hb", connection);

        await(() -> connection.sent.contains("h"), "Client should receive heartbeat");
        assertEquals("o", connection.sent.get(0));
    }

    @Test
    void broadcast_reachesAllSessions() throws Exception
    {
        RecordingConnection a = new RecordingConnection();
        RecordingConnection b = new RecordingConnection();
        broker.openWebSocket("a", a);
        broker.openWebSocket("b", b);
        await(() -> a.sent.contains("o") && b.sent.contains("o"), "Both clients should open");

        broker.broadcast("news");

        await(() -> a.sent.contains("a[\"news\"]"), "First client should receive broadcast");
        await(() -> b.sent.contains("a[\"news\"]"), "Second client should receive broadcast");
    }

    @Test
    void closedSession_expiresAfterTimeout() throws Exception
    {
        RecordingConnection connection = new RecordingConnection();
        WebSocketListener listener = broker.openWebSocket("gone", connection);
        await(() -> connection.sent.contains("o"), "Client should open");

        listener.onClose();

        assertTrue(closed.await(5, TimeUnit.SECONDS), "Handler should see close");
        await(() -> broker.getSession("gone").isEmpty(), "Session should be reclaimed");
        assertEquals(0, broker.getStats().getSessionCount());
    }

    @Test
    void close_sendsGoAwayToAttachedClients() throws Exception
    {
        RecordingConnection connection = new RecordingConnection();
        broker.openWebSocket("s1", connection);
        await(() -> connection.sent.contains("o"), "Client should open");

        broker.close();

        await(() -> !connection.isOpen(), "Connection should be closed");
        assertTrue(connection.sent.contains("c[3000,\"Go away!\"]"));
        assertThrows(IllegalStateException.class,
                () -> broker.openWebSocket("s2", new RecordingConnection()));
    }

    @Test
    void concurrentSessions_eachSeeTheirOwnMessagesInOrder() throws Exception
    {
        int sessions = 8;
        int messages = 50;
        ExecutorService clients = Executors.newFixedThreadPool(sessions);
        try
        {
            RecordingConnection[] connections = new RecordingConnection[sessions];
            WebSocketListener[] listeners = new WebSocketListener[sessions];
            for (int i = 0; i < sessions; i++)
            {
                connections[i] = new RecordingConnection();
                listeners[i] = broker.openWebSocket("c" + i, connections[i]);
            }

            for (int i = 0; i < sessions; i++)
            {
                WebSocketListener listener = listeners[i];
                int n = i;
                clients.execute(() ->
                {
                    for (int m = 0; m < messages; m++)
                    {
                        listener.onText("[\"" + n + "-" + m + "\"]");
                    }
                });
            }

            for (int i = 0; i < sessions; i++)
            {
                RecordingConnection connection = connections[i];
                await(() -> connection.sent.stream().filter(text -> text.startsWith("a")).count() >= messages,
                        "Every echo should arrive");
            }

            for (int i = 0; i < sessions; i++)
            {
                List<String> echoes = connections[i].sent.stream()
                        .filter(text -> text.startsWith("a"))
                        .toList();
                assertEquals(messages, echoes.size());
                for (int m = 0; m < messages; m++)
                {
                    assertEquals("a[\"" + i + "-" + m + "\"]", echoes.get(m));
                }
            }
        }
        finally
        {
            clients.shutdownNow();
        }
    }

    @Test
    void sessionState_visibleThroughBroker() throws Exception
    {
        RecordingConnection connection = new RecordingConnection();
        broker.openWebSocket("visible", connection);
        await(() -> connection.sent.contains("o"), "Client should open");

        Session session = broker.getSession("visible").orElseThrow();
        assertEquals(SessionState.RUNNING, session.getState());
        assertEquals(1, broker.getSessions().size());
        assertEquals(1, broker.getStats().getAttachedCount());
    }

    /**
     * Echoes every message back to its session.
     */
    private class EchoHandler implements SessionHandler
    {
        @Override
        public void onMessage(Session session, String message)
        {
            session.send(message);
        }

        @Override
        public void onClose(Session session)
        {
            closed.countDown();
        }
    }
}
