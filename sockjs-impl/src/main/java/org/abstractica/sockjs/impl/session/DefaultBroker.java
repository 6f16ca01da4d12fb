package org.abstractica.sockjs.impl.session;

import org.abstractica.sockjs.Broker;
import org.abstractica.sockjs.BrokerStats;
import org.abstractica.sockjs.Session;
import org.abstractica.sockjs.WebSocketConnection;
import org.abstractica.sockjs.WebSocketListener;
import org.abstractica.sockjs.handlers.ErrorHandler;
import org.abstractica.sockjs.handlers.SessionHandlerFactory;
import org.abstractica.sockjs.impl.protocol.Frame;
import org.abstractica.sockjs.impl.transport.WebSocketTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default implementation of the Broker interface.
 *
 * <p>Owns the session registry, the worker threads that run the registry
 * shards and transport mailboxes, and a tick thread that sends heartbeats
 * and reclaims detached sessions.</p>
 */
public class DefaultBroker implements Broker
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultBroker.class);

    private static final long SHUTDOWN_TIMEOUT_MS = 5000;

    private final Duration heartbeatInterval;
    private final Duration sessionTimeout;
    private final Executor executor;
    private final ExecutorService ownedExecutor;
    private final DefaultBrokerStats stats;
    private final DefaultSessionRegistry registry;

    private Thread tickThread;
    private volatile boolean running;

    /**
     * Creates a broker.
     *
     * @param handlerFactory    creates the handler of each new session
     * @param errorHandler      handles session handler exceptions, or null to log them
     * @param heartbeatInterval interval between heartbeats
     * @param sessionTimeout    how long a detached session survives
     * @param shards            number of registry shards
     * @param executor          executor for mailboxes, or null to create a worker pool
     */
    public DefaultBroker(
            SessionHandlerFactory handlerFactory,
            ErrorHandler errorHandler,
            Duration heartbeatInterval,
            Duration sessionTimeout,
            int shards,
            Executor executor
    )
    {
        this.heartbeatInterval = Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        this.sessionTimeout = Objects.requireNonNull(sessionTimeout, "sessionTimeout");

        if (executor != null)
        {
            this.executor = executor;
            this.ownedExecutor = null;
        }
        else
        {
            this.ownedExecutor = Executors.newFixedThreadPool(shards, new WorkerThreadFactory());
            this.executor = ownedExecutor;
        }

        this.stats = new DefaultBrokerStats();
        this.registry = new DefaultSessionRegistry(handlerFactory, errorHandler, this.executor, shards, stats);
        this.running = false;
    }

    // ========== Broker Interface ==========

    @Override
    public void start()
    {
        if (running)
        {
            throw new IllegalStateException("Broker already started");
        }
        if (registry.isClosed())
        {
            throw new IllegalStateException("Broker has been closed");
        }

        running = true;

        tickThread = new Thread(this::tickLoop, "sockjs-tick");
        tickThread.setDaemon(true);
        tickThread.start();

        LOG.info("Broker started (heartbeat={}ms, sessionTimeout={}ms)",
                heartbeatInterval.toMillis(), sessionTimeout.toMillis());
    }

    @Override
    public void close()
    {
        if (!running)
        {
            return;
        }

        LOG.info("Closing broker");
        running = false;

        if (tickThread != null)
        {
            tickThread.interrupt();
        }

        try
        {
            int closed = registry.shutdown().get(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            LOG.info("Closed {} sessions", closed);
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
        catch (ExecutionException | TimeoutException e)
        {
            LOG.warn("Session shutdown did not complete cleanly", e);
        }

        if (ownedExecutor != null)
        {
            ownedExecutor.shutdown();
        }

        LOG.info("Broker closed");
    }

    @Override
    public WebSocketListener openWebSocket(String sessionId, WebSocketConnection connection)
    {
        Objects.requireNonNull(sessionId, "sessionId");
        Objects.requireNonNull(connection, "connection");
        if (!running)
        {
            throw new IllegalStateException("Broker is not running");
        }

        LOG.debug("WebSocket opened for session {}", sessionId);
        WebSocketTransport transport = new WebSocketTransport(sessionId, connection, registry, executor, stats);
        transport.init();
        return transport;
    }

    @Override
    public void broadcast(String message)
    {
        Objects.requireNonNull(message, "message");
        registry.broadcast(new Frame.Message(message));
    }

    @Override
    public Collection<Session> getSessions()
    {
        return registry.getSessions();
    }

    @Override
    public Optional<Session> getSession(String sessionId)
    {
        return registry.findSession(sessionId);
    }

    @Override
    public BrokerStats getStats()
    {
        return stats;
    }

    /**
     * Returns the session registry.
     */
    public DefaultSessionRegistry getRegistry()
    {
        return registry;
    }

    // ========== Tick Loop ==========

    private void tickLoop()
    {
        LOG.debug("Tick loop started");

        long sleepMs = Math.min(heartbeatInterval.toMillis(), sessionTimeout.toMillis());
        long lastHeartbeatMs = System.currentTimeMillis();

        while (running)
        {
            try
            {
                Thread.sleep(sleepMs);

                if (!running)
                {
                    break;
                }

                long nowMs = System.currentTimeMillis();

                if (nowMs - lastHeartbeatMs >= heartbeatInterval.toMillis())
                {
                    registry.heartbeat();
                    lastHeartbeatMs = nowMs;
                }

                registry.expireSessions(nowMs, sessionTimeout)
                        .whenComplete((count, error) ->
                        {
                            if (error != null)
                            {
                                LOG.debug("Session expiry skipped: {}", error.toString());
                            }
                            else if (count > 0)
                            {
                                LOG.debug("Expired {} sessions", count);
                            }
                        });
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
                break;
            }
            catch (Exception e)
            {
                LOG.error("Error in tick loop", e);
            }
        }

        LOG.debug("Tick loop stopped");
    }

    private static final class WorkerThreadFactory implements ThreadFactory
    {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable task)
        {
            Thread thread = new Thread(task, "sockjs-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
