package org.abstractica.sockjs.impl.session;

import org.abstractica.sockjs.BrokerStats;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default implementation of BrokerStats.
 *
 * <p>Counters are updated by the registry shards and the transports.</p>
 */
public class DefaultBrokerStats implements BrokerStats
{
    private final AtomicInteger sessions = new AtomicInteger(0);
    private final AtomicInteger attached = new AtomicInteger(0);
    private final AtomicLong messagesDelivered = new AtomicLong(0);
    private final AtomicLong framesSent = new AtomicLong(0);

    @Override
    public int getSessionCount()
    {
        return sessions.get();
    }

    @Override
    public int getAttachedCount()
    {
        return attached.get();
    }

    @Override
    public long getMessagesDelivered()
    {
        return messagesDelivered.get();
    }

    @Override
    public long getFramesSent()
    {
        return framesSent.get();
    }

    // ========== Update Methods ==========

    public void recordSessionCreated()
    {
        sessions.incrementAndGet();
    }

    public void recordSessionRemoved()
    {
        sessions.decrementAndGet();
    }

    public void recordAttached()
    {
        attached.incrementAndGet();
    }

    public void recordDetached()
    {
        attached.decrementAndGet();
    }

    public void recordMessageDelivered()
    {
        messagesDelivered.incrementAndGet();
    }

    public void recordFrameSent()
    {
        framesSent.incrementAndGet();
    }
}
