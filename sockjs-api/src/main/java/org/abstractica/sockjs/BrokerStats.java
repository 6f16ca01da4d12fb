package org.abstractica.sockjs;

/**
 * Broker statistics for monitoring.
 *
 * <p>Values are pollable snapshots.</p>
 */
public interface BrokerStats
{
    /**
     * Returns the number of sessions held by the registry, attached or not.
     *
     * @return session count
     */
    int getSessionCount();

    /**
     * Returns the number of sessions that currently have a transport attached.
     *
     * @return attached session count
     */
    int getAttachedCount();

    /**
     * Returns the number of inbound messages delivered to session handlers.
     *
     * @return delivered message count
     */
    long getMessagesDelivered();

    /**
     * Returns the number of frames written to transports.
     *
     * @return frames sent
     */
    long getFramesSent();
}
