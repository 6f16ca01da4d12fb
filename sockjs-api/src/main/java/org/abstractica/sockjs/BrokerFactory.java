package org.abstractica.sockjs;

import org.abstractica.sockjs.handlers.ErrorHandler;
import org.abstractica.sockjs.handlers.SessionHandlerFactory;

import java.time.Duration;

/**
 * Factory for creating Broker instances.
 *
 * <pre>{@code
 * BrokerFactory factory = new DefaultBrokerFactory();
 * Broker broker = factory.builder()
 *     .handlerFactory(sessionId -> new ChatHandler())
 *     .sessionTimeout(Duration.ofSeconds(10))
 *     .build();
 * }</pre>
 */
public interface BrokerFactory
{
    /**
     * Creates a new broker builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a Broker.
     */
    interface Builder
    {
        /**
         * Sets the factory that creates one handler per session.
         *
         * @param factory the handler factory
         * @return this builder
         */
        Builder handlerFactory(SessionHandlerFactory factory);

        /**
         * Sets the handler for exceptions thrown by session handlers.
         *
         * <p>Optional. Without one, exceptions are logged.</p>
         *
         * @param handler the error handler
         * @return this builder
         */
        Builder errorHandler(ErrorHandler handler);

        /**
         * Sets the interval between heartbeat frames.
         *
         * <p>Optional. Defaults to 25 seconds.</p>
         *
         * @param interval the heartbeat interval
         * @return this builder
         */
        Builder heartbeatInterval(Duration interval);

        /**
         * Sets how long a detached session survives before it is reclaimed.
         *
         * <p>Optional. Defaults to 5 seconds.</p>
         *
         * @param timeout the session timeout
         * @return this builder
         */
        Builder sessionTimeout(Duration timeout);

        /**
         * Sets the number of registry shards.
         *
         * <p>Optional. Defaults to the number of available processors.</p>
         *
         * @param shards shard count
         * @return this builder
         */
        Builder shards(int shards);

        /**
         * Builds the broker.
         *
         * @return the configured broker
         * @throws IllegalStateException if required parameters are missing
         */
        Broker build();
    }
}
