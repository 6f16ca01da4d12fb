package org.abstractica.sockjs.impl.session;

import org.abstractica.sockjs.Broker;
import org.abstractica.sockjs.BrokerFactory;
import org.abstractica.sockjs.handlers.ErrorHandler;
import org.abstractica.sockjs.handlers.SessionHandlerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Default implementation of BrokerFactory.
 *
 * <p>Creates DefaultBroker instances using a builder pattern.</p>
 */
public class DefaultBrokerFactory implements BrokerFactory
{
    @Override
    public Builder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private SessionHandlerFactory handlerFactory;
        private ErrorHandler errorHandler;
        private Duration heartbeatInterval = Duration.ofSeconds(25);
        private Duration sessionTimeout = Duration.ofSeconds(5);
        private int shards = Runtime.getRuntime().availableProcessors();
        private Executor customExecutor; // Optional custom executor for testing

        @Override
        public Builder handlerFactory(SessionHandlerFactory factory)
        {
            this.handlerFactory = Objects.requireNonNull(factory, "factory");
            return this;
        }

        @Override
        public Builder errorHandler(ErrorHandler handler)
        {
            this.errorHandler = handler;
            return this;
        }

        @Override
        public Builder heartbeatInterval(Duration interval)
        {
            Objects.requireNonNull(interval, "interval");
            if (interval.isNegative() || interval.isZero())
            {
                throw new IllegalArgumentException("Heartbeat interval must be positive");
            }
            this.heartbeatInterval = interval;
            return this;
        }

        @Override
        public Builder sessionTimeout(Duration timeout)
        {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isNegative() || timeout.isZero())
            {
                throw new IllegalArgumentException("Session timeout must be positive");
            }
            this.sessionTimeout = timeout;
            return this;
        }

        @Override
        public Builder shards(int shards)
        {
            if (shards <= 0)
            {
                throw new IllegalArgumentException("shards must be positive: " + shards);
            }
            this.shards = shards;
            return this;
        }

        /**
         * Sets a custom executor for testing purposes.
         *
         * <p>If not set, the broker creates its own worker pool.</p>
         *
         * @param executor the executor to run mailboxes on
         * @return this builder
         */
        public DefaultBuilder executor(Executor executor)
        {
            this.customExecutor = executor;
            return this;
        }

        @Override
        public Broker build()
        {
            if (handlerFactory == null)
            {
                throw new IllegalStateException("Handler factory must be specified");
            }

            return new DefaultBroker(
                    handlerFactory,
                    errorHandler,
                    heartbeatInterval,
                    sessionTimeout,
                    shards,
                    customExecutor
            );
        }
    }
}
