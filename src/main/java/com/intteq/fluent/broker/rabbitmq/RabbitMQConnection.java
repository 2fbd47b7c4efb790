package com.intteq.fluent.broker.rabbitmq;

import com.intteq.fluent.broker.exception.MissingRequiredFieldException;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.ExchangeTypes;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory.CacheMode;

import java.time.Duration;

/**
 * Connection settings of a RabbitMQ broker and the exchange messages are routed through.
 */
@Slf4j
@Getter
@ToString(exclude = "password")
public final class RabbitMQConnection {

    private final String name;
    private final String host;
    private final int port;
    private final String virtualHost;
    private final String username;
    private final String password;
    private final String exchange;
    private final String exchangeType;
    private final boolean durableExchange;
    private final String deadLetterExchange;
    private final boolean persistMessages;
    private final Duration heartbeat;
    private final Duration connectionTimeout;
    private final int channelCacheSize;

    private RabbitMQConnection(Builder builder) {
        this.name = builder.name;
        this.host = builder.host;
        this.port = builder.port;
        this.virtualHost = builder.virtualHost;
        this.username = builder.username;
        this.password = builder.password;
        this.exchange = builder.exchange;
        this.exchangeType = builder.exchangeType;
        this.durableExchange = builder.durableExchange;
        this.deadLetterExchange = builder.deadLetterExchange;
        this.persistMessages = builder.persistMessages;
        this.heartbeat = builder.heartbeat;
        this.connectionTimeout = builder.connectionTimeout;
        this.channelCacheSize = builder.channelCacheSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates an unconnected Spring AMQP connection factory; the broker is contacted on first use.
     */
    public CachingConnectionFactory createConnectionFactory() {
        CachingConnectionFactory factory = new CachingConnectionFactory();

        factory.setHost(host);
        factory.setPort(port);
        factory.setVirtualHost(virtualHost);
        factory.setUsername(username);
        factory.setPassword(password);
        factory.setConnectionNameStrategy(cf -> name);

        factory.setConnectionTimeout((int) connectionTimeout.toMillis());
        factory.setRequestedHeartBeat((int) heartbeat.getSeconds());

        factory.setCacheMode(CacheMode.CHANNEL);
        factory.setChannelCacheSize(channelCacheSize);
        factory.setChannelCheckoutTimeout(10_000);

        // Publisher confirms
        factory.setPublisherConfirmType(CachingConnectionFactory.ConfirmType.CORRELATED);
        factory.setPublisherReturns(true);

        log.info("RabbitMQ ConnectionFactory initialized: host={} port={} vhost={}", host, port, virtualHost);
        return factory;
    }

    public static final class Builder {

        private String name = "fluent-broker";
        private String host = "localhost";
        private int port = 5672;
        private String virtualHost = "/";
        private String username = "guest";
        private String password = "guest";
        private String exchange;
        private String exchangeType = ExchangeTypes.DIRECT;
        private boolean durableExchange = true;
        private String deadLetterExchange;
        private boolean persistMessages = true;
        private Duration heartbeat = Duration.ofSeconds(60);
        private Duration connectionTimeout = Duration.ofSeconds(10);
        private int channelCacheSize = 50;

        private Builder() {
        }

        public Builder setName(String name) {
            this.name = name;
            return this;
        }

        public Builder setHost(String host) {
            this.host = host;
            return this;
        }

        public Builder setPort(int port) {
            this.port = port;
            return this;
        }

        public Builder setVirtualHost(String virtualHost) {
            this.virtualHost = virtualHost;
            return this;
        }

        public Builder setUsername(String username) {
            this.username = username;
            return this;
        }

        public Builder setPassword(String password) {
            this.password = password;
            return this;
        }

        public Builder setExchange(String exchange) {
            this.exchange = exchange;
            return this;
        }

        /** One of the {@link ExchangeTypes} constants. Defaults to {@code direct}. */
        public Builder setExchangeType(String exchangeType) {
            this.exchangeType = exchangeType;
            return this;
        }

        public Builder setDurableExchange(boolean durableExchange) {
            this.durableExchange = durableExchange;
            return this;
        }

        public Builder setDeadLetterExchange(String deadLetterExchange) {
            this.deadLetterExchange = deadLetterExchange;
            return this;
        }

        public Builder setPersistMessages(boolean persistMessages) {
            this.persistMessages = persistMessages;
            return this;
        }

        public Builder setHeartbeat(Duration heartbeat) {
            this.heartbeat = heartbeat;
            return this;
        }

        public Builder setConnectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
            return this;
        }

        public Builder setChannelCacheSize(int channelCacheSize) {
            this.channelCacheSize = channelCacheSize;
            return this;
        }

        public RabbitMQConnection build() {
            if (host == null || host.isBlank()) {
                throw new MissingRequiredFieldException("RabbitMQConnection", "host");
            }
            if (exchange == null || exchange.isBlank()) {
                throw new MissingRequiredFieldException("RabbitMQConnection", "exchange");
            }
            if (exchangeType == null || exchangeType.isBlank()) {
                throw new MissingRequiredFieldException("RabbitMQConnection", "exchangeType");
            }
            return new RabbitMQConnection(this);
        }
    }
}
