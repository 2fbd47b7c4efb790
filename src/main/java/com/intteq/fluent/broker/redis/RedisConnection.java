package com.intteq.fluent.broker.redis;

import com.intteq.fluent.broker.exception.MissingRequiredFieldException;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Redis server settings. Keys written by the transport are prefixed with {@link #getKeyPrefix()}.
 */
@Getter
@ToString(exclude = "password")
public final class RedisConnection {

    private final String host;
    private final int port;
    private final int database;
    private final String password;
    private final Duration timeout;
    private final String keyPrefix;

    private RedisConnection(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.database = builder.database;
        this.password = builder.password;
        this.timeout = builder.timeout;
        this.keyPrefix = builder.keyPrefix;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasPassword() {
        return password != null && !password.isBlank();
    }

    public RedisURI toRedisUri() {
        RedisURI.Builder builder = RedisURI.builder()
                .withHost(host)
                .withPort(port)
                .withDatabase(database)
                .withTimeout(timeout);

        if (hasPassword()) {
            builder.withPassword(password.toCharArray());
        }

        return builder.build();
    }

    /** Creates a client; no connection is opened until {@code connect()} is called on it. */
    public RedisClient createClient() {
        return RedisClient.create(toRedisUri());
    }

    /** Key of the set holding the queue names subscribed to {@code routingKey}. */
    public String topicKey(String routingKey) {
        return keyPrefix + "topic:" + routingKey;
    }

    public String queueKey(String queueName) {
        return keyPrefix + queueName;
    }

    public static final class Builder {

        private String host = "localhost";
        private int port = 6379;
        private int database;
        private String password;
        private Duration timeout = Duration.ofSeconds(5);
        private String keyPrefix = "";

        private Builder() {
        }

        public Builder setHost(String host) {
            this.host = host;
            return this;
        }

        public Builder setPort(int port) {
            this.port = port;
            return this;
        }

        public Builder setDatabase(int database) {
            this.database = database;
            return this;
        }

        public Builder setPassword(String password) {
            this.password = password;
            return this;
        }

        public Builder setTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
            return this;
        }

        public RedisConnection build() {
            if (host == null || host.isBlank()) {
                throw new MissingRequiredFieldException("RedisConnection", "host");
            }
            if (timeout == null) {
                throw new MissingRequiredFieldException("RedisConnection", "timeout");
            }
            return new RedisConnection(this);
        }
    }
}
