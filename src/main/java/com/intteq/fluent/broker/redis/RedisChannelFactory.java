package com.intteq.fluent.broker.redis;

import com.intteq.fluent.broker.core.ChannelFactory;
import com.intteq.fluent.broker.core.OnMissingChannel;
import com.intteq.fluent.broker.core.Subscription;
import com.intteq.fluent.broker.exception.MessagingOperationException;
import com.intteq.fluent.broker.internal.MessageEnvelopeCodec;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;

/**
 * Opens {@link RedisChannel}s. Each channel gets its own connection since {@code BRPOP} blocks it.
 */
@Slf4j
public class RedisChannelFactory implements ChannelFactory, AutoCloseable {

    private final RedisConnection connection;
    private final MessageEnvelopeCodec codec = new MessageEnvelopeCodec();
    private volatile RedisClient client;

    public RedisChannelFactory(RedisConnection connection) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
    }

    public RedisConnection getConnection() {
        return connection;
    }

    @Override
    public RedisChannel createChannel(Subscription subscription) {
        if (!(subscription instanceof RedisSubscription redisSubscription)) {
            throw new IllegalArgumentException("RedisChannelFactory requires a RedisSubscription, got "
                    + subscription.getClass().getName());
        }

        String topicKey = connection.topicKey(redisSubscription.getRoutingKey());
        String queueKey = connection.queueKey(redisSubscription.getQueueName());

        try {
            StatefulRedisConnection<String, String> redis = client().connect();
            RedisCommands<String, String> commands = redis.sync();

            if (redisSubscription.getMakeChannels() == OnMissingChannel.CREATE) {
                commands.sadd(topicKey, queueKey);
            } else if (redisSubscription.getMakeChannels() == OnMissingChannel.VALIDATE
                    && !Boolean.TRUE.equals(commands.sismember(topicKey, queueKey))) {
                redis.close();
                throw new MessagingOperationException("Queue " + queueKey + " is not subscribed to " + topicKey);
            }

            log.info("Redis channel created: queue={} topic={}", queueKey, topicKey);
            return new RedisChannel(redisSubscription, commands, codec, queueKey,
                    connection.queueKey(redisSubscription.getDeadLetterQueueName()), () -> closeQuietly(redis, queueKey));

        } catch (RedisException e) {
            throw new MessagingOperationException("Failed to create Redis channel for queue " + queueKey, e);
        }
    }

    private RedisClient client() {
        RedisClient current = client;
        if (current == null) {
            synchronized (this) {
                current = client;
                if (current == null) {
                    current = connection.createClient();
                    client = current;
                    log.info("Redis client created for {}:{}", connection.getHost(), connection.getPort());
                }
            }
        }
        return current;
    }

    private static void closeQuietly(StatefulRedisConnection<String, String> redis, String queueKey) {
        try {
            redis.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close Redis connection for {}", queueKey, e);
        }
    }

    @Override
    public void close() {
        RedisClient current = client;
        if (current != null) {
            try {
                current.shutdown(Duration.ofSeconds(1), Duration.ofSeconds(5));
            } catch (RuntimeException e) {
                log.warn("Failed to shutdown Redis client cleanly", e);
            }
        }
    }
}
