package com.intteq.fluent.broker.redis;

import com.intteq.fluent.broker.core.DestinationIdentity;
import com.intteq.fluent.broker.core.MessageProducer;
import com.intteq.fluent.broker.core.MessageProducerFactory;
import com.intteq.fluent.broker.core.PolicyRegistry;
import com.intteq.fluent.broker.internal.MessageEnvelopeCodec;
import io.lettuce.core.RedisClient;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Creates one {@link RedisMessageProducer} per publication, all sharing one lazily opened
 * connection.
 */
@Slf4j
public class RedisMessageProducerFactory implements MessageProducerFactory {

    private final RedisConnection connection;
    private final List<RedisPublication> publications;

    public RedisMessageProducerFactory(RedisConnection connection, List<RedisPublication> publications) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.publications = List.copyOf(publications);
    }

    @Override
    public Map<DestinationIdentity, MessageProducer> create(PolicyRegistry policies) {
        Map<DestinationIdentity, MessageProducer> producers = new LinkedHashMap<>();
        if (publications.isEmpty()) {
            return producers;
        }

        SharedConnection shared = new SharedConnection(connection);
        MessageEnvelopeCodec codec = new MessageEnvelopeCodec();

        for (RedisPublication publication : publications) {
            producers.put(publication.destination(), new RedisMessageProducer(
                    publication,
                    shared::commands,
                    codec,
                    connection.topicKey(publication.getRoutingKey()),
                    policies.getOrDefault(publication.getRetryPolicyName()),
                    shared::close));
            log.info("Redis producer created: topic={}", publication.getRoutingKey());
        }
        return producers;
    }

    /** Lettuce connections are thread-safe, so one is shared by every producer. */
    private static final class SharedConnection {

        private final RedisConnection settings;
        private RedisClient client;
        private StatefulRedisConnection<String, String> redis;

        private SharedConnection(RedisConnection settings) {
            this.settings = settings;
        }

        synchronized RedisCommands<String, String> commands() {
            if (redis == null) {
                RedisClient created = settings.createClient();
                try {
                    redis = created.connect();
                } catch (RuntimeException ex) {
                    created.shutdown();
                    throw ex;
                }
                client = created;
                log.info("Connected to Redis at {}:{}", settings.getHost(), settings.getPort());
            }
            return redis.sync();
        }

        synchronized void close() {
            if (redis == null) {
                return;
            }
            try {
                redis.close();
            } catch (RuntimeException ex) {
                log.warn("Failed to close Redis connection cleanly", ex);
            }
            try {
                client.shutdown(Duration.ofSeconds(1), Duration.ofSeconds(5));
            } catch (RuntimeException ex) {
                log.warn("Failed to shutdown Redis client cleanly", ex);
            }
            redis = null;
            client = null;
        }
    }
}
