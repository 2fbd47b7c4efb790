package com.intteq.fluent.broker.redis;

import com.intteq.fluent.broker.core.Message;
import com.intteq.fluent.broker.core.MessageProducer;
import com.intteq.fluent.broker.core.RetryPolicy;
import com.intteq.fluent.broker.exception.MessagingPublishException;
import com.intteq.fluent.broker.internal.MessageEnvelopeCodec;
import io.lettuce.core.api.sync.RedisCommands;
import lombok.extern.slf4j.Slf4j;

import java.util.HashSet;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Pushes the JSON envelope onto every queue registered for the publication's routing key. With no
 * registered queue the message is dropped, as with any topic nobody listens to.
 */
@Slf4j
public class RedisMessageProducer implements MessageProducer {

    private final RedisPublication publication;
    private final Supplier<RedisCommands<String, String>> commands;
    private final MessageEnvelopeCodec codec;
    private final String topicKey;
    private final RetryPolicy retryPolicy;
    private final Runnable onClose;

    RedisMessageProducer(RedisPublication publication,
                         Supplier<RedisCommands<String, String>> commands,
                         MessageEnvelopeCodec codec,
                         String topicKey,
                         RetryPolicy retryPolicy,
                         Runnable onClose) {
        this.publication = publication;
        this.commands = commands;
        this.codec = codec;
        this.topicKey = topicKey;
        this.retryPolicy = retryPolicy;
        this.onClose = onClose;
    }

    @Override
    public RedisPublication publication() {
        return publication;
    }

    @Override
    public void send(Message message) {
        try {
            String envelope = codec.encode(message);
            // queues already pushed to are skipped on retry
            Set<String> delivered = new HashSet<>();
            retryPolicy.execute("Redis publish " + publication.getRoutingKey(), () -> {
                RedisCommands<String, String> redis = commands.get();
                Set<String> queues = redis.smembers(topicKey);
                if (queues.isEmpty()) {
                    log.debug("No queue subscribed to {}; message {} dropped", topicKey, message.getId());
                    return;
                }
                for (String queue : queues) {
                    if (!delivered.contains(queue)) {
                        redis.lpush(queue, envelope);
                        delivered.add(queue);
                    }
                }
            });

        } catch (RuntimeException ex) {
            log.error("Failed to publish message id={} topic={}", message.getId(), topicKey, ex);
            throw new MessagingPublishException("Failed to publish message " + message.getId(), ex);
        }
    }

    @Override
    public void close() {
        onClose.run();
    }
}
