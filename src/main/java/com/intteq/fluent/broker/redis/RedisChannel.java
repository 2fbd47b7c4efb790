package com.intteq.fluent.broker.redis;

import com.intteq.fluent.broker.core.Channel;
import com.intteq.fluent.broker.core.Message;
import com.intteq.fluent.broker.exception.MessagingOperationException;
import com.intteq.fluent.broker.internal.MessageEnvelopeCodec;
import io.lettuce.core.KeyValue;
import io.lettuce.core.RedisException;
import io.lettuce.core.api.sync.RedisCommands;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Consumes one Redis list with {@code BRPOP}. A popped message is already off the queue, so
 * acknowledging only forgets it; reject moves it to the dead letter list and requeue pushes it
 * back. A payload that cannot be decoded goes straight to the dead letter list.
 */
@Slf4j
public class RedisChannel implements Channel {

    private final RedisSubscription subscription;
    private final RedisCommands<String, String> commands;
    private final MessageEnvelopeCodec codec;
    private final String queueKey;
    private final String deadLetterKey;
    private final Runnable onClose;

    /** Raw envelopes of received, unsettled messages keyed by message id. */
    private final Map<String, String> pending = new HashMap<>();

    RedisChannel(RedisSubscription subscription,
                 RedisCommands<String, String> commands,
                 MessageEnvelopeCodec codec,
                 String queueKey,
                 String deadLetterKey,
                 Runnable onClose) {
        this.subscription = subscription;
        this.commands = commands;
        this.codec = codec;
        this.queueKey = queueKey;
        this.deadLetterKey = deadLetterKey;
        this.onClose = onClose;
    }

    @Override
    public RedisSubscription subscription() {
        return subscription;
    }

    @Override
    public Optional<Message> receive(Duration timeout) {
        // BRPOP 0 blocks forever
        double seconds = Math.max(0.01, timeout.toMillis() / 1000.0);
        try {
            KeyValue<String, String> popped = commands.brpop(seconds, queueKey);
            if (popped == null || !popped.hasValue()) {
                return Optional.empty();
            }
            String raw = popped.getValue();
            Message message;
            try {
                message = codec.decode(raw);
            } catch (MessagingOperationException e) {
                commands.lpush(deadLetterKey, raw);
                log.error("Undecodable message on {} → moved to {}", queueKey, deadLetterKey, e);
                return Optional.empty();
            }
            pending.put(message.getId(), raw);
            return Optional.of(message);

        } catch (RedisException e) {
            throw new MessagingOperationException("Failed to receive from Redis queue " + queueKey, e);
        }
    }

    @Override
    public void acknowledge(Message message) {
        if (pending.remove(message.getId()) == null) {
            log.warn("Cannot acknowledge message {} on {}: no pending delivery", message.getId(), queueKey);
            return;
        }
        log.debug("Acknowledged message {} on {}", message.getId(), queueKey);
    }

    @Override
    public void reject(Message message) {
        String raw = pending.remove(message.getId());
        if (raw == null) {
            log.warn("Cannot reject message {} on {}: no pending delivery", message.getId(), queueKey);
            return;
        }
        push(deadLetterKey, raw, "reject", message);
        log.warn("Message {} rejected → moved to {}", message.getId(), deadLetterKey);
    }

    @Override
    public void requeue(Message message) {
        String raw = pending.remove(message.getId());
        if (raw == null) {
            log.warn("Cannot requeue message {} on {}: no pending delivery", message.getId(), queueKey);
            return;
        }
        push(queueKey, raw, "requeue", message);
        log.debug("Requeued message {} on {}", message.getId(), queueKey);
    }

    @Override
    public void close() {
        onClose.run();
    }

    private void push(String key, String raw, String operation, Message message) {
        try {
            commands.lpush(key, raw);
        } catch (RedisException e) {
            throw new MessagingOperationException(
                    "Failed to " + operation + " message " + message.getId() + " on " + queueKey, e);
        }
    }
}
