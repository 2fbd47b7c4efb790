package com.intteq.fluent.broker.rabbitmq;

import com.intteq.fluent.broker.core.Channel;
import com.intteq.fluent.broker.core.Message;
import com.intteq.fluent.broker.exception.MessagingOperationException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.GetResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Polling consumer over one RabbitMQ queue. Messages are fetched with {@code basic.get} in manual
 * ack mode and settled by delivery tag.
 */
@Slf4j
public class RabbitMQChannel implements Channel {

    private static final Duration POLL_INTERVAL = Duration.ofMillis(50);

    private final RabbitMQSubscription subscription;
    private final com.rabbitmq.client.Channel channel;

    /** Delivery tags of received, unsettled messages keyed by message id. */
    private final Map<String, Long> pending = new HashMap<>();

    RabbitMQChannel(RabbitMQSubscription subscription, com.rabbitmq.client.Channel channel) {
        this.subscription = subscription;
        this.channel = channel;
    }

    @Override
    public RabbitMQSubscription subscription() {
        return subscription;
    }

    @Override
    public Optional<Message> receive(Duration timeout) {
        Instant deadline = Instant.now().plus(timeout);
        try {
            while (true) {
                GetResponse response = channel.basicGet(subscription.getQueueName(), false);
                if (response != null) {
                    Message message = toMessage(response);
                    pending.put(message.getId(), response.getEnvelope().getDeliveryTag());
                    return Optional.of(message);
                }
                if (!Instant.now().isBefore(deadline)) {
                    return Optional.empty();
                }
                Thread.sleep(Math.min(POLL_INTERVAL.toMillis(),
                        Math.max(1, Duration.between(Instant.now(), deadline).toMillis())));
            }
        } catch (IOException e) {
            throw new MessagingOperationException("Failed to receive from queue " + subscription.getQueueName(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public void acknowledge(Message message) {
        settle(message, "acknowledge", tag -> channel.basicAck(tag, false));
    }

    /** Nacks without requeue so the broker dead-letters the message when a DLX is configured. */
    @Override
    public void reject(Message message) {
        settle(message, "reject", tag -> channel.basicNack(tag, false, false));
    }

    @Override
    public void requeue(Message message) {
        settle(message, "requeue", tag -> channel.basicNack(tag, false, true));
    }

    @Override
    public void close() {
        try {
            if (channel.isOpen()) {
                channel.close();
            }
        } catch (IOException | TimeoutException e) {
            log.warn("Failed to close RabbitMQ channel for queue {}", subscription.getQueueName(), e);
        }
    }

    int pendingCount() {
        return pending.size();
    }

    private void settle(Message message, String operation, Settlement settlement) {
        Long tag = pending.remove(message.getId());
        if (tag == null) {
            log.warn("Cannot {} message {} on queue {}: no pending delivery",
                    operation, message.getId(), subscription.getQueueName());
            return;
        }
        try {
            settlement.apply(tag);
            log.debug("{} message {} (deliveryTag={}) on queue {}",
                    operation, message.getId(), tag, subscription.getQueueName());
        } catch (IOException e) {
            throw new MessagingOperationException(
                    "Failed to " + operation + " message " + message.getId() + " on queue " + subscription.getQueueName(), e);
        }
    }

    private Message toMessage(GetResponse response) {
        AMQP.BasicProperties props = response.getProps();

        Map<String, String> headers = new HashMap<>();
        if (props != null && props.getHeaders() != null) {
            props.getHeaders().forEach((key, value) -> headers.put(key, String.valueOf(value)));
        }

        Message.MessageBuilder builder = Message.builder()
                .id(props != null && props.getMessageId() != null ? props.getMessageId() : UUID.randomUUID().toString())
                .routingKey(response.getEnvelope().getRoutingKey())
                .headers(headers)
                .body(response.getBody() != null ? response.getBody() : new byte[0]);

        if (props != null) {
            if (props.getContentType() != null) {
                builder.contentType(props.getContentType());
            }
            if (props.getTimestamp() != null) {
                builder.timestamp(props.getTimestamp().toInstant());
            }
            builder.correlationId(props.getCorrelationId());
        }
        return builder.build();
    }

    @FunctionalInterface
    private interface Settlement {
        void apply(long deliveryTag) throws IOException;
    }
}
