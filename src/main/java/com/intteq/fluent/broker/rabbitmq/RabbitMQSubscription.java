package com.intteq.fluent.broker.rabbitmq;

import com.intteq.fluent.broker.core.Subscription;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Subscription to a RabbitMQ queue. The channel name is the queue name; the routing key binds
 * the queue to the connection's exchange.
 */
@Getter
@ToString(callSuper = true)
public final class RabbitMQSubscription extends Subscription {

    private final boolean durable;
    private final boolean highAvailability;
    private final Duration ttl;
    private final Integer maxQueueLength;
    private final String deadLetterChannelName;
    private final String deadLetterRoutingKey;

    private RabbitMQSubscription(Builder builder) {
        super(builder);
        this.durable = builder.durable;
        this.highAvailability = builder.highAvailability;
        this.ttl = builder.ttl;
        this.maxQueueLength = builder.maxQueueLength;
        this.deadLetterChannelName = builder.deadLetterChannelName;
        this.deadLetterRoutingKey = builder.deadLetterRoutingKey;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getQueueName() {
        return getChannelName();
    }

    public boolean hasDeadLetterQueue() {
        return deadLetterChannelName != null && !deadLetterChannelName.isBlank();
    }

    public static final class Builder extends Subscription.Builder<RabbitMQSubscription, Builder> {

        private boolean durable;
        private boolean highAvailability;
        private Duration ttl;
        private Integer maxQueueLength;
        private String deadLetterChannelName;
        private String deadLetterRoutingKey;

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected RabbitMQSubscription newSubscription() {
            return new RabbitMQSubscription(this);
        }

        public Builder setQueue(String queueName) {
            return setChannelName(queueName);
        }

        public Builder setDurable(boolean durable) {
            this.durable = durable;
            return this;
        }

        public Builder setHighAvailability(boolean highAvailability) {
            this.highAvailability = highAvailability;
            return this;
        }

        /** Per-queue message TTL ({@code x-message-ttl}). */
        public Builder setTtl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder setMaxQueueLength(Integer maxQueueLength) {
            this.maxQueueLength = maxQueueLength;
            return this;
        }

        /** Queue receiving rejected messages, bound to the connection's dead letter exchange. */
        public Builder setDeadLetterChannelName(String deadLetterChannelName) {
            this.deadLetterChannelName = deadLetterChannelName;
            return this;
        }

        public Builder setDeadLetterRoutingKey(String deadLetterRoutingKey) {
            this.deadLetterRoutingKey = deadLetterRoutingKey;
            return this;
        }

        @Override
        protected void validate(String owner) {
            if (maxQueueLength != null && maxQueueLength < 1) {
                throw new IllegalArgumentException(owner + ": maxQueueLength must be >= 1");
            }
        }
    }
}
