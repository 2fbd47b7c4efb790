package com.intteq.fluent.broker.redis;

import com.intteq.fluent.broker.core.Subscription;
import lombok.ToString;

/**
 * Subscription backed by a Redis list named after the channel, registered in the set of queues
 * of its routing key.
 */
@ToString(callSuper = true)
public final class RedisSubscription extends Subscription {

    private final String deadLetterQueueName;

    private RedisSubscription(Builder builder) {
        super(builder);
        this.deadLetterQueueName = builder.deadLetterQueueName;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getQueueName() {
        return getChannelName();
    }

    /** Defaults to {@code <queue>.dlq}. */
    public String getDeadLetterQueueName() {
        return deadLetterQueueName != null ? deadLetterQueueName : getQueueName() + ".dlq";
    }

    public static final class Builder extends Subscription.Builder<RedisSubscription, Builder> {

        private String deadLetterQueueName;

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected RedisSubscription newSubscription() {
            return new RedisSubscription(this);
        }

        public Builder setQueue(String queueName) {
            return setChannelName(queueName);
        }

        public Builder setTopic(String topic) {
            return setRoutingKey(topic);
        }

        public Builder setDeadLetterQueueName(String deadLetterQueueName) {
            this.deadLetterQueueName = deadLetterQueueName;
            return this;
        }
    }
}
