package com.intteq.fluent.broker.azure;

import com.intteq.fluent.broker.core.Subscription;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Subscription on an Azure Service Bus topic. The routing key is the topic; the channel name is
 * the Service Bus subscription.
 */
@Getter
@ToString(callSuper = true)
public final class AzureServiceBusSubscription extends Subscription {

    private final int maxDeliveryCount;
    private final Duration lockDuration;
    private final Duration defaultMessageTimeToLive;
    private final boolean deadLetteringOnMessageExpiration;

    private AzureServiceBusSubscription(Builder builder) {
        super(builder);
        this.maxDeliveryCount = builder.maxDeliveryCount;
        this.lockDuration = builder.lockDuration;
        this.defaultMessageTimeToLive = builder.defaultMessageTimeToLive;
        this.deadLetteringOnMessageExpiration = builder.deadLetteringOnMessageExpiration;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTopicName() {
        return getRoutingKey();
    }

    public String getServiceBusSubscriptionName() {
        return getChannelName();
    }

    public static final class Builder extends Subscription.Builder<AzureServiceBusSubscription, Builder> {

        private int maxDeliveryCount = 10;
        private Duration lockDuration = Duration.ofMinutes(1);
        private Duration defaultMessageTimeToLive;
        private boolean deadLetteringOnMessageExpiration;

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected AzureServiceBusSubscription newSubscription() {
            return new AzureServiceBusSubscription(this);
        }

        public Builder setTopic(String topic) {
            return setRoutingKey(topic);
        }

        public Builder setMaxDeliveryCount(int maxDeliveryCount) {
            this.maxDeliveryCount = maxDeliveryCount;
            return this;
        }

        public Builder setLockDuration(Duration lockDuration) {
            this.lockDuration = lockDuration;
            return this;
        }

        public Builder setDefaultMessageTimeToLive(Duration defaultMessageTimeToLive) {
            this.defaultMessageTimeToLive = defaultMessageTimeToLive;
            return this;
        }

        public Builder setDeadLetteringOnMessageExpiration(boolean deadLetteringOnMessageExpiration) {
            this.deadLetteringOnMessageExpiration = deadLetteringOnMessageExpiration;
            return this;
        }

        @Override
        protected void validate(String owner) {
            if (maxDeliveryCount < 1) {
                throw new IllegalArgumentException(owner + ": maxDeliveryCount must be >= 1");
            }
        }
    }
}
