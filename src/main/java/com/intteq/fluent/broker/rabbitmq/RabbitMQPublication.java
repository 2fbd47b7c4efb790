package com.intteq.fluent.broker.rabbitmq;

import com.intteq.fluent.broker.core.Publication;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Publication to the connection's exchange under one routing key.
 */
@Getter
@ToString(callSuper = true)
public final class RabbitMQPublication extends Publication {

    private final Duration waitForConfirmsTimeout;

    private RabbitMQPublication(Builder builder) {
        super(builder);
        this.waitForConfirmsTimeout = builder.waitForConfirmsTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder extends Publication.Builder<RabbitMQPublication, Builder> {

        private Duration waitForConfirmsTimeout = Duration.ofMillis(500);

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected RabbitMQPublication newPublication() {
            return new RabbitMQPublication(this);
        }

        public Builder setTopic(String topic) {
            return setRoutingKey(topic);
        }

        public Builder setWaitForConfirmsTimeout(Duration waitForConfirmsTimeout) {
            this.waitForConfirmsTimeout = waitForConfirmsTimeout;
            return this;
        }
    }
}
