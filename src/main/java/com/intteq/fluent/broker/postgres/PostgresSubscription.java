package com.intteq.fluent.broker.postgres;

import com.intteq.fluent.broker.core.Subscription;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Subscription reading the rows queued under its routing key. Subscriptions sharing a routing
 * key compete for rows.
 */
@Getter
@ToString(callSuper = true)
public final class PostgresSubscription extends Subscription {

    private final Duration visibilityTimeout;

    private PostgresSubscription(Builder builder) {
        super(builder);
        this.visibilityTimeout = builder.visibilityTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder extends Subscription.Builder<PostgresSubscription, Builder> {

        private Duration visibilityTimeout = Duration.ofSeconds(30);

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected PostgresSubscription newSubscription() {
            return new PostgresSubscription(this);
        }

        public Builder setQueue(String queue) {
            return setChannelName(queue);
        }

        /** How long a claimed row stays hidden from other consumers before it is redelivered. */
        public Builder setVisibilityTimeout(Duration visibilityTimeout) {
            this.visibilityTimeout = visibilityTimeout;
            return this;
        }

        @Override
        protected void validate(String owner) {
            if (visibilityTimeout == null || visibilityTimeout.isNegative() || visibilityTimeout.isZero()) {
                throw new IllegalArgumentException(owner + ": visibilityTimeout must be positive");
            }
        }
    }
}
