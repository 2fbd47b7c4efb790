package com.intteq.fluent.broker.postgres;

import com.intteq.fluent.broker.core.Publication;
import lombok.ToString;

/**
 * Publication inserting rows into the queue table under its routing key.
 */
@ToString(callSuper = true)
public final class PostgresPublication extends Publication {

    private PostgresPublication(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder extends Publication.Builder<PostgresPublication, Builder> {

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected PostgresPublication newPublication() {
            return new PostgresPublication(this);
        }

        public Builder setTopic(String topic) {
            return setRoutingKey(topic);
        }
    }
}
