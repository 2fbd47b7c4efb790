package com.intteq.fluent.broker.redis;

import com.intteq.fluent.broker.core.Publication;
import lombok.ToString;

/**
 * Publication fanning out to every Redis queue subscribed to the routing key.
 */
@ToString(callSuper = true)
public final class RedisPublication extends Publication {

    private RedisPublication(Builder builder) {
        super(builder);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder extends Publication.Builder<RedisPublication, Builder> {

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected RedisPublication newPublication() {
            return new RedisPublication(this);
        }

        public Builder setTopic(String topic) {
            return setRoutingKey(topic);
        }
    }
}
