package com.intteq.fluent.broker.azure;

import com.intteq.fluent.broker.core.Publication;
import lombok.Getter;
import lombok.ToString;

/**
 * Publication to an Azure Service Bus topic named by the routing key.
 */
@Getter
@ToString(callSuper = true)
public final class AzureServiceBusPublication extends Publication {

    private final String subject;

    private AzureServiceBusPublication(Builder builder) {
        super(builder);
        this.subject = builder.subject;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTopicName() {
        return getRoutingKey();
    }

    public static final class Builder extends Publication.Builder<AzureServiceBusPublication, Builder> {

        private String subject;

        private Builder() {
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected AzureServiceBusPublication newPublication() {
            return new AzureServiceBusPublication(this);
        }

        public Builder setTopic(String topic) {
            return setRoutingKey(topic);
        }

        /** Message subject stamped on every send; defaults to the topic. */
        public Builder setSubject(String subject) {
            this.subject = subject;
            return this;
        }
    }
}
