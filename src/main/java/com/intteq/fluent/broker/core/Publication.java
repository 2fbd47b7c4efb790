package com.intteq.fluent.broker.core;

import com.intteq.fluent.broker.annotation.MessagingRoute;
import com.intteq.fluent.broker.exception.MissingRequiredFieldException;
import lombok.Getter;
import lombok.ToString;

/**
 * Describes one outbound route. Each transport contributes a subclass and a nested
 * {@code Builder}.
 */
@Getter
@ToString
public abstract class Publication {

    private final DestinationIdentity destination;
    private final Class<?> dataType;
    private final OnMissingChannel makeChannels;
    private final String retryPolicyName;
    private final String contentType;

    protected Publication(Builder<?, ?> builder) {
        this.destination = new DestinationIdentity(builder.routingKey);
        this.dataType = builder.dataType;
        this.makeChannels = builder.makeChannels;
        this.retryPolicyName = builder.retryPolicyName;
        this.contentType = builder.contentType;
    }

    public DestinationIdentity destination() {
        return destination;
    }

    public String getRoutingKey() {
        return destination.routingKey();
    }

    /**
     * @param <P> the publication type built
     * @param <B> the concrete builder type, returned by every setter
     */
    public abstract static class Builder<P extends Publication, B extends Builder<P, B>> {

        private String routingKey;
        private Class<?> dataType;
        private OnMissingChannel makeChannels = OnMissingChannel.CREATE;
        private String retryPolicyName;
        private String contentType = "application/json";

        protected abstract B self();

        protected abstract P newPublication();

        public B setRoutingKey(String routingKey) {
            this.routingKey = routingKey;
            return self();
        }

        /**
         * Sets the message type and, when no routing key was given, derives it from the type's
         * {@link MessagingRoute#topic()} or simple class name.
         */
        public B setDataType(Class<?> dataType) {
            this.dataType = dataType;
            if (dataType != null && (routingKey == null || routingKey.isBlank())) {
                MessagingRoute route = dataType.getAnnotation(MessagingRoute.class);
                routingKey = route != null && !route.topic().isEmpty()
                        ? route.topic()
                        : dataType.getSimpleName();
            }
            return self();
        }

        public B setMakeChannels(OnMissingChannel makeChannels) {
            this.makeChannels = makeChannels;
            return self();
        }

        /**
         * Names the {@link RetryPolicy} in the {@link PolicyRegistry} used when sending. The
         * registry default applies when unset or unknown.
         */
        public B setRetryPolicyName(String retryPolicyName) {
            this.retryPolicyName = retryPolicyName;
            return self();
        }

        public B setContentType(String contentType) {
            this.contentType = contentType;
            return self();
        }

        public P build() {
            String owner = getClass().getEnclosingClass() != null
                    ? getClass().getEnclosingClass().getSimpleName()
                    : getClass().getSimpleName();

            if (routingKey == null || routingKey.isBlank()) {
                throw new MissingRequiredFieldException(owner, "routingKey");
            }
            if (makeChannels == null) {
                throw new MissingRequiredFieldException(owner, "makeChannels");
            }
            validate(owner);
            return newPublication();
        }

        protected void validate(String owner) {
        }
    }
}
