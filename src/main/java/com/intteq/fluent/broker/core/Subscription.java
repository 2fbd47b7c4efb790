package com.intteq.fluent.broker.core;

import com.intteq.fluent.broker.annotation.MessagingRoute;
import com.intteq.fluent.broker.exception.MissingRequiredFieldException;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Describes one inbound route and how its message pump should behave.
 *
 * <p>Each transport contributes a subclass carrying its own settings. Instances are immutable and
 * are created through the transport's nested {@code Builder}, whose {@code build()} step fails
 * with {@link MissingRequiredFieldException} when an identity field is missing.
 */
@Getter
@ToString(exclude = "channelFactory")
public abstract class Subscription {

    private final SubscriptionIdentity identity;
    private final Class<?> dataType;
    private final int bufferSize;
    private final int noOfPerformers;
    private final Duration timeout;
    private final int requeueCount;
    private final Duration requeueDelay;
    private final int unacceptableMessageLimit;
    private final OnMissingChannel makeChannels;
    private final Duration emptyChannelDelay;
    private final Duration channelFailureDelay;
    private final ChannelFactory channelFactory;

    protected Subscription(Builder<?, ?> builder) {
        this.identity = new SubscriptionIdentity(builder.subscriptionName, builder.channelName, builder.routingKey);
        this.dataType = builder.dataType;
        this.bufferSize = builder.bufferSize;
        this.noOfPerformers = builder.noOfPerformers;
        this.timeout = builder.timeout;
        this.requeueCount = builder.requeueCount;
        this.requeueDelay = builder.requeueDelay;
        this.unacceptableMessageLimit = builder.unacceptableMessageLimit;
        this.makeChannels = builder.makeChannels;
        this.emptyChannelDelay = builder.emptyChannelDelay;
        this.channelFailureDelay = builder.channelFailureDelay;
        this.channelFactory = builder.channelFactory;
    }

    public SubscriptionIdentity identity() {
        return identity;
    }

    public String getSubscriptionName() {
        return identity.subscriptionName();
    }

    public String getChannelName() {
        return identity.channelName();
    }

    public String getRoutingKey() {
        return identity.routingKey();
    }

    /**
     * Settings shared by every transport's subscription builder.
     *
     * @param <S> the subscription type built
     * @param <B> the concrete builder type, returned by every setter
     */
    public abstract static class Builder<S extends Subscription, B extends Builder<S, B>> {

        private String subscriptionName;
        private String channelName;
        private String routingKey;
        private Class<?> dataType;
        private int bufferSize = 1;
        private int noOfPerformers = 1;
        private Duration timeout = Duration.ofMillis(300);
        private int requeueCount = -1;
        private Duration requeueDelay = Duration.ZERO;
        private int unacceptableMessageLimit;
        private OnMissingChannel makeChannels = OnMissingChannel.CREATE;
        private Duration emptyChannelDelay = Duration.ofMillis(500);
        private Duration channelFailureDelay = Duration.ofSeconds(1);
        private ChannelFactory channelFactory;

        protected abstract B self();

        protected abstract S newSubscription();

        public B setSubscriptionName(String subscriptionName) {
            this.subscriptionName = subscriptionName;
            return self();
        }

        public B setChannelName(String channelName) {
            this.channelName = channelName;
            return self();
        }

        public B setRoutingKey(String routingKey) {
            this.routingKey = routingKey;
            return self();
        }

        /**
         * Sets the message type and fills any unset identity field from its
         * {@link MessagingRoute} annotation or, failing that, from the class name.
         */
        public B setDataType(Class<?> dataType) {
            this.dataType = dataType;
            if (dataType == null) {
                return self();
            }

            MessagingRoute route = dataType.getAnnotation(MessagingRoute.class);
            if (isEmpty(subscriptionName)) {
                subscriptionName = route != null && !route.subscription().isEmpty()
                        ? route.subscription()
                        : dataType.getName();
            }
            if (isEmpty(channelName)) {
                channelName = route != null && !route.channel().isEmpty()
                        ? route.channel()
                        : dataType.getSimpleName();
            }
            if (isEmpty(routingKey)) {
                routingKey = route != null && !route.topic().isEmpty()
                        ? route.topic()
                        : dataType.getSimpleName();
            }
            return self();
        }

        public B setBufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
            return self();
        }

        public B setNoOfPerformers(int noOfPerformers) {
            this.noOfPerformers = noOfPerformers;
            return self();
        }

        public B setTimeout(Duration timeout) {
            this.timeout = timeout;
            return self();
        }

        public B setRequeueCount(int requeueCount) {
            this.requeueCount = requeueCount;
            return self();
        }

        public B setRequeueDelay(Duration requeueDelay) {
            this.requeueDelay = requeueDelay;
            return self();
        }

        public B setUnacceptableMessageLimit(int unacceptableMessageLimit) {
            this.unacceptableMessageLimit = unacceptableMessageLimit;
            return self();
        }

        public B setMakeChannels(OnMissingChannel makeChannels) {
            this.makeChannels = makeChannels;
            return self();
        }

        public B setEmptyChannelDelay(Duration emptyChannelDelay) {
            this.emptyChannelDelay = emptyChannelDelay;
            return self();
        }

        public B setChannelFailureDelay(Duration channelFailureDelay) {
            this.channelFailureDelay = channelFailureDelay;
            return self();
        }

        public B setChannelFactory(ChannelFactory channelFactory) {
            this.channelFactory = channelFactory;
            return self();
        }

        public S build() {
            String owner = getClass().getEnclosingClass() != null
                    ? getClass().getEnclosingClass().getSimpleName()
                    : getClass().getSimpleName();

            if (isEmpty(subscriptionName)) {
                throw new MissingRequiredFieldException(owner, "subscriptionName");
            }
            if (isEmpty(channelName)) {
                throw new MissingRequiredFieldException(owner, "channelName");
            }
            if (isEmpty(routingKey)) {
                throw new MissingRequiredFieldException(owner, "routingKey");
            }
            if (makeChannels == null) {
                throw new MissingRequiredFieldException(owner, "makeChannels");
            }
            validate(owner);
            return newSubscription();
        }

        /**
         * Hook for transport-specific required fields.
         */
        protected void validate(String owner) {
        }

        private static boolean isEmpty(String value) {
            return value == null || value.isBlank();
        }
    }
}
