package com.intteq.fluent.broker.core;

import java.util.Objects;

/**
 * The (subscription name, channel name, routing key) tuple that uniquely addresses one inbound
 * route. Used as the key of the channel dispatch table.
 */
public record SubscriptionIdentity(String subscriptionName, String channelName, String routingKey) {

    public SubscriptionIdentity {
        Objects.requireNonNull(subscriptionName, "subscriptionName must not be null");
        Objects.requireNonNull(channelName, "channelName must not be null");
        Objects.requireNonNull(routingKey, "routingKey must not be null");
    }

    public static SubscriptionIdentity of(String subscriptionName, String channelName, String routingKey) {
        return new SubscriptionIdentity(subscriptionName, channelName, routingKey);
    }

    @Override
    public String toString() {
        return "[subscription=" + subscriptionName + ", channel=" + channelName + ", routingKey=" + routingKey + "]";
    }
}
