package com.intteq.fluent.broker.core;

import java.util.Objects;

/**
 * The topic / routing key that addresses one outbound route.
 */
public record DestinationIdentity(String routingKey) {

    public DestinationIdentity {
        Objects.requireNonNull(routingKey, "routingKey must not be null");
    }

    public static DestinationIdentity of(String routingKey) {
        return new DestinationIdentity(routingKey);
    }

    @Override
    public String toString() {
        return "[routingKey=" + routingKey + "]";
    }
}
