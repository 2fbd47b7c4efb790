package com.intteq.fluent.broker.core;

/**
 * Opens channels for subscriptions of one transport.
 */
@FunctionalInterface
public interface ChannelFactory {

    Channel createChannel(Subscription subscription);
}
