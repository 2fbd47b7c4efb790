package com.intteq.fluent.broker.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Collects the subscriptions a transport configurator declares inside one
 * {@code useSubscriptions(...)} call. Subscriptions built here are bound to the transport's
 * channel factory.
 *
 * @param <S> the transport's subscription type
 * @param <B> the transport's subscription builder type
 */
public final class SubscriptionCollector<S extends Subscription, B extends Subscription.Builder<S, B>> {

    private final Supplier<B> builders;
    private final ChannelFactory channelFactory;
    private final List<S> subscriptions = new ArrayList<>();

    public SubscriptionCollector(Supplier<B> builders, ChannelFactory channelFactory) {
        this.builders = Objects.requireNonNull(builders, "builders must not be null");
        this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory must not be null");
    }

    /**
     * Adds a pre-built subscription. It is bound to this transport's channel factory regardless
     * of the factory it was built with.
     */
    public SubscriptionCollector<S, B> addSubscription(S subscription) {
        subscriptions.add(Objects.requireNonNull(subscription, "subscription must not be null"));
        return this;
    }

    public SubscriptionCollector<S, B> addSubscription(Consumer<B> configure) {
        B builder = builders.get();
        configure.accept(builder);
        builder.setChannelFactory(channelFactory);
        return addSubscription(builder.build());
    }

    /**
     * Adds a subscription for {@code dataType}; identity fields left unset by {@code configure}
     * are derived from the type.
     */
    public SubscriptionCollector<S, B> addSubscription(Class<?> dataType, Consumer<B> configure) {
        return addSubscription(builder -> {
            configure.accept(builder);
            builder.setDataType(dataType);
        });
    }

    public ChannelFactory getChannelFactory() {
        return channelFactory;
    }

    public List<S> getSubscriptions() {
        return Collections.unmodifiableList(subscriptions);
    }
}
