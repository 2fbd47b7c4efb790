package com.intteq.fluent.broker.consumer;

import com.intteq.fluent.broker.DuplicateRoutePolicy;
import com.intteq.fluent.broker.capability.MessageSchedulerFactory;
import com.intteq.fluent.broker.core.ChannelFactory;
import com.intteq.fluent.broker.core.PolicyRegistry;
import com.intteq.fluent.broker.core.Subscription;
import com.intteq.fluent.broker.core.SubscriptionIdentity;
import com.intteq.fluent.broker.exception.MissingRequiredFieldException;
import com.intteq.fluent.broker.internal.CombinedChannelResolver;
import com.intteq.fluent.broker.internal.RouteTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Accumulates the subscriptions of every transport and binds each identity to the channel
 * factory that serves it.
 *
 * <p>Registration order does not matter for resolution: a resolver built from the same
 * bindings in any order answers the same (duplicates aside, which follow the
 * {@link DuplicateRoutePolicy}).
 */
@Slf4j
public class ConsumerBuilder {

    private final List<Registration> registrations = new ArrayList<>();
    private ChannelFactory defaultChannelFactory;
    private InboxConfiguration explicitInbox;
    private final InboxConfiguration.Builder inboxBuilder = InboxConfiguration.builder();
    private DuplicateRoutePolicy duplicateRoutePolicy = DuplicateRoutePolicy.WARN;

    /**
     * Binds every subscription's identity to {@code factory}.
     */
    public ConsumerBuilder addChannelFactory(ChannelFactory factory, Collection<? extends Subscription> subscriptions) {
        Objects.requireNonNull(factory, "factory must not be null");
        for (Subscription subscription : subscriptions) {
            registrations.add(new Registration(subscription, factory));
        }
        return this;
    }

    /**
     * Adds a subscription bound to its own channel factory, or to the default channel factory when
     * it has none.
     */
    public ConsumerBuilder addSubscription(Subscription subscription) {
        registrations.add(new Registration(Objects.requireNonNull(subscription, "subscription must not be null"), null));
        return this;
    }

    public ConsumerBuilder setDefaultChannelFactory(ChannelFactory defaultChannelFactory) {
        this.defaultChannelFactory = defaultChannelFactory;
        return this;
    }

    /** Explicit inbox configuration; takes precedence over the builder form. */
    public ConsumerBuilder setInbox(InboxConfiguration inbox) {
        this.explicitInbox = inbox;
        return this;
    }

    public ConsumerBuilder setInbox(Consumer<InboxConfiguration.Builder> configure) {
        configure.accept(inboxBuilder);
        return this;
    }

    public ConsumerBuilder setDuplicateRoutePolicy(DuplicateRoutePolicy duplicateRoutePolicy) {
        this.duplicateRoutePolicy = Objects.requireNonNull(duplicateRoutePolicy, "duplicateRoutePolicy must not be null");
        return this;
    }

    public DuplicateRoutePolicy getDuplicateRoutePolicy() {
        return duplicateRoutePolicy;
    }

    public int subscriptionCount() {
        return registrations.size();
    }

    public ConsumersOptions build(PolicyRegistry policies, MessageSchedulerFactory schedulerFactory) {
        RouteTable.Builder<SubscriptionIdentity, ChannelFactory> table =
                RouteTable.builder("channel", duplicateRoutePolicy);
        Map<SubscriptionIdentity, Subscription> subscriptions = new LinkedHashMap<>();

        for (Registration registration : registrations) {
            Subscription subscription = registration.subscription();
            ChannelFactory factory = registration.factory() != null
                    ? registration.factory()
                    : subscription.getChannelFactory() != null
                    ? subscription.getChannelFactory()
                    : defaultChannelFactory;

            if (factory == null) {
                throw new MissingRequiredFieldException(
                        subscription.getClass().getSimpleName() + " " + subscription.identity(), "channelFactory");
            }

            table.put(subscription.identity(), factory);
            subscriptions.put(subscription.identity(), subscription);
        }

        InboxConfiguration inbox = explicitInbox != null ? explicitInbox : inboxBuilder.build();
        CombinedChannelResolver resolver = new CombinedChannelResolver(table.build());

        log.debug("Consumer configuration built: {} channel bindings, inbox enabled={}",
                resolver.size(), inbox.isEnabled());

        return new ConsumersOptions(new ArrayList<>(subscriptions.values()), resolver, inbox, policies, schedulerFactory);
    }

    private record Registration(Subscription subscription, ChannelFactory factory) {
    }
}
