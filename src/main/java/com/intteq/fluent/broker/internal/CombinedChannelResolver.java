package com.intteq.fluent.broker.internal;

import com.intteq.fluent.broker.core.Channel;
import com.intteq.fluent.broker.core.ChannelFactory;
import com.intteq.fluent.broker.core.ChannelResolver;
import com.intteq.fluent.broker.core.Subscription;
import com.intteq.fluent.broker.core.SubscriptionIdentity;
import com.intteq.fluent.broker.exception.UnknownRouteException;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Set;

/**
 * Routes channel creation to the transport factory registered for a subscription's identity.
 * Immutable once constructed.
 */
@Slf4j
public final class CombinedChannelResolver implements ChannelResolver, ChannelFactory {

    private final RouteTable<SubscriptionIdentity, ChannelFactory> bindings;

    public CombinedChannelResolver(RouteTable<SubscriptionIdentity, ChannelFactory> bindings) {
        this.bindings = Objects.requireNonNull(bindings, "bindings must not be null");
    }

    @Override
    public ChannelFactory resolve(SubscriptionIdentity identity) {
        ChannelFactory factory = bindings.get(identity);
        if (factory == null) {
            throw new UnknownRouteException("channel", identity);
        }
        return factory;
    }

    @Override
    public Set<SubscriptionIdentity> identities() {
        return bindings.keys();
    }

    @Override
    public Channel createChannel(Subscription subscription) {
        return resolve(subscription.identity()).createChannel(subscription);
    }

    /**
     * Closes each distinct {@link AutoCloseable} factory once, replaced bindings included. A
     * failing factory is logged and the rest are still closed.
     */
    @Override
    public void close() {
        for (ChannelFactory factory : bindings.boundValues()) {
            if (!(factory instanceof AutoCloseable closeable)) {
                continue;
            }
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Failed to close channel factory {}: {}", factory, e.getMessage(), e);
            }
        }
    }

    public int size() {
        return bindings.size();
    }

    @Override
    public String toString() {
        return "CombinedChannelResolver" + bindings.keys();
    }
}
