package com.intteq.fluent.broker.internal;

import com.intteq.fluent.broker.DuplicateRoutePolicy;
import com.intteq.fluent.broker.core.DestinationIdentity;
import com.intteq.fluent.broker.core.MessageProducer;
import com.intteq.fluent.broker.core.MessageProducerFactory;
import com.intteq.fluent.broker.core.PolicyRegistry;
import com.intteq.fluent.broker.core.ProducerRegistry;
import com.intteq.fluent.broker.exception.UnknownRouteException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves outbound destinations across every transport's producers.
 */
@Slf4j
public final class CombinedProducerRegistry implements ProducerRegistry {

    private static final CombinedProducerRegistry EMPTY =
            new CombinedProducerRegistry(RouteTable.<DestinationIdentity, MessageProducer>builder(
                    "producer", DuplicateRoutePolicy.OVERWRITE).build());

    private final RouteTable<DestinationIdentity, MessageProducer> routes;

    public CombinedProducerRegistry(RouteTable<DestinationIdentity, MessageProducer> routes) {
        this.routes = Objects.requireNonNull(routes, "routes must not be null");
    }

    public static CombinedProducerRegistry empty() {
        return EMPTY;
    }

    /**
     * Invokes every factory and merges their producers. A single factory's producers are taken
     * as they are; producers of several factories go through {@code policy}.
     */
    public static CombinedProducerRegistry from(List<MessageProducerFactory> factories,
                                                PolicyRegistry policies,
                                                DuplicateRoutePolicy policy) {
        if (factories.isEmpty()) {
            return empty();
        }

        if (factories.size() == 1) {
            Map<DestinationIdentity, MessageProducer> producers = factories.get(0).create(policies);
            RouteTable.Builder<DestinationIdentity, MessageProducer> table =
                    RouteTable.builder("producer", DuplicateRoutePolicy.OVERWRITE);
            table.putAll(producers);
            return new CombinedProducerRegistry(table.build());
        }

        RouteTable.Builder<DestinationIdentity, MessageProducer> table = RouteTable.builder("producer", policy);
        for (MessageProducerFactory factory : factories) {
            table.putAll(factory.create(policies));
        }
        return new CombinedProducerRegistry(table.build());
    }

    @Override
    public MessageProducer resolve(DestinationIdentity destination) {
        MessageProducer producer = routes.get(destination);
        if (producer == null) {
            throw new UnknownRouteException("producer", destination);
        }
        return producer;
    }

    @Override
    public Set<DestinationIdentity> destinations() {
        return routes.keys();
    }

    @Override
    public Collection<MessageProducer> producers() {
        return Collections.unmodifiableCollection(new LinkedHashSet<>(routes.asMap().values()));
    }

    /** Closes every producer the factories created, including ones a duplicate route replaced. */
    @Override
    public void close() {
        for (MessageProducer producer : routes.boundValues()) {
            try {
                producer.close();
            } catch (Exception e) {
                log.warn("Failed to close producer for {}: {}", producer.publication().getRoutingKey(),
                        e.getMessage(), e);
            }
        }
    }

    @Override
    public String toString() {
        return "CombinedProducerRegistry" + routes.keys();
    }
}
