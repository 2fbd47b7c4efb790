package com.intteq.fluent.broker.redis;

import com.intteq.fluent.broker.TransportConfigurator;
import com.intteq.fluent.broker.capability.DistributedLock;
import com.intteq.fluent.broker.capability.LuggageStore;
import com.intteq.fluent.broker.core.PublicationCollector;
import com.intteq.fluent.broker.core.SubscriptionCollector;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Fluent configuration of the Redis transport and the Redis-backed capabilities.
 */
public class RedisConfigurator extends TransportConfigurator<RedisConnection, RedisConfigurator> {

    @Override
    protected RedisConfigurator self() {
        return this;
    }

    @Override
    public String transportName() {
        return "Redis";
    }

    public RedisConfigurator setConnection(Consumer<RedisConnection.Builder> configure) {
        RedisConnection.Builder builder = RedisConnection.builder();
        configure.accept(builder);
        return setConnection(builder.build());
    }

    public RedisConfigurator useSubscriptions(
            Consumer<SubscriptionCollector<RedisSubscription, RedisSubscription.Builder>> configure) {
        return addSubscriptionsStep(RedisSubscription::builder, RedisChannelFactory::new, configure);
    }

    public RedisConfigurator usePublications(
            Consumer<PublicationCollector<RedisPublication, RedisPublication.Builder>> configure) {
        return addPublicationsStep(RedisPublication::builder, RedisMessageProducerFactory::new, configure);
    }

    public RedisConfigurator useLuggageStore(Function<RedisConnection, LuggageStore> factory) {
        return addCapabilityStep(factory, (fluent, store) -> fluent.setLuggageStore(store));
    }

    public RedisConfigurator useDistributedLock(Function<RedisConnection, DistributedLock> factory) {
        return addCapabilityStep(factory,
                (fluent, lock) -> fluent.producers(producers -> producers.setDistributedLock(lock)));
    }
}
