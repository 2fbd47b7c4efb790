package com.intteq.fluent.broker.postgres;

import com.intteq.fluent.broker.TransportConfigurator;
import com.intteq.fluent.broker.capability.DistributedLock;
import com.intteq.fluent.broker.capability.Inbox;
import com.intteq.fluent.broker.capability.Outbox;
import com.intteq.fluent.broker.core.PublicationCollector;
import com.intteq.fluent.broker.core.SubscriptionCollector;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Fluent configuration of the PostgreSQL transport and the PostgreSQL-backed inbox, outbox and
 * distributed lock.
 *
 * <pre>
 * new PostgresConfigurator()
 *         .setConnection(c -> c.setJdbcUrl("jdbc:postgresql://localhost:5432/orders"))
 *         .useOutbox(connection -> new MyPostgresOutbox(connection.createDataSource()))
 *         .usePublications(p -> p.addPublication(b -> b.setTopic("order.created")));
 * </pre>
 */
public class PostgresConfigurator extends TransportConfigurator<PostgresConnection, PostgresConfigurator> {

    @Override
    protected PostgresConfigurator self() {
        return this;
    }

    @Override
    public String transportName() {
        return "PostgreSQL";
    }

    public PostgresConfigurator setConnection(Consumer<PostgresConnection.Builder> configure) {
        PostgresConnection.Builder builder = PostgresConnection.builder();
        configure.accept(builder);
        return setConnection(builder.build());
    }

    public PostgresConfigurator useSubscriptions(
            Consumer<SubscriptionCollector<PostgresSubscription, PostgresSubscription.Builder>> configure) {
        return addSubscriptionsStep(PostgresSubscription::builder, PostgresChannelFactory::new, configure);
    }

    public PostgresConfigurator usePublications(
            Consumer<PublicationCollector<PostgresPublication, PostgresPublication.Builder>> configure) {
        return addPublicationsStep(PostgresPublication::builder, PostgresMessageProducerFactory::new, configure);
    }

    public PostgresConfigurator useInbox(Function<PostgresConnection, Inbox> factory) {
        return addCapabilityStep(factory,
                (fluent, inbox) -> fluent.subscriptions(consumers -> consumers.setInbox(b -> b.setInbox(inbox))));
    }

    public PostgresConfigurator useOutbox(Function<PostgresConnection, Outbox> factory) {
        return addCapabilityStep(factory,
                (fluent, outbox) -> fluent.producers(producers -> producers.setOutbox(outbox)));
    }

    public PostgresConfigurator useDistributedLock(Function<PostgresConnection, DistributedLock> factory) {
        return addCapabilityStep(factory,
                (fluent, lock) -> fluent.producers(producers -> producers.setDistributedLock(lock)));
    }
}
