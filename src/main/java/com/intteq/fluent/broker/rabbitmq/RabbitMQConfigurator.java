package com.intteq.fluent.broker.rabbitmq;

import com.intteq.fluent.broker.TransportConfigurator;
import com.intteq.fluent.broker.core.PublicationCollector;
import com.intteq.fluent.broker.core.SubscriptionCollector;

import java.util.function.Consumer;

/**
 * Fluent configuration of the RabbitMQ transport.
 *
 * <pre>
 * new RabbitMQConfigurator()
 *         .setConnection(c -> c.setHost("localhost").setExchange("orders"))
 *         .usePublications(p -> p.addPublication(b -> b.setTopic("order.created")))
 *         .useSubscriptions(s -> s.addSubscription(b -> b
 *                 .setSubscriptionName("order-created-sub")
 *                 .setQueue("order-created")
 *                 .setRoutingKey("order.created")));
 * </pre>
 */
public class RabbitMQConfigurator extends TransportConfigurator<RabbitMQConnection, RabbitMQConfigurator> {

    @Override
    protected RabbitMQConfigurator self() {
        return this;
    }

    @Override
    public String transportName() {
        return "RabbitMQ";
    }

    public RabbitMQConfigurator setConnection(Consumer<RabbitMQConnection.Builder> configure) {
        RabbitMQConnection.Builder builder = RabbitMQConnection.builder();
        configure.accept(builder);
        return setConnection(builder.build());
    }

    public RabbitMQConfigurator useSubscriptions(
            Consumer<SubscriptionCollector<RabbitMQSubscription, RabbitMQSubscription.Builder>> configure) {
        return addSubscriptionsStep(RabbitMQSubscription::builder, RabbitMQChannelFactory::new, configure);
    }

    public RabbitMQConfigurator usePublications(
            Consumer<PublicationCollector<RabbitMQPublication, RabbitMQPublication.Builder>> configure) {
        return addPublicationsStep(RabbitMQPublication::builder, RabbitMQMessageProducerFactory::new, configure);
    }
}
