package com.intteq.fluent.broker.rabbitmq;

import com.intteq.fluent.broker.core.ChannelFactory;
import com.intteq.fluent.broker.core.OnMissingChannel;
import com.intteq.fluent.broker.core.Subscription;
import com.intteq.fluent.broker.exception.MessagingOperationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;

import java.util.Objects;

/**
 * Opens {@link RabbitMQChannel}s for RabbitMQ subscriptions. The connection factory is created on
 * the first channel; topology is declared or verified per subscription at that point.
 */
@Slf4j
public class RabbitMQChannelFactory implements ChannelFactory, AutoCloseable {

    private final RabbitMQConnection connection;
    private volatile CachingConnectionFactory connectionFactory;

    public RabbitMQChannelFactory(RabbitMQConnection connection) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
    }

    public RabbitMQConnection getConnection() {
        return connection;
    }

    @Override
    public RabbitMQChannel createChannel(Subscription subscription) {
        if (!(subscription instanceof RabbitMQSubscription rabbitSubscription)) {
            throw new IllegalArgumentException("RabbitMQChannelFactory requires a RabbitMQSubscription, got "
                    + subscription.getClass().getName());
        }

        CachingConnectionFactory factory = connectionFactory();
        try {
            RabbitAdmin admin = new RabbitAdmin(factory);
            if (rabbitSubscription.getMakeChannels() == OnMissingChannel.CREATE) {
                declareTopology(admin, rabbitSubscription);
            } else if (rabbitSubscription.getMakeChannels() == OnMissingChannel.VALIDATE
                    && admin.getQueueProperties(rabbitSubscription.getQueueName()) == null) {
                throw new MessagingOperationException("Queue does not exist: " + rabbitSubscription.getQueueName());
            }

            com.rabbitmq.client.Channel channel = factory.createConnection().createChannel(false);
            log.info("RabbitMQ channel created: queue={} routingKey={}",
                    rabbitSubscription.getQueueName(), rabbitSubscription.getRoutingKey());
            return new RabbitMQChannel(rabbitSubscription, channel);

        } catch (AmqpException e) {
            throw new MessagingOperationException(
                    "Failed to create RabbitMQ channel for queue " + rabbitSubscription.getQueueName(), e);
        }
    }

    private void declareTopology(RabbitAdmin admin, RabbitMQSubscription subscription) {
        Exchange exchange = new ExchangeBuilder(connection.getExchange(), connection.getExchangeType())
                .durable(connection.isDurableExchange())
                .build();
        admin.declareExchange(exchange);

        QueueBuilder queueBuilder = subscription.isDurable()
                ? QueueBuilder.durable(subscription.getQueueName())
                : QueueBuilder.nonDurable(subscription.getQueueName());

        if (subscription.getTtl() != null) {
            queueBuilder.withArgument("x-message-ttl", subscription.getTtl().toMillis());
        }
        if (subscription.getMaxQueueLength() != null) {
            queueBuilder.withArgument("x-max-length", subscription.getMaxQueueLength());
        }
        if (subscription.isHighAvailability()) {
            queueBuilder.withArgument("x-ha-policy", "all");
        }

        if (subscription.hasDeadLetterQueue()) {
            String dlxName = connection.getDeadLetterExchange() != null
                    ? connection.getDeadLetterExchange()
                    : connection.getExchange() + ".dlx";
            String dlRoutingKey = subscription.getDeadLetterRoutingKey() != null
                    ? subscription.getDeadLetterRoutingKey()
                    : subscription.getDeadLetterChannelName();

            DirectExchange dlx = new DirectExchange(dlxName, true, false);
            Queue dlq = QueueBuilder.durable(subscription.getDeadLetterChannelName()).build();
            admin.declareExchange(dlx);
            admin.declareQueue(dlq);
            admin.declareBinding(new Binding(dlq.getName(), Binding.DestinationType.QUEUE, dlxName, dlRoutingKey, null));

            queueBuilder.withArgument("x-dead-letter-exchange", dlxName);
            queueBuilder.withArgument("x-dead-letter-routing-key", dlRoutingKey);

            log.info("DLQ enabled → queue={} dlx={} dlq={}",
                    subscription.getQueueName(), dlxName, subscription.getDeadLetterChannelName());
        }

        Queue queue = queueBuilder.build();
        admin.declareQueue(queue);
        admin.declareBinding(new Binding(queue.getName(), Binding.DestinationType.QUEUE,
                connection.getExchange(), subscription.getRoutingKey(), null));

        log.info("Binding created: queue={} exchange={} routingKey={}",
                queue.getName(), connection.getExchange(), subscription.getRoutingKey());
    }

    private CachingConnectionFactory connectionFactory() {
        CachingConnectionFactory factory = connectionFactory;
        if (factory == null) {
            synchronized (this) {
                factory = connectionFactory;
                if (factory == null) {
                    factory = connection.createConnectionFactory();
                    connectionFactory = factory;
                }
            }
        }
        return factory;
    }

    @Override
    public void close() {
        CachingConnectionFactory factory = connectionFactory;
        if (factory != null) {
            factory.destroy();
        }
    }
}
