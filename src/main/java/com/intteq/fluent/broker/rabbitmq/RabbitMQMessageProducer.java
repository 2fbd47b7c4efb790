package com.intteq.fluent.broker.rabbitmq;

import com.intteq.fluent.broker.core.Message;
import com.intteq.fluent.broker.core.MessageProducer;
import com.intteq.fluent.broker.core.OnMissingChannel;
import com.intteq.fluent.broker.core.RetryPolicy;
import com.intteq.fluent.broker.exception.MessagingPublishException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.util.Date;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sends messages of one publication to the connection's exchange through a {@link RabbitTemplate},
 * waiting for the publisher confirm.
 */
@Slf4j
public class RabbitMQMessageProducer implements MessageProducer {

    private final RabbitMQPublication publication;
    private final RabbitMQConnection connection;
    private final RabbitTemplate template;
    private final AmqpAdmin admin;
    private final RetryPolicy retryPolicy;
    private final Runnable onClose;
    private final AtomicBoolean exchangeDeclared = new AtomicBoolean();

    RabbitMQMessageProducer(RabbitMQPublication publication,
                            RabbitMQConnection connection,
                            RabbitTemplate template,
                            AmqpAdmin admin,
                            RetryPolicy retryPolicy,
                            Runnable onClose) {
        this.publication = publication;
        this.connection = connection;
        this.template = template;
        this.admin = admin;
        this.retryPolicy = retryPolicy;
        this.onClose = onClose;
    }

    @Override
    public RabbitMQPublication publication() {
        return publication;
    }

    @Override
    public void send(Message message) {
        try {
            ensureExchange();
            retryPolicy.execute("RabbitMQ publish " + publication.getRoutingKey(), () -> publish(message));

        } catch (RuntimeException ex) {
            log.error("Failed to publish message id={} exchange={} routingKey={}",
                    message.getId(), connection.getExchange(), publication.getRoutingKey(), ex);
            throw new MessagingPublishException("Failed to publish message " + message.getId(), ex);
        }
    }

    private void publish(Message message) {
        CorrelationData correlation = new CorrelationData(message.getId());
        template.send(connection.getExchange(), publication.getRoutingKey(), toAmqpMessage(message), correlation);

        long timeoutMs = publication.getWaitForConfirmsTimeout().toMillis();
        try {
            CorrelationData.Confirm confirm = correlation.getFuture().get(timeoutMs, TimeUnit.MILLISECONDS);
            if (!confirm.isAck()) {
                throw new IllegalStateException("Broker nacked message " + message.getId() + ": " + confirm.getReason());
            }
        } catch (TimeoutException e) {
            throw new IllegalStateException("No publisher confirm within " + timeoutMs + "ms for message " + message.getId(), e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Publisher confirm failed for message " + message.getId(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for publisher confirm", e);
        }
    }

    private void ensureExchange() {
        if (publication.getMakeChannels() != OnMissingChannel.CREATE || admin == null) {
            return;
        }
        if (exchangeDeclared.compareAndSet(false, true)) {
            Exchange exchange = new ExchangeBuilder(connection.getExchange(), connection.getExchangeType())
                    .durable(connection.isDurableExchange())
                    .build();
            try {
                admin.declareExchange(exchange);
            } catch (RuntimeException e) {
                exchangeDeclared.set(false);
                throw e;
            }
            log.info("Declared exchange: {} ({})", connection.getExchange(), connection.getExchangeType());
        }
    }

    private org.springframework.amqp.core.Message toAmqpMessage(Message message) {
        MessageProperties properties = new MessageProperties();
        properties.setMessageId(message.getId());
        properties.setContentType(message.getContentType());
        properties.setCorrelationId(message.getCorrelationId());
        properties.setTimestamp(Date.from(message.getTimestamp()));
        properties.setDeliveryMode(connection.isPersistMessages()
                ? MessageDeliveryMode.PERSISTENT
                : MessageDeliveryMode.NON_PERSISTENT);
        message.getHeaders().forEach(properties::setHeader);
        return new org.springframework.amqp.core.Message(message.getBody(), properties);
    }

    @Override
    public void close() {
        onClose.run();
    }
}
