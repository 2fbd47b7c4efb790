package com.intteq.fluent.broker.rabbitmq;

import com.intteq.fluent.broker.core.DestinationIdentity;
import com.intteq.fluent.broker.core.MessageProducer;
import com.intteq.fluent.broker.core.MessageProducerFactory;
import com.intteq.fluent.broker.core.PolicyRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Creates one {@link RabbitMQMessageProducer} per publication. All producers share a single
 * connection factory and template.
 */
@Slf4j
public class RabbitMQMessageProducerFactory implements MessageProducerFactory {

    private final RabbitMQConnection connection;
    private final List<RabbitMQPublication> publications;

    public RabbitMQMessageProducerFactory(RabbitMQConnection connection, List<RabbitMQPublication> publications) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.publications = List.copyOf(publications);
    }

    public List<RabbitMQPublication> getPublications() {
        return publications;
    }

    @Override
    public Map<DestinationIdentity, MessageProducer> create(PolicyRegistry policies) {
        Map<DestinationIdentity, MessageProducer> producers = new LinkedHashMap<>();
        if (publications.isEmpty()) {
            return producers;
        }

        CachingConnectionFactory connectionFactory = connection.createConnectionFactory();
        RabbitTemplate template = rabbitTemplate(connectionFactory);
        RabbitAdmin admin = new RabbitAdmin(connectionFactory);

        for (RabbitMQPublication publication : publications) {
            producers.put(publication.destination(), new RabbitMQMessageProducer(
                    publication,
                    connection,
                    template,
                    admin,
                    policies.getOrDefault(publication.getRetryPolicyName()),
                    connectionFactory::destroy));
            log.info("RabbitMQ producer created: exchange={} routingKey={}",
                    connection.getExchange(), publication.getRoutingKey());
        }
        return producers;
    }

    private RabbitTemplate rabbitTemplate(CachingConnectionFactory connectionFactory) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMandatory(true);

        template.setConfirmCallback((CorrelationData cd, boolean ack, String cause) -> {
            if (ack) {
                log.debug("Publish confirmed: correlationId={}", cd != null ? cd.getId() : null);
            } else {
                log.error("Publish failed: correlationId={} cause={}",
                        cd != null ? cd.getId() : null, cause);
            }
        });

        template.setReturnsCallback(returned ->
                log.error("Returned message: exchange={} routingKey={} replyCode={} replyText={}",
                        returned.getExchange(),
                        returned.getRoutingKey(),
                        returned.getReplyCode(),
                        returned.getReplyText())
        );

        return template;
    }
}
