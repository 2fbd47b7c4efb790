package com.intteq.fluent.broker.rabbitmq;

import com.intteq.fluent.broker.core.Message;
import com.intteq.fluent.broker.core.OnMissingChannel;
import com.intteq.fluent.broker.core.RetryPolicy;
import com.intteq.fluent.broker.exception.MessagingPublishException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

final class RabbitMQMessageProducerTest {

    private final RabbitMQConnection connection = RabbitMQConnection.builder().setExchange("greetings").build();
    private RabbitTemplate template;
    private AmqpAdmin admin;

    @BeforeEach
    void setUp() {
        template = mock(RabbitTemplate.class);
        admin = mock(AmqpAdmin.class);
    }

    @Test
    void sendsToExchangeAndWaitsForConfirm() {
        confirmWith(true);
        RabbitMQMessageProducer producer = producer(OnMissingChannel.CREATE, RetryPolicy.NONE);

        producer.send(Message.builder().id("m-1").routingKey("greet").header("tenant", "acme").build());

        ArgumentCaptor<org.springframework.amqp.core.Message> sent =
                ArgumentCaptor.forClass(org.springframework.amqp.core.Message.class);
        verify(template).send(eq("greetings"), eq("greet"), sent.capture(), any(CorrelationData.class));
        assertEquals("m-1", sent.getValue().getMessageProperties().getMessageId());
        assertEquals("acme", sent.getValue().getMessageProperties().getHeader("tenant"));
        assertEquals(MessageDeliveryMode.PERSISTENT, sent.getValue().getMessageProperties().getDeliveryMode());
    }

    @Test
    void declaresExchangeOnlyOnce() {
        confirmWith(true);
        RabbitMQMessageProducer producer = producer(OnMissingChannel.CREATE, RetryPolicy.NONE);

        producer.send(Message.builder().routingKey("greet").build());
        producer.send(Message.builder().routingKey("greet").build());

        verify(admin, times(1)).declareExchange(any(Exchange.class));
    }

    @Test
    void assumeModeDeclaresNothing() {
        confirmWith(true);

        producer(OnMissingChannel.ASSUME, RetryPolicy.NONE).send(Message.builder().routingKey("greet").build());

        verifyNoInteractions(admin);
    }

    @Test
    void nackIsRetriedThenReported() {
        confirmWith(false);
        RabbitMQMessageProducer producer = producer(OnMissingChannel.ASSUME, RetryPolicy.fixed(2, Duration.ZERO));

        assertThrows(MessagingPublishException.class, () -> producer.send(Message.builder().routingKey("greet").build()));

        verify(template, times(2)).send(anyString(), anyString(), any(org.springframework.amqp.core.Message.class),
                any(CorrelationData.class));
    }

    private void confirmWith(boolean ack) {
        doAnswer(invocation -> {
            CorrelationData correlation = invocation.getArgument(3);
            correlation.getFuture().complete(new CorrelationData.Confirm(ack, ack ? null : "rejected"));
            return null;
        }).when(template).send(anyString(), anyString(), any(org.springframework.amqp.core.Message.class),
                any(CorrelationData.class));
    }

    private RabbitMQMessageProducer producer(OnMissingChannel makeChannels, RetryPolicy retryPolicy) {
        RabbitMQPublication publication = RabbitMQPublication.builder()
                .setTopic("greet")
                .setMakeChannels(makeChannels)
                .build();
        return new RabbitMQMessageProducer(publication, connection, template, admin, retryPolicy, () -> { });
    }
}
