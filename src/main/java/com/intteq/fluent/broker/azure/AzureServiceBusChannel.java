package com.intteq.fluent.broker.azure;

import com.azure.messaging.servicebus.ServiceBusReceivedMessage;
import com.azure.messaging.servicebus.ServiceBusReceiverClient;
import com.azure.messaging.servicebus.models.DeadLetterOptions;
import com.intteq.fluent.broker.core.Channel;
import com.intteq.fluent.broker.core.Message;
import com.intteq.fluent.broker.exception.MessagingOperationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Peek-lock receiver over one Service Bus subscription. Settlement: acknowledge completes,
 * reject dead-letters, requeue abandons the lock.
 */
@Slf4j
public class AzureServiceBusChannel implements Channel {

    private final AzureServiceBusSubscription subscription;
    private final ServiceBusReceiverClient receiver;

    private final Map<String, ServiceBusReceivedMessage> pending = new HashMap<>();

    AzureServiceBusChannel(AzureServiceBusSubscription subscription, ServiceBusReceiverClient receiver) {
        this.subscription = subscription;
        this.receiver = receiver;
    }

    @Override
    public AzureServiceBusSubscription subscription() {
        return subscription;
    }

    @Override
    public Optional<Message> receive(Duration timeout) {
        try {
            Iterator<ServiceBusReceivedMessage> received = receiver.receiveMessages(1, timeout).iterator();
            if (!received.hasNext()) {
                return Optional.empty();
            }
            ServiceBusReceivedMessage azureMessage = received.next();
            Message message = toMessage(azureMessage);
            pending.put(message.getId(), azureMessage);
            return Optional.of(message);

        } catch (RuntimeException e) {
            throw new MessagingOperationException("Failed to receive from " + describe(), e);
        }
    }

    @Override
    public void acknowledge(Message message) {
        settle(message, "complete", receiver::complete);
    }

    @Override
    public void reject(Message message) {
        settle(message, "dead-letter", azureMessage -> receiver.deadLetter(azureMessage, new DeadLetterOptions()
                .setDeadLetterReason("Rejected")
                .setDeadLetterErrorDescription("Message " + message.getId() + " rejected by consumer")));
    }

    @Override
    public void requeue(Message message) {
        settle(message, "abandon", receiver::abandon);
    }

    @Override
    public void close() {
        try {
            receiver.close();
        } catch (RuntimeException e) {
            log.warn("Failed to close Azure receiver for {}", describe(), e);
        }
    }

    private void settle(Message message, String operation, Consumer<ServiceBusReceivedMessage> settlement) {
        ServiceBusReceivedMessage azureMessage = pending.remove(message.getId());
        if (azureMessage == null) {
            log.warn("Cannot {} message {} on {}: no locked message", operation, message.getId(), describe());
            return;
        }
        try {
            settlement.accept(azureMessage);
            log.debug("{} message {} on {}", operation, message.getId(), describe());
        } catch (RuntimeException e) {
            throw new MessagingOperationException(
                    "Failed to " + operation + " message " + message.getId() + " on " + describe(), e);
        }
    }

    private Message toMessage(ServiceBusReceivedMessage azureMessage) {
        Map<String, String> headers = new HashMap<>();
        azureMessage.getApplicationProperties().forEach((key, value) -> headers.put(key, String.valueOf(value)));

        Message.MessageBuilder builder = Message.builder()
                .id(azureMessage.getMessageId() != null ? azureMessage.getMessageId() : UUID.randomUUID().toString())
                .routingKey(subscription.getTopicName())
                .correlationId(azureMessage.getCorrelationId())
                .headers(headers)
                .body(azureMessage.getBody() != null ? azureMessage.getBody().toBytes() : new byte[0]);

        if (azureMessage.getContentType() != null) {
            builder.contentType(azureMessage.getContentType());
        }
        if (azureMessage.getEnqueuedTime() != null) {
            builder.timestamp(azureMessage.getEnqueuedTime().toInstant());
        }
        return builder.build();
    }

    private String describe() {
        return subscription.getTopicName() + "/" + subscription.getServiceBusSubscriptionName();
    }
}
