package com.intteq.fluent.broker.azure;

import com.azure.messaging.servicebus.ServiceBusMessage;
import com.azure.messaging.servicebus.ServiceBusSenderClient;
import com.intteq.fluent.broker.core.Message;
import com.intteq.fluent.broker.core.MessageProducer;
import com.intteq.fluent.broker.core.RetryPolicy;
import com.intteq.fluent.broker.exception.MessagingPublishException;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Sends messages of one publication to its Service Bus topic. The sender client is created on the
 * first send.
 */
@Slf4j
public class AzureServiceBusMessageProducer implements MessageProducer {

    private final AzureServiceBusPublication publication;
    private final Supplier<ServiceBusSenderClient> senderFactory;
    private final Runnable ensureTopic;
    private final RetryPolicy retryPolicy;

    private volatile ServiceBusSenderClient sender;

    AzureServiceBusMessageProducer(AzureServiceBusPublication publication,
                                   Supplier<ServiceBusSenderClient> senderFactory,
                                   Runnable ensureTopic,
                                   RetryPolicy retryPolicy) {
        this.publication = publication;
        this.senderFactory = senderFactory;
        this.ensureTopic = ensureTopic;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public AzureServiceBusPublication publication() {
        return publication;
    }

    @Override
    public void send(Message message) {
        try {
            ServiceBusSenderClient client = sender();
            ServiceBusMessage azureMessage = toServiceBusMessage(message);
            retryPolicy.execute("Azure publish " + publication.getTopicName(), () -> client.sendMessage(azureMessage));

        } catch (RuntimeException ex) {
            log.error("Failed to publish message id={} topic={}", message.getId(), publication.getTopicName(), ex);
            throw new MessagingPublishException(
                    "Failed to send message to Azure Service Bus topic: " + publication.getTopicName(), ex);
        }
    }

    private ServiceBusSenderClient sender() {
        ServiceBusSenderClient client = sender;
        if (client == null) {
            synchronized (this) {
                client = sender;
                if (client == null) {
                    ensureTopic.run();
                    log.info("Creating Azure Service Bus sender for topic {}", publication.getTopicName());
                    client = senderFactory.get();
                    sender = client;
                }
            }
        }
        return client;
    }

    private ServiceBusMessage toServiceBusMessage(Message message) {
        ServiceBusMessage azureMessage = new ServiceBusMessage(message.getBody());
        azureMessage.setMessageId(message.getId());
        azureMessage.setContentType(message.getContentType());
        azureMessage.setCorrelationId(message.getCorrelationId());
        azureMessage.setSubject(publication.getSubject() != null ? publication.getSubject() : message.getRoutingKey());
        azureMessage.getApplicationProperties().putAll(message.getHeaders());
        return azureMessage;
    }

    @Override
    public void close() {
        ServiceBusSenderClient client = sender;
        if (client != null) {
            log.info("Closing Azure sender for topic {}", publication.getTopicName());
            client.close();
            sender = null;
        }
    }
}
