package com.intteq.fluent.broker.azure;

import com.azure.messaging.servicebus.ServiceBusReceiverClient;
import com.azure.messaging.servicebus.models.ServiceBusReceiveMode;
import com.intteq.fluent.broker.core.ChannelFactory;
import com.intteq.fluent.broker.core.Subscription;
import com.intteq.fluent.broker.exception.MessagingOperationException;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Opens peek-lock {@link AzureServiceBusChannel}s, first making sure the topic and subscription
 * exist as the subscription's {@code makeChannels} setting requires.
 */
@Slf4j
public class AzureServiceBusChannelFactory implements ChannelFactory {

    private final AzureServiceBusConnection connection;

    public AzureServiceBusChannelFactory(AzureServiceBusConnection connection) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
    }

    public AzureServiceBusConnection getConnection() {
        return connection;
    }

    @Override
    public AzureServiceBusChannel createChannel(Subscription subscription) {
        if (!(subscription instanceof AzureServiceBusSubscription azureSubscription)) {
            throw new IllegalArgumentException("AzureServiceBusChannelFactory requires an AzureServiceBusSubscription, got "
                    + subscription.getClass().getName());
        }

        try {
            new AzureTopology(connection.adminClient()).ensureSubscription(azureSubscription);

            ServiceBusReceiverClient receiver = connection.clientBuilder()
                    .receiver()
                    .topicName(azureSubscription.getTopicName())
                    .subscriptionName(azureSubscription.getServiceBusSubscriptionName())
                    .receiveMode(ServiceBusReceiveMode.PEEK_LOCK)
                    .disableAutoComplete()
                    .prefetchCount(Math.max(0, azureSubscription.getBufferSize() - 1))
                    .buildClient();

            log.info("Azure Service Bus channel created: topic={} subscription={}",
                    azureSubscription.getTopicName(), azureSubscription.getServiceBusSubscriptionName());
            return new AzureServiceBusChannel(azureSubscription, receiver);

        } catch (MessagingOperationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MessagingOperationException("Failed to create Azure Service Bus channel for "
                    + azureSubscription.getTopicName() + "/" + azureSubscription.getServiceBusSubscriptionName(), e);
        }
    }
}
