package com.intteq.fluent.broker.azure;

import com.azure.core.exception.ResourceNotFoundException;
import com.azure.messaging.servicebus.administration.ServiceBusAdministrationClient;
import com.azure.messaging.servicebus.administration.models.CreateSubscriptionOptions;
import com.intteq.fluent.broker.core.OnMissingChannel;
import com.intteq.fluent.broker.core.RetryPolicy;
import com.intteq.fluent.broker.exception.MessagingOperationException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Ensures or verifies Service Bus topics and subscriptions through the administration client.
 */
@Slf4j
class AzureTopology {

    private static final RetryPolicy TOPOLOGY_RETRY = RetryPolicy.exponential(6, Duration.ofSeconds(1));

    private final ServiceBusAdministrationClient admin;

    AzureTopology(ServiceBusAdministrationClient admin) {
        this.admin = admin;
    }

    void ensureTopic(String topic, OnMissingChannel makeChannels) {
        if (makeChannels == OnMissingChannel.ASSUME) {
            return;
        }
        if (topicExists(topic)) {
            log.info("Topic already exists: {}", topic);
            return;
        }
        if (makeChannels == OnMissingChannel.VALIDATE) {
            throw new MessagingOperationException("Topic does not exist: " + topic);
        }
        TOPOLOGY_RETRY.execute("CreateTopic:" + topic, () -> admin.createTopic(topic));
        log.info("Topic created: {}", topic);
    }

    void ensureSubscription(AzureServiceBusSubscription subscription) {
        String topic = subscription.getTopicName();
        String name = subscription.getServiceBusSubscriptionName();

        ensureTopic(topic, subscription.getMakeChannels());
        if (subscription.getMakeChannels() == OnMissingChannel.ASSUME) {
            return;
        }

        log.info("Ensuring subscription exists: {} → {}", name, topic);
        if (subscriptionExists(topic, name)) {
            return;
        }
        if (subscription.getMakeChannels() == OnMissingChannel.VALIDATE) {
            throw new MessagingOperationException("Subscription does not exist: " + topic + "/" + name);
        }

        CreateSubscriptionOptions options = new CreateSubscriptionOptions()
                .setMaxDeliveryCount(subscription.getMaxDeliveryCount())
                .setLockDuration(subscription.getLockDuration())
                .setDeadLetteringOnMessageExpiration(subscription.isDeadLetteringOnMessageExpiration());
        if (subscription.getDefaultMessageTimeToLive() != null) {
            options.setDefaultMessageTimeToLive(subscription.getDefaultMessageTimeToLive());
        }

        TOPOLOGY_RETRY.execute("CreateSubscription:" + name, () -> admin.createSubscription(topic, name, options));
    }

    private boolean topicExists(String name) {
        try {
            admin.getTopic(name);
            return true;
        } catch (ResourceNotFoundException e) {
            return false;
        } catch (RuntimeException e) {
            log.error("Topic existence check failed: {}", name, e);
            throw e;
        }
    }

    private boolean subscriptionExists(String topic, String sub) {
        try {
            admin.getSubscription(topic, sub);
            return true;
        } catch (ResourceNotFoundException e) {
            return false;
        } catch (RuntimeException e) {
            log.error("Subscription existence check failed: {} / {}", topic, sub, e);
            throw e;
        }
    }
}
