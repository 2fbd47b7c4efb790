package com.intteq.fluent.broker.azure;

import com.azure.core.exception.ResourceNotFoundException;
import com.azure.messaging.servicebus.administration.ServiceBusAdministrationClient;
import com.azure.messaging.servicebus.administration.models.CreateSubscriptionOptions;
import com.intteq.fluent.broker.core.OnMissingChannel;
import com.intteq.fluent.broker.exception.MessagingOperationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

final class AzureTopologyTest {

    private ServiceBusAdministrationClient admin;
    private AzureTopology topology;

    @BeforeEach
    void setUp() {
        admin = mock(ServiceBusAdministrationClient.class);
        topology = new AzureTopology(admin);
    }

    @Test
    void createsMissingTopicAndSubscription() {
        when(admin.getTopic("greet")).thenThrow(new ResourceNotFoundException("missing", null));
        when(admin.getSubscription("greet", "greet-ch")).thenThrow(new ResourceNotFoundException("missing", null));

        topology.ensureSubscription(subscription(OnMissingChannel.CREATE));

        verify(admin).createTopic("greet");
        verify(admin).createSubscription(eq("greet"), eq("greet-ch"), argThat((CreateSubscriptionOptions o) ->
                o.getMaxDeliveryCount() == 5 && o.getLockDuration().equals(Duration.ofSeconds(30))));
    }

    @Test
    void existingTopologyIsLeftAlone() {
        topology.ensureSubscription(subscription(OnMissingChannel.CREATE));

        verify(admin, never()).createTopic(anyString());
        verify(admin, never()).createSubscription(anyString(), anyString(), any(CreateSubscriptionOptions.class));
    }

    @Test
    void validateFailsOnMissingTopic() {
        when(admin.getTopic("greet")).thenThrow(new ResourceNotFoundException("missing", null));

        assertThrows(MessagingOperationException.class, () -> topology.ensureTopic("greet", OnMissingChannel.VALIDATE));
        verify(admin, never()).createTopic(anyString());
    }

    @Test
    void assumeTouchesNothing() {
        topology.ensureSubscription(subscription(OnMissingChannel.ASSUME));

        verifyNoInteractions(admin);
    }

    private AzureServiceBusSubscription subscription(OnMissingChannel makeChannels) {
        return AzureServiceBusSubscription.builder()
                .setSubscriptionName("greet-sub")
                .setChannelName("greet-ch")
                .setTopic("greet")
                .setMaxDeliveryCount(5)
                .setLockDuration(Duration.ofSeconds(30))
                .setMakeChannels(makeChannels)
                .build();
    }
}
