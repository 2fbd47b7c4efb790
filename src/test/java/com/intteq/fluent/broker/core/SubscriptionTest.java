package com.intteq.fluent.broker.core;

import com.intteq.fluent.broker.BrokerFixtures.StubSubscription;
import com.intteq.fluent.broker.annotation.MessagingRoute;
import com.intteq.fluent.broker.exception.MissingRequiredFieldException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class SubscriptionTest {

    @MessagingRoute(topic = "greeting.created", channel = "greetings")
    static final class GreetingEvent {
    }

    static final class FarewellEvent {
    }

    @Test
    void appliesPumpDefaults() {
        StubSubscription subscription = StubSubscription.builder()
                .setSubscriptionName("greet-sub")
                .setChannelName("greet-ch")
                .setRoutingKey("greet")
                .build();

        assertEquals(SubscriptionIdentity.of("greet-sub", "greet-ch", "greet"), subscription.identity());
        assertEquals(1, subscription.getBufferSize());
        assertEquals(1, subscription.getNoOfPerformers());
        assertEquals(Duration.ofMillis(300), subscription.getTimeout());
        assertEquals(-1, subscription.getRequeueCount());
        assertEquals(OnMissingChannel.CREATE, subscription.getMakeChannels());
        assertNull(subscription.getChannelFactory());
    }

    @Test
    void missingIdentityFieldNamesTheField() {
        MissingRequiredFieldException ex = assertThrows(MissingRequiredFieldException.class,
                () -> StubSubscription.builder().setSubscriptionName("greet-sub").setRoutingKey("greet").build());

        assertEquals("StubSubscription", ex.getOwner());
        assertEquals("channelName", ex.getField());
    }

    @Test
    void blankFieldCountsAsMissing() {
        MissingRequiredFieldException ex = assertThrows(MissingRequiredFieldException.class,
                () -> StubSubscription.builder()
                        .setSubscriptionName(" ")
                        .setChannelName("greet-ch")
                        .setRoutingKey("greet")
                        .build());

        assertEquals("subscriptionName", ex.getField());
    }

    @Test
    void nullMakeChannelsIsRejected() {
        MissingRequiredFieldException ex = assertThrows(MissingRequiredFieldException.class,
                () -> StubSubscription.builder()
                        .setSubscriptionName("greet-sub")
                        .setChannelName("greet-ch")
                        .setRoutingKey("greet")
                        .setMakeChannels(null)
                        .build());

        assertEquals("makeChannels", ex.getField());
    }

    @Test
    void dataTypeAnnotationFillsUnsetFields() {
        StubSubscription subscription = StubSubscription.builder()
                .setDataType(GreetingEvent.class)
                .build();

        assertEquals(GreetingEvent.class.getName(), subscription.getSubscriptionName());
        assertEquals("greetings", subscription.getChannelName());
        assertEquals("greeting.created", subscription.getRoutingKey());
        assertEquals(GreetingEvent.class, subscription.getDataType());
    }

    @Test
    void explicitFieldsWinOverDataType() {
        StubSubscription subscription = StubSubscription.builder()
                .setChannelName("custom")
                .setDataType(GreetingEvent.class)
                .build();

        assertEquals("custom", subscription.getChannelName());
        assertEquals("greeting.created", subscription.getRoutingKey());
    }

    @Test
    void unannotatedDataTypeFallsBackToClassName() {
        StubSubscription subscription = StubSubscription.builder()
                .setDataType(FarewellEvent.class)
                .build();

        assertEquals(FarewellEvent.class.getName(), subscription.getSubscriptionName());
        assertEquals("FarewellEvent", subscription.getChannelName());
        assertEquals("FarewellEvent", subscription.getRoutingKey());
    }
}
