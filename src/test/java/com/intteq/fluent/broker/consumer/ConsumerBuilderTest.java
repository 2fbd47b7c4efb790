package com.intteq.fluent.broker.consumer;

import com.intteq.fluent.broker.BrokerFixtures;
import com.intteq.fluent.broker.DuplicateRoutePolicy;
import com.intteq.fluent.broker.capability.Inbox;
import com.intteq.fluent.broker.core.ChannelFactory;
import com.intteq.fluent.broker.core.ChannelResolver;
import com.intteq.fluent.broker.core.PolicyRegistry;
import com.intteq.fluent.broker.core.Subscription;
import com.intteq.fluent.broker.core.SubscriptionIdentity;
import com.intteq.fluent.broker.exception.DuplicateRouteException;
import com.intteq.fluent.broker.exception.MissingRequiredFieldException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

final class ConsumerBuilderTest {

    private final PolicyRegistry policies = PolicyRegistry.defaults();
    private final ChannelFactory rabbit = BrokerFixtures.channelFactory("rabbit");
    private final ChannelFactory redis = BrokerFixtures.channelFactory("redis");
    private final Subscription greet = BrokerFixtures.subscription("greet-sub", "greet-ch", "greet");
    private final Subscription farewell = BrokerFixtures.subscription("farewell-sub", "farewell-ch", "farewell");

    @Test
    void registrationOrderDoesNotChangeResolution() {
        ChannelResolver first = new ConsumerBuilder()
                .addChannelFactory(rabbit, List.of(greet))
                .addChannelFactory(redis, List.of(farewell))
                .build(policies, null)
                .getChannelResolver();
        ChannelResolver second = new ConsumerBuilder()
                .addChannelFactory(redis, List.of(farewell))
                .addChannelFactory(rabbit, List.of(greet))
                .build(policies, null)
                .getChannelResolver();

        for (ChannelResolver resolver : List.of(first, second)) {
            assertSame(rabbit, resolver.resolve(greet.identity()));
            assertSame(redis, resolver.resolve(farewell.identity()));
        }
    }

    @Test
    void subscriptionFallsBackToItsOwnThenDefaultFactory() {
        Subscription bound = BrokerFixtures.subscription("bound", "bound-ch", "bound", redis);

        ConsumersOptions options = new ConsumerBuilder()
                .setDefaultChannelFactory(rabbit)
                .addSubscription(bound)
                .addSubscription(greet)
                .build(policies, null);

        assertSame(redis, options.getChannelResolver().resolve(bound.identity()));
        assertSame(rabbit, options.getChannelResolver().resolve(greet.identity()));
        assertEquals(List.of(bound, greet), options.getSubscriptions());
    }

    @Test
    void subscriptionWithoutAnyFactoryFails() {
        ConsumerBuilder builder = new ConsumerBuilder().addSubscription(greet);

        MissingRequiredFieldException ex = assertThrows(MissingRequiredFieldException.class,
                () -> builder.build(policies, null));
        assertEquals("channelFactory", ex.getField());
    }

    @Test
    void collisionFollowsPolicy() {
        Subscription twin = BrokerFixtures.subscription("greet-sub", "greet-ch", "greet");

        ConsumerBuilder failing = new ConsumerBuilder()
                .setDuplicateRoutePolicy(DuplicateRoutePolicy.FAIL)
                .addChannelFactory(rabbit, List.of(greet))
                .addChannelFactory(redis, List.of(twin));
        assertThrows(DuplicateRouteException.class, () -> failing.build(policies, null));

        ConsumersOptions options = new ConsumerBuilder()
                .addChannelFactory(rabbit, List.of(greet))
                .addChannelFactory(redis, List.of(twin))
                .build(policies, null);
        assertSame(redis, options.getChannelResolver().resolve(SubscriptionIdentity.of("greet-sub", "greet-ch", "greet")));
        assertEquals(1, options.getSubscriptions().size());
    }

    @Test
    void explicitInboxWinsOverBuilderForm() {
        Inbox configured = mock(Inbox.class);
        Inbox explicit = mock(Inbox.class);

        ConsumersOptions options = new ConsumerBuilder()
                .setInbox(b -> b.setInbox(configured).setScope(InboxScope.COMMANDS))
                .setInbox(InboxConfiguration.builder().setInbox(explicit).setContextKey("orders").build())
                .build(policies, null);

        assertSame(explicit, options.getInboxConfiguration().inbox().orElseThrow());
        assertEquals("orders", options.getInboxConfiguration().getContextKey());
    }

    @Test
    void builderFormInboxIsUsedWhenNoExplicitOne() {
        Inbox inbox = mock(Inbox.class);

        ConsumersOptions options = new ConsumerBuilder()
                .setInbox(b -> b.setInbox(inbox).setActionOnExists(OnceOnlyAction.WARN))
                .build(policies, null);

        InboxConfiguration configuration = options.getInboxConfiguration();
        assertTrue(configuration.isEnabled());
        assertEquals(OnceOnlyAction.WARN, configuration.getActionOnExists());
        assertEquals(InboxScope.ALL, configuration.getScope());
    }

    @Test
    void noInboxMeansDisabled() {
        ConsumersOptions options = new ConsumerBuilder().build(policies, null);

        assertFalse(options.getInboxConfiguration().isEnabled());
        assertTrue(options.getSubscriptions().isEmpty());
        assertTrue(options.schedulerFactory().isEmpty());
    }
}
