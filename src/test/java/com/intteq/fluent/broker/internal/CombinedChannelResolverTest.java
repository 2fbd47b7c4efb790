package com.intteq.fluent.broker.internal;

import com.intteq.fluent.broker.BrokerFixtures;
import com.intteq.fluent.broker.DuplicateRoutePolicy;
import com.intteq.fluent.broker.core.Channel;
import com.intteq.fluent.broker.core.ChannelFactory;
import com.intteq.fluent.broker.core.Subscription;
import com.intteq.fluent.broker.core.SubscriptionIdentity;
import com.intteq.fluent.broker.exception.UnknownRouteException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

final class CombinedChannelResolverTest {

    @Test
    void resolvesBoundFactory() {
        ChannelFactory rabbit = BrokerFixtures.channelFactory("rabbit");
        ChannelFactory redis = BrokerFixtures.channelFactory("redis");
        CombinedChannelResolver resolver = resolver(rabbit, redis);

        assertSame(rabbit, resolver.resolve(SubscriptionIdentity.of("greet-sub", "greet-ch", "greet")));
        assertSame(redis, resolver.resolve(SubscriptionIdentity.of("farewell-sub", "farewell-ch", "farewell")));
        assertEquals(2, resolver.identities().size());
    }

    @Test
    void unknownIdentityFails() {
        CombinedChannelResolver resolver = resolver(BrokerFixtures.channelFactory("a"), BrokerFixtures.channelFactory("b"));
        SubscriptionIdentity other = SubscriptionIdentity.of("other", "other-ch", "other");

        UnknownRouteException ex = assertThrows(UnknownRouteException.class, () -> resolver.resolve(other));
        assertEquals(other, ex.getIdentity());
    }

    @Test
    void identityMatchesOnAllThreeFields() {
        CombinedChannelResolver resolver = resolver(BrokerFixtures.channelFactory("a"), BrokerFixtures.channelFactory("b"));

        assertThrows(UnknownRouteException.class,
                () -> resolver.resolve(SubscriptionIdentity.of("greet-sub", "greet-ch", "farewell")));
    }

    @Test
    void createChannelDelegatesToBoundFactory() {
        ChannelFactory factory = mock(ChannelFactory.class);
        Channel channel = mock(Channel.class);
        Subscription subscription = BrokerFixtures.subscription("greet-sub", "greet-ch", "greet");
        when(factory.createChannel(subscription)).thenReturn(channel);

        RouteTable.Builder<SubscriptionIdentity, ChannelFactory> table = RouteTable.builder("channel", DuplicateRoutePolicy.FAIL);
        table.put(subscription.identity(), factory);
        CombinedChannelResolver resolver = new CombinedChannelResolver(table.build());

        assertSame(channel, resolver.createChannel(subscription));
    }

    @Test
    void closeClosesEachCloseableFactoryOnce() throws Exception {
        ChannelFactory shared = mock(ChannelFactory.class, withSettings().extraInterfaces(AutoCloseable.class));
        ChannelFactory plain = BrokerFixtures.channelFactory("plain");

        CombinedChannelResolver resolver = resolver(shared, shared);
        resolver.close();
        resolver(plain, plain).close();

        verify((AutoCloseable) shared, times(1)).close();
    }

    @Test
    void closeContinuesPastFailingFactory() throws Exception {
        ChannelFactory failing = mock(ChannelFactory.class, withSettings().extraInterfaces(AutoCloseable.class));
        ChannelFactory healthy = mock(ChannelFactory.class, withSettings().extraInterfaces(AutoCloseable.class));
        doThrow(new IllegalStateException("boom")).when((AutoCloseable) failing).close();

        resolver(failing, healthy).close();

        verify((AutoCloseable) healthy).close();
    }

    @Test
    void closeReachesFactoryReplacedByDuplicateBinding() throws Exception {
        ChannelFactory replaced = mock(ChannelFactory.class, withSettings().extraInterfaces(AutoCloseable.class));
        ChannelFactory kept = BrokerFixtures.channelFactory("kept");
        SubscriptionIdentity greet = SubscriptionIdentity.of("greet-sub", "greet-ch", "greet");
        RouteTable.Builder<SubscriptionIdentity, ChannelFactory> table = RouteTable.builder("channel", DuplicateRoutePolicy.WARN);
        table.put(greet, replaced);
        table.put(greet, kept);

        CombinedChannelResolver resolver = new CombinedChannelResolver(table.build());
        assertSame(kept, resolver.resolve(greet));
        resolver.close();

        verify((AutoCloseable) replaced).close();
    }

    private static CombinedChannelResolver resolver(ChannelFactory greet, ChannelFactory farewell) {
        RouteTable.Builder<SubscriptionIdentity, ChannelFactory> table = RouteTable.builder("channel", DuplicateRoutePolicy.FAIL);
        table.put(SubscriptionIdentity.of("greet-sub", "greet-ch", "greet"), greet);
        table.put(SubscriptionIdentity.of("farewell-sub", "farewell-ch", "farewell"), farewell);
        return new CombinedChannelResolver(table.build());
    }
}
