package com.intteq.fluent.broker;

import com.intteq.fluent.broker.capability.ArchiveProvider;
import com.intteq.fluent.broker.capability.Outbox;
import com.intteq.fluent.broker.core.ChannelFactory;
import com.intteq.fluent.broker.core.DestinationIdentity;
import com.intteq.fluent.broker.core.PolicyRegistry;
import com.intteq.fluent.broker.core.RetryPolicy;
import com.intteq.fluent.broker.core.SubscriptionIdentity;
import com.intteq.fluent.broker.exception.MissingConnectionException;
import com.intteq.fluent.broker.exception.MissingOutboxException;
import com.intteq.fluent.broker.exception.UnknownRouteException;
import com.intteq.fluent.broker.rabbitmq.RabbitMQChannelFactory;
import com.intteq.fluent.broker.rabbitmq.RabbitMQConfigurator;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

final class FluentBrokerBuilderTest {

    @Test
    void greetSubscriptionResolvesToRabbitFactory() {
        BrokerConfiguration configuration = new FluentBrokerBuilder()
                .using(new RabbitMQConfigurator()
                        .setConnection(c -> c.setHost("localhost").setExchange("paramore.brighter.exchange"))
                        .useSubscriptions(s -> s.addSubscription(b -> b
                                .setSubscriptionName("greet-sub")
                                .setChannelName("greet-ch")
                                .setRoutingKey("greet"))))
                .build();

        ChannelFactory factory = configuration.channelResolver()
                .resolve(SubscriptionIdentity.of("greet-sub", "greet-ch", "greet"));

        assertInstanceOf(RabbitMQChannelFactory.class, factory);
        assertEquals("paramore.brighter.exchange",
                ((RabbitMQChannelFactory) factory).getConnection().getExchange());
        assertThrows(UnknownRouteException.class, () -> configuration.channelResolver()
                .resolve(SubscriptionIdentity.of("other", "other-ch", "other")));
    }

    @Test
    void connectionMaySetAfterUseCalls() {
        RabbitMQConfigurator rabbit = new RabbitMQConfigurator()
                .usePublications(p -> p.addPublication(b -> b.setTopic("greet")));
        rabbit.setConnection(c -> c.setExchange("greetings"));

        BrokerConfiguration configuration = new FluentBrokerBuilder().using(rabbit).build();

        assertNotNull(configuration.producerRegistry().resolve(DestinationIdentity.of("greet")));
        configuration.producerRegistry().close();
    }

    @Test
    void missingConnectionRunsNoStepOfAnyConfigurator() {
        RecordingConfigurator connected = new RecordingConfigurator("connected").setConnection("conn");
        RecordingConfigurator disconnected = new RecordingConfigurator("disconnected");
        connected.record("subscriptions");
        disconnected.record("publications");

        FluentBrokerBuilder builder = new FluentBrokerBuilder().using(connected).using(disconnected);

        MissingConnectionException ex = assertThrows(MissingConnectionException.class, builder::build);
        assertEquals("disconnected", ex.getTransport());
        assertTrue(connected.ran.isEmpty());
        assertTrue(disconnected.ran.isEmpty());
    }

    @Test
    void configuratorStepsRunInDeclarationOrder() {
        RecordingConfigurator first = new RecordingConfigurator("first").setConnection("a");
        RecordingConfigurator second = new RecordingConfigurator("second").setConnection("b");
        List<String> order = new ArrayList<>();
        first.onStep(order::add);
        second.onStep(order::add);
        first.record("first-1").record("first-2");
        second.record("second-1");

        new FluentBrokerBuilder().using(first).using(second).build();

        assertEquals(List.of("first-1", "first-2", "second-1"), order);
    }

    @Test
    void transportsFromDifferentConfiguratorsAreCombined() {
        ChannelFactory redis = BrokerFixtures.channelFactory("redis");

        BrokerConfiguration configuration = new FluentBrokerBuilder()
                .using(new RabbitMQConfigurator()
                        .setConnection(c -> c.setExchange("greetings"))
                        .useSubscriptions(s -> s.addSubscription(b -> b
                                .setSubscriptionName("greet-sub")
                                .setQueue("greet-ch")
                                .setRoutingKey("greet"))))
                .subscriptions(c -> c.addChannelFactory(redis,
                        List.of(BrokerFixtures.subscription("farewell-sub", "farewell-ch", "farewell"))))
                .producers(p -> p.addMessageProducerFactory(BrokerFixtures.producerFactory("farewell")))
                .build();

        assertEquals(2, configuration.getConsumers().getSubscriptions().size());
        assertSame(redis, configuration.channelResolver()
                .resolve(SubscriptionIdentity.of("farewell-sub", "farewell-ch", "farewell")));
        assertInstanceOf(RabbitMQChannelFactory.class, configuration.channelResolver()
                .resolve(SubscriptionIdentity.of("greet-sub", "greet-ch", "greet")));
        assertEquals(1, configuration.producerRegistry().destinations().size());
    }

    @Test
    void archiverWithoutOutboxFails() {
        FluentBrokerBuilder builder = new FluentBrokerBuilder()
                .useOutboxArchiver(mock(ArchiveProvider.class), a -> a.setBatchSize(10));

        MissingOutboxException ex = assertThrows(MissingOutboxException.class, builder::build);
        assertEquals("outboxArchiver", ex.getFeature());
    }

    @Test
    void sweeperWithoutOutboxFails() {
        FluentBrokerBuilder builder = new FluentBrokerBuilder().useOutboxSweeper(s -> s.setBatchSize(10));

        assertThrows(MissingOutboxException.class, builder::build);
    }

    @Test
    void outboxEnablesSweeperAndArchiver() {
        ArchiveProvider archive = mock(ArchiveProvider.class);

        BrokerConfiguration configuration = new FluentBrokerBuilder()
                .producers(p -> p.setOutbox(mock(Outbox.class)))
                .useOutboxSweeper(s -> s.setTimerInterval(Duration.ofSeconds(1)))
                .useOutboxArchiver(archive, a -> a.setMinimumAge(Duration.ofHours(1)))
                .build();

        assertEquals(Duration.ofSeconds(1), configuration.outboxSweeper().orElseThrow().getTimerInterval());
        assertSame(archive, configuration.outboxArchiver().orElseThrow().getArchiveProvider());
    }

    @Test
    void emptyBuilderYieldsEmptyConfiguration() {
        BrokerConfiguration configuration = new FluentBrokerBuilder().build();

        assertTrue(configuration.channelResolver().identities().isEmpty());
        assertTrue(configuration.producerRegistry().destinations().isEmpty());
        assertTrue(configuration.luggageStore().isEmpty());
    }

    @Test
    void buildsOnlyOnce() {
        FluentBrokerBuilder builder = new FluentBrokerBuilder();
        builder.build();

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void policiesAreShared() {
        RetryPolicy slow = RetryPolicy.exponential(5, Duration.ofSeconds(1));

        BrokerConfiguration configuration = new FluentBrokerBuilder()
                .addPolicy("slow", slow)
                .setDefaultRetryPolicy(RetryPolicy.NONE)
                .build();

        assertSame(slow, configuration.getPolicies().getOrDefault("slow"));
        assertSame(RetryPolicy.NONE, configuration.getPolicies().getOrDefault(PolicyRegistry.DEFAULT_POLICY));
        assertSame(configuration.getPolicies(), configuration.getConsumers().getPolicies());
        assertSame(configuration.getPolicies(), configuration.getProducers().getPolicies());
    }

    /** Configurator over a plain string connection that records which steps ran. */
    static final class RecordingConfigurator extends TransportConfigurator<String, RecordingConfigurator> {

        private final String name;
        private final List<String> ran = new ArrayList<>();
        private java.util.function.Consumer<String> listener = step -> { };

        RecordingConfigurator(String name) {
            this.name = name;
        }

        RecordingConfigurator record(String step) {
            return addStep(fluent -> {
                connection();
                ran.add(step);
                listener.accept(step);
            });
        }

        void onStep(java.util.function.Consumer<String> listener) {
            this.listener = listener;
        }

        @Override
        protected RecordingConfigurator self() {
            return this;
        }

        @Override
        public String transportName() {
            return name;
        }
    }
}
