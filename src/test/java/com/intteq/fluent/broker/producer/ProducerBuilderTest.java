package com.intteq.fluent.broker.producer;

import com.intteq.fluent.broker.BrokerFixtures;
import com.intteq.fluent.broker.DuplicateRoutePolicy;
import com.intteq.fluent.broker.capability.BoxTransactionProvider;
import com.intteq.fluent.broker.capability.MessageScheduler;
import com.intteq.fluent.broker.capability.MessageSchedulerFactory;
import com.intteq.fluent.broker.capability.Outbox;
import com.intteq.fluent.broker.core.DestinationIdentity;
import com.intteq.fluent.broker.core.MessageProducerFactory;
import com.intteq.fluent.broker.core.PolicyRegistry;
import com.intteq.fluent.broker.core.ProducerRegistry;
import com.intteq.fluent.broker.exception.DuplicateRouteException;
import com.intteq.fluent.broker.exception.MissingOutboxException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

final class ProducerBuilderTest {

    private final PolicyRegistry policies = PolicyRegistry.defaults();

    @Test
    void mergesProducersOfEveryFactory() {
        ProducersConfiguration configuration = new ProducerBuilder()
                .addMessageProducerFactory(BrokerFixtures.producerFactory("greet"))
                .addMessageProducerFactory(BrokerFixtures.producerFactory("farewell", "wave"))
                .build(policies, null);

        assertEquals(Set.of(DestinationIdentity.of("greet"), DestinationIdentity.of("farewell"), DestinationIdentity.of("wave")),
                configuration.getProducerRegistry().destinations());
    }

    @Test
    void overlappingFactoriesFailUnderFailPolicy() {
        ProducerBuilder builder = new ProducerBuilder()
                .setDuplicateRoutePolicy(DuplicateRoutePolicy.FAIL)
                .addMessageProducerFactory(BrokerFixtures.producerFactory("greet"))
                .addMessageProducerFactory(BrokerFixtures.producerFactory("greet"));

        assertThrows(DuplicateRouteException.class, () -> builder.build(policies, null));
    }

    @Test
    void explicitRegistryReplacesFactories() {
        ProducerRegistry registry = mock(ProducerRegistry.class);
        MessageProducerFactory factory = mock(MessageProducerFactory.class);

        ProducersConfiguration configuration = new ProducerBuilder()
                .addMessageProducerFactory(factory)
                .setProducerRegistry(registry)
                .build(policies, null);

        assertSame(registry, configuration.getProducerRegistry());
        verifyNoInteractions(factory);
    }

    @Test
    void transactionProviderNeedsOutbox() {
        MessageProducerFactory factory = mock(MessageProducerFactory.class);
        ProducerBuilder builder = new ProducerBuilder()
                .addMessageProducerFactory(factory)
                .setTransactionProvider(mock(BoxTransactionProvider.class));

        MissingOutboxException ex = assertThrows(MissingOutboxException.class, () -> builder.build(policies, null));

        assertEquals("transactionProvider", ex.getFeature());
        verifyNoInteractions(factory);
    }

    @Test
    void carriesOutboxSettings() {
        Outbox outbox = mock(Outbox.class);
        BoxTransactionProvider transactions = mock(BoxTransactionProvider.class);

        ProducersConfiguration configuration = new ProducerBuilder()
                .setOutbox(outbox)
                .setTransactionProvider(transactions)
                .setOutboxBulkChunkSize(25)
                .setOutboxTimeout(Duration.ofSeconds(2))
                .setOutboxArgs(Map.of("table", "outbox"))
                .setMaxOutstandingMessages(500)
                .build(policies, null);

        assertSame(outbox, configuration.outbox().orElseThrow());
        assertSame(transactions, configuration.transactionProvider().orElseThrow());
        assertEquals(25, configuration.getOutboxBulkChunkSize());
        assertEquals(Duration.ofSeconds(2), configuration.getOutboxTimeout());
        assertEquals("outbox", configuration.getOutboxArgs().get("table"));
        assertEquals(500, configuration.getMaxOutstandingMessages());
        assertTrue(configuration.distributedLock().isEmpty());
    }

    @Test
    void schedulerIsCreatedFromTheFinalRegistry() {
        MessageScheduler scheduler = mock(MessageScheduler.class);
        MessageSchedulerFactory schedulerFactory = mock(MessageSchedulerFactory.class);
        when(schedulerFactory.create(any())).thenReturn(scheduler);

        ProducersConfiguration configuration = new ProducerBuilder()
                .addMessageProducerFactory(BrokerFixtures.producerFactory("greet"))
                .build(policies, schedulerFactory);

        verify(schedulerFactory).create(configuration.getProducerRegistry());
        assertSame(scheduler, configuration.scheduler().orElseThrow());
    }
}
