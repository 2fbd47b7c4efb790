package com.intteq.fluent.broker.producer;

import com.intteq.fluent.broker.DuplicateRoutePolicy;
import com.intteq.fluent.broker.capability.BoxTransactionProvider;
import com.intteq.fluent.broker.capability.DistributedLock;
import com.intteq.fluent.broker.capability.MessageScheduler;
import com.intteq.fluent.broker.capability.MessageSchedulerFactory;
import com.intteq.fluent.broker.capability.Outbox;
import com.intteq.fluent.broker.core.MessageProducerFactory;
import com.intteq.fluent.broker.core.PolicyRegistry;
import com.intteq.fluent.broker.core.ProducerRegistry;
import com.intteq.fluent.broker.exception.MissingOutboxException;
import com.intteq.fluent.broker.internal.CombinedProducerRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Accumulates transport producer factories and outbox settings, then merges them into one
 * {@link ProducerRegistry}.
 */
@Slf4j
public class ProducerBuilder {

    private final List<MessageProducerFactory> factories = new ArrayList<>();
    private ProducerRegistry producerRegistry;
    private Outbox outbox;
    private int outboxBulkChunkSize = 100;
    private Duration outboxTimeout = Duration.ofMillis(300);
    private final Map<String, Object> outboxArgs = new LinkedHashMap<>();
    private DistributedLock distributedLock;
    private BoxTransactionProvider transactionProvider;
    private int maxOutstandingMessages = -1;
    private Duration maxOutstandingCheckInterval = Duration.ZERO;
    private DuplicateRoutePolicy duplicateRoutePolicy = DuplicateRoutePolicy.WARN;

    /** Appends a factory. Adding the same factory twice invokes it twice. */
    public ProducerBuilder addMessageProducerFactory(MessageProducerFactory factory) {
        factories.add(Objects.requireNonNull(factory, "factory must not be null"));
        return this;
    }

    /** Uses {@code registry} instead of the one merged from the producer factories. */
    public ProducerBuilder setProducerRegistry(ProducerRegistry registry) {
        this.producerRegistry = registry;
        return this;
    }

    public ProducerBuilder setOutbox(Outbox outbox) {
        this.outbox = outbox;
        return this;
    }

    public ProducerBuilder setOutboxBulkChunkSize(int outboxBulkChunkSize) {
        this.outboxBulkChunkSize = outboxBulkChunkSize;
        return this;
    }

    public ProducerBuilder setOutboxTimeout(Duration outboxTimeout) {
        this.outboxTimeout = outboxTimeout;
        return this;
    }

    public ProducerBuilder setOutboxArgs(Map<String, Object> outboxArgs) {
        this.outboxArgs.clear();
        this.outboxArgs.putAll(outboxArgs);
        return this;
    }

    public ProducerBuilder setDistributedLock(DistributedLock distributedLock) {
        this.distributedLock = distributedLock;
        return this;
    }

    /** Requires an outbox by the time {@link #build} runs. */
    public ProducerBuilder setTransactionProvider(BoxTransactionProvider transactionProvider) {
        this.transactionProvider = transactionProvider;
        return this;
    }

    public ProducerBuilder setMaxOutstandingMessages(int maxOutstandingMessages) {
        this.maxOutstandingMessages = maxOutstandingMessages;
        return this;
    }

    public ProducerBuilder setMaxOutstandingCheckInterval(Duration maxOutstandingCheckInterval) {
        this.maxOutstandingCheckInterval = maxOutstandingCheckInterval;
        return this;
    }

    public ProducerBuilder setDuplicateRoutePolicy(DuplicateRoutePolicy duplicateRoutePolicy) {
        this.duplicateRoutePolicy = Objects.requireNonNull(duplicateRoutePolicy, "duplicateRoutePolicy must not be null");
        return this;
    }

    public boolean hasOutbox() {
        return outbox != null;
    }

    public List<MessageProducerFactory> getFactories() {
        return Collections.unmodifiableList(factories);
    }

    /**
     * Validates the capability plan, then creates and merges the producers. Nothing is created
     * when validation fails.
     *
     * @throws MissingOutboxException when a transaction provider is set without an outbox
     */
    public ProducersConfiguration build(PolicyRegistry policies, MessageSchedulerFactory schedulerFactory) {
        if (transactionProvider != null && outbox == null) {
            throw new MissingOutboxException("transactionProvider");
        }

        ProducerRegistry registry = producerRegistry != null
                ? producerRegistry
                : CombinedProducerRegistry.from(factories, policies, duplicateRoutePolicy);

        MessageScheduler scheduler = schedulerFactory != null ? schedulerFactory.create(registry) : null;

        log.debug("Producer configuration built: {} factories, {} destinations, outbox={}",
                factories.size(), registry.destinations().size(), outbox != null);

        return ProducersConfiguration.builder()
                .producerRegistry(registry)
                .policies(policies)
                .outbox(outbox)
                .outboxBulkChunkSize(outboxBulkChunkSize)
                .outboxTimeout(outboxTimeout)
                .outboxArgs(Collections.unmodifiableMap(new LinkedHashMap<>(outboxArgs)))
                .distributedLock(distributedLock)
                .transactionProvider(transactionProvider)
                .maxOutstandingMessages(maxOutstandingMessages)
                .maxOutstandingCheckInterval(maxOutstandingCheckInterval)
                .scheduler(scheduler)
                .build();
    }
}
