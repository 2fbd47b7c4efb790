package com.intteq.fluent.broker.producer;

import com.intteq.fluent.broker.capability.BoxTransactionProvider;
import com.intteq.fluent.broker.capability.DistributedLock;
import com.intteq.fluent.broker.capability.MessageScheduler;
import com.intteq.fluent.broker.capability.Outbox;
import com.intteq.fluent.broker.core.PolicyRegistry;
import com.intteq.fluent.broker.core.ProducerRegistry;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Finalized producer side: the producer registry and the outbox settings around it.
 */
@Getter
@Builder
@ToString
public final class ProducersConfiguration {

    private final ProducerRegistry producerRegistry;
    private final PolicyRegistry policies;
    private final Outbox outbox;
    private final int outboxBulkChunkSize;
    private final Duration outboxTimeout;
    private final Map<String, Object> outboxArgs;
    private final DistributedLock distributedLock;
    private final BoxTransactionProvider transactionProvider;
    private final int maxOutstandingMessages;
    private final Duration maxOutstandingCheckInterval;
    private final MessageScheduler scheduler;

    public Optional<Outbox> outbox() {
        return Optional.ofNullable(outbox);
    }

    public Optional<DistributedLock> distributedLock() {
        return Optional.ofNullable(distributedLock);
    }

    public Optional<BoxTransactionProvider> transactionProvider() {
        return Optional.ofNullable(transactionProvider);
    }

    public Optional<MessageScheduler> scheduler() {
        return Optional.ofNullable(scheduler);
    }
}
