package com.intteq.fluent.broker;

import com.intteq.fluent.broker.capability.LuggageStore;
import com.intteq.fluent.broker.core.ChannelResolver;
import com.intteq.fluent.broker.core.PolicyRegistry;
import com.intteq.fluent.broker.core.ProducerRegistry;
import com.intteq.fluent.broker.consumer.ConsumersOptions;
import com.intteq.fluent.broker.producer.ProducersConfiguration;
import com.intteq.fluent.broker.producer.TimedOutboxArchiverOptions;
import com.intteq.fluent.broker.producer.TimedOutboxSweeperOptions;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Optional;

/**
 * Result of {@link FluentBrokerBuilder#build()}. Immutable.
 */
@Getter
@ToString
@RequiredArgsConstructor
public final class BrokerConfiguration {

    private final ConsumersOptions consumers;
    private final ProducersConfiguration producers;
    private final PolicyRegistry policies;
    private final TimedOutboxSweeperOptions outboxSweeper;
    private final TimedOutboxArchiverOptions outboxArchiver;
    private final LuggageStore luggageStore;

    public ChannelResolver channelResolver() {
        return consumers.getChannelResolver();
    }

    public ProducerRegistry producerRegistry() {
        return producers.getProducerRegistry();
    }

    public Optional<TimedOutboxSweeperOptions> outboxSweeper() {
        return Optional.ofNullable(outboxSweeper);
    }

    public Optional<TimedOutboxArchiverOptions> outboxArchiver() {
        return Optional.ofNullable(outboxArchiver);
    }

    public Optional<LuggageStore> luggageStore() {
        return Optional.ofNullable(luggageStore);
    }
}
