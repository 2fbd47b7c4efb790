package com.intteq.fluent.broker;

import com.intteq.fluent.broker.capability.ArchiveProvider;
import com.intteq.fluent.broker.capability.LuggageStore;
import com.intteq.fluent.broker.capability.MessageSchedulerFactory;
import com.intteq.fluent.broker.consumer.ConsumerBuilder;
import com.intteq.fluent.broker.consumer.ConsumersOptions;
import com.intteq.fluent.broker.core.PolicyRegistry;
import com.intteq.fluent.broker.core.RetryPolicy;
import com.intteq.fluent.broker.exception.MissingOutboxException;
import com.intteq.fluent.broker.producer.ProducerBuilder;
import com.intteq.fluent.broker.producer.ProducersConfiguration;
import com.intteq.fluent.broker.producer.TimedOutboxArchiverOptions;
import com.intteq.fluent.broker.producer.TimedOutboxSweeperOptions;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Composes the contributions of any number of transport configurators into one
 * {@link BrokerConfiguration}.
 *
 * <pre>
 * BrokerConfiguration config = new FluentBrokerBuilder()
 *         .using(new RabbitMQConfigurator()
 *                 .setConnection(c -> c.setHost("localhost").setExchange("paramore.brighter.exchange"))
 *                 .useSubscriptions(s -> s.addSubscription(b -> b
 *                         .setSubscriptionName("greet-sub")
 *                         .setChannelName("greet-ch")
 *                         .setRoutingKey("greet"))))
 *         .build();
 * </pre>
 *
 * <p>{@code subscriptions(...)} and {@code producers(...)} act immediately; configurators are
 * deferred until {@link #build()}, which validates all of them before running any of their steps.
 * A builder builds exactly once.
 */
@Slf4j
public class FluentBrokerBuilder {

    private final ConsumerBuilder consumers = new ConsumerBuilder();
    private final ProducerBuilder producers = new ProducerBuilder();
    private final List<TransportConfigurator<?, ?>> configurators = new ArrayList<>();
    private final PolicyRegistry.Builder policies = PolicyRegistry.builder();

    private MessageSchedulerFactory schedulerFactory;
    private LuggageStore luggageStore;
    private Consumer<TimedOutboxSweeperOptions.Builder> outboxSweeper;
    private ArchiveProvider archiveProvider;
    private Consumer<TimedOutboxArchiverOptions.Builder> outboxArchiver;
    private boolean built;

    public FluentBrokerBuilder subscriptions(Consumer<ConsumerBuilder> configure) {
        configure.accept(consumers);
        return this;
    }

    public FluentBrokerBuilder producers(Consumer<ProducerBuilder> configure) {
        configure.accept(producers);
        return this;
    }

    /** Enqueues a transport configurator; its steps run during {@link #build()}. */
    public FluentBrokerBuilder using(TransportConfigurator<?, ?> configurator) {
        configurators.add(Objects.requireNonNull(configurator, "configurator must not be null"));
        return this;
    }

    /** Applies to both channel bindings and producer destinations. */
    public FluentBrokerBuilder setDuplicateRoutePolicy(DuplicateRoutePolicy policy) {
        consumers.setDuplicateRoutePolicy(policy);
        producers.setDuplicateRoutePolicy(policy);
        return this;
    }

    public FluentBrokerBuilder addPolicy(String name, RetryPolicy policy) {
        policies.add(name, policy);
        return this;
    }

    public FluentBrokerBuilder setDefaultRetryPolicy(RetryPolicy policy) {
        policies.setDefault(policy);
        return this;
    }

    public FluentBrokerBuilder useScheduler(MessageSchedulerFactory schedulerFactory) {
        this.schedulerFactory = schedulerFactory;
        return this;
    }

    public FluentBrokerBuilder setLuggageStore(LuggageStore luggageStore) {
        this.luggageStore = luggageStore;
        return this;
    }

    /** Requires an outbox at build time. */
    public FluentBrokerBuilder useOutboxSweeper(Consumer<TimedOutboxSweeperOptions.Builder> configure) {
        this.outboxSweeper = Objects.requireNonNull(configure, "configure must not be null");
        return this;
    }

    /** Requires an outbox at build time. */
    public FluentBrokerBuilder useOutboxArchiver(ArchiveProvider archiveProvider,
                                                 Consumer<TimedOutboxArchiverOptions.Builder> configure) {
        this.archiveProvider = Objects.requireNonNull(archiveProvider, "archiveProvider must not be null");
        this.outboxArchiver = Objects.requireNonNull(configure, "configure must not be null");
        return this;
    }

    /**
     * Builds the configuration.
     *
     * @throws com.intteq.fluent.broker.exception.MissingConnectionException when a configurator has no
     *                                                                       connection; no step has run
     * @throws MissingOutboxException                                        when an outbox-dependent feature
     *                                                                       is used without an outbox
     * @throws IllegalStateException                                         when called twice
     */
    public BrokerConfiguration build() {
        if (built) {
            throw new IllegalStateException("FluentBrokerBuilder.build() may only be called once");
        }
        built = true;

        configurators.forEach(TransportConfigurator::validate);
        for (TransportConfigurator<?, ?> configurator : configurators) {
            configurator.apply(this);
            log.debug("Applied {} configurator ({} steps)", configurator.transportName(), configurator.stepCount());
        }

        if (outboxSweeper != null && !producers.hasOutbox()) {
            throw new MissingOutboxException("outboxSweeper");
        }
        if (outboxArchiver != null && !producers.hasOutbox()) {
            throw new MissingOutboxException("outboxArchiver");
        }

        TimedOutboxSweeperOptions sweeper = null;
        if (outboxSweeper != null) {
            TimedOutboxSweeperOptions.Builder builder = TimedOutboxSweeperOptions.builder();
            outboxSweeper.accept(builder);
            sweeper = builder.build();
        }

        TimedOutboxArchiverOptions archiver = null;
        if (outboxArchiver != null) {
            TimedOutboxArchiverOptions.Builder builder = TimedOutboxArchiverOptions.builder(archiveProvider);
            outboxArchiver.accept(builder);
            archiver = builder.build();
        }

        PolicyRegistry policyRegistry = policies.build();
        ConsumersOptions consumersOptions = consumers.build(policyRegistry, schedulerFactory);
        ProducersConfiguration producersConfiguration = producers.build(policyRegistry, schedulerFactory);

        log.info("Fluent broker configuration built: transports={} subscriptions={} publications={}",
                configurators.size(),
                consumersOptions.getSubscriptions().size(),
                producersConfiguration.getProducerRegistry().destinations().size());

        return new BrokerConfiguration(consumersOptions, producersConfiguration, policyRegistry,
                sweeper, archiver, luggageStore);
    }
}
