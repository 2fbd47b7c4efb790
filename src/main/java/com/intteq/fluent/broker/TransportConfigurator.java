package com.intteq.fluent.broker;

import com.intteq.fluent.broker.core.ChannelFactory;
import com.intteq.fluent.broker.core.MessageProducerFactory;
import com.intteq.fluent.broker.core.Publication;
import com.intteq.fluent.broker.core.PublicationCollector;
import com.intteq.fluent.broker.core.Subscription;
import com.intteq.fluent.broker.core.SubscriptionCollector;
import com.intteq.fluent.broker.exception.MissingConnectionException;
import com.intteq.fluent.broker.internal.ConfigurationSteps;

import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Base of the per-transport configurators.
 *
 * <p>A configurator owns one connection descriptor and a list of deferred steps. Every
 * {@code use*} call appends a step; nothing touches the {@link FluentBrokerBuilder} until
 * {@link #apply(FluentBrokerBuilder)} runs them in declaration order. Steps read the connection
 * when they run, so it may be set after the {@code use*} calls.
 *
 * @param <C>    the transport's connection descriptor
 * @param <SELF> the concrete configurator, returned by every fluent method
 */
public abstract class TransportConfigurator<C, SELF extends TransportConfigurator<C, SELF>> {

    private final ConfigurationSteps<FluentBrokerBuilder> steps = new ConfigurationSteps<>();
    private C connection;

    protected abstract SELF self();

    /** Name used in error messages, e.g. {@code "RabbitMQ"}. */
    public abstract String transportName();

    public SELF setConnection(C connection) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        return self();
    }

    public boolean hasConnection() {
        return connection != null;
    }

    /**
     * @throws MissingConnectionException when no connection was set
     */
    protected C connection() {
        if (connection == null) {
            throw new MissingConnectionException(transportName());
        }
        return connection;
    }

    protected SELF addStep(Consumer<FluentBrokerBuilder> step) {
        steps.add(step);
        return self();
    }

    /**
     * Registers a step that collects subscriptions against a channel factory created from the
     * connection and binds them on the consumer side.
     */
    protected <S extends Subscription, B extends Subscription.Builder<S, B>> SELF addSubscriptionsStep(
            Supplier<B> builders,
            Function<C, ? extends ChannelFactory> channelFactory,
            Consumer<SubscriptionCollector<S, B>> configure) {
        Objects.requireNonNull(configure, "configure must not be null");
        return addStep(fluent -> {
            ChannelFactory factory = channelFactory.apply(connection());
            SubscriptionCollector<S, B> collector = new SubscriptionCollector<>(builders, factory);
            configure.accept(collector);
            fluent.subscriptions(consumers -> consumers.addChannelFactory(factory, collector.getSubscriptions()));
        });
    }

    /**
     * Registers a step that collects publications and adds a producer factory for them.
     */
    protected <P extends Publication, B extends Publication.Builder<P, B>> SELF addPublicationsStep(
            Supplier<B> builders,
            BiFunction<C, List<P>, ? extends MessageProducerFactory> producerFactory,
            Consumer<PublicationCollector<P, B>> configure) {
        Objects.requireNonNull(configure, "configure must not be null");
        return addStep(fluent -> {
            PublicationCollector<P, B> collector = new PublicationCollector<>(builders);
            configure.accept(collector);
            MessageProducerFactory factory = producerFactory.apply(connection(), collector.getPublications());
            fluent.producers(producers -> producers.addMessageProducerFactory(factory));
        });
    }

    /**
     * Registers a step that creates a capability from the connection and hands it to
     * {@code sink}.
     */
    protected <X> SELF addCapabilityStep(Function<C, X> factory, BiConsumer<FluentBrokerBuilder, X> sink) {
        Objects.requireNonNull(factory, "factory must not be null");
        return addStep(fluent -> sink.accept(fluent, factory.apply(connection())));
    }

    /**
     * @throws MissingConnectionException when no connection was set
     */
    public void validate() {
        connection();
    }

    /**
     * Validates, then runs every registered step against {@code fluent}.
     */
    public void apply(FluentBrokerBuilder fluent) {
        validate();
        steps.applyTo(fluent);
    }

    public int stepCount() {
        return steps.size();
    }
}
