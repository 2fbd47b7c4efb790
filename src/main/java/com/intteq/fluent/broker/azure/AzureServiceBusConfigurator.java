package com.intteq.fluent.broker.azure;

import com.intteq.fluent.broker.TransportConfigurator;
import com.intteq.fluent.broker.core.PublicationCollector;
import com.intteq.fluent.broker.core.SubscriptionCollector;

import java.util.function.Consumer;

/**
 * Fluent configuration of the Azure Service Bus transport.
 */
public class AzureServiceBusConfigurator
        extends TransportConfigurator<AzureServiceBusConnection, AzureServiceBusConfigurator> {

    @Override
    protected AzureServiceBusConfigurator self() {
        return this;
    }

    @Override
    public String transportName() {
        return "Azure Service Bus";
    }

    public AzureServiceBusConfigurator setConnection(Consumer<AzureServiceBusConnection.Builder> configure) {
        AzureServiceBusConnection.Builder builder = AzureServiceBusConnection.builder();
        configure.accept(builder);
        return setConnection(builder.build());
    }

    public AzureServiceBusConfigurator useSubscriptions(
            Consumer<SubscriptionCollector<AzureServiceBusSubscription, AzureServiceBusSubscription.Builder>> configure) {
        return addSubscriptionsStep(AzureServiceBusSubscription::builder, AzureServiceBusChannelFactory::new, configure);
    }

    public AzureServiceBusConfigurator usePublications(
            Consumer<PublicationCollector<AzureServiceBusPublication, AzureServiceBusPublication.Builder>> configure) {
        return addPublicationsStep(AzureServiceBusPublication::builder, AzureServiceBusMessageProducerFactory::new, configure);
    }
}
