package com.intteq.fluent.broker.azure;

import com.intteq.fluent.broker.core.DestinationIdentity;
import com.intteq.fluent.broker.core.MessageProducer;
import com.intteq.fluent.broker.core.MessageProducerFactory;
import com.intteq.fluent.broker.core.PolicyRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Creates one {@link AzureServiceBusMessageProducer} per publication.
 */
@Slf4j
public class AzureServiceBusMessageProducerFactory implements MessageProducerFactory {

    private final AzureServiceBusConnection connection;
    private final List<AzureServiceBusPublication> publications;

    public AzureServiceBusMessageProducerFactory(AzureServiceBusConnection connection,
                                                 List<AzureServiceBusPublication> publications) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.publications = List.copyOf(publications);
    }

    @Override
    public Map<DestinationIdentity, MessageProducer> create(PolicyRegistry policies) {
        Map<DestinationIdentity, MessageProducer> producers = new LinkedHashMap<>();
        for (AzureServiceBusPublication publication : publications) {
            producers.put(publication.destination(), new AzureServiceBusMessageProducer(
                    publication,
                    () -> connection.clientBuilder().sender().topicName(publication.getTopicName()).buildClient(),
                    () -> new AzureTopology(connection.adminClient())
                            .ensureTopic(publication.getTopicName(), publication.getMakeChannels()),
                    policies.getOrDefault(publication.getRetryPolicyName())));
            log.info("Azure Service Bus producer created: topic={}", publication.getTopicName());
        }
        return producers;
    }
}
