package com.intteq.fluent.broker.postgres;

import com.intteq.fluent.broker.core.DestinationIdentity;
import com.intteq.fluent.broker.core.MessageProducer;
import com.intteq.fluent.broker.core.MessageProducerFactory;
import com.intteq.fluent.broker.core.PolicyRegistry;
import com.intteq.fluent.broker.internal.MessageEnvelopeCodec;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Creates one {@link PostgresMessageProducer} per publication over a shared data source.
 */
@Slf4j
public class PostgresMessageProducerFactory implements MessageProducerFactory {

    private final PostgresConnection connection;
    private final List<PostgresPublication> publications;

    public PostgresMessageProducerFactory(PostgresConnection connection, List<PostgresPublication> publications) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.publications = List.copyOf(publications);
    }

    @Override
    public Map<DestinationIdentity, MessageProducer> create(PolicyRegistry policies) {
        Map<DestinationIdentity, MessageProducer> producers = new LinkedHashMap<>();
        if (publications.isEmpty()) {
            return producers;
        }

        DataSource dataSource = connection.createDataSource();
        PostgresQueueTable table = new PostgresQueueTable(connection);
        MessageEnvelopeCodec codec = new MessageEnvelopeCodec();

        for (PostgresPublication publication : publications) {
            producers.put(publication.destination(), new PostgresMessageProducer(
                    publication, dataSource, table, codec,
                    policies.getOrDefault(publication.getRetryPolicyName())));
            log.info("Postgres producer created: table={} queue={}", table.name(), publication.getRoutingKey());
        }
        return producers;
    }
}
