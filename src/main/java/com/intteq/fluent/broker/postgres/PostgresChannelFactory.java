package com.intteq.fluent.broker.postgres;

import com.intteq.fluent.broker.core.ChannelFactory;
import com.intteq.fluent.broker.core.Subscription;
import com.intteq.fluent.broker.internal.MessageEnvelopeCodec;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * Opens {@link PostgresChannel}s over the connection's queue table.
 */
@Slf4j
public class PostgresChannelFactory implements ChannelFactory {

    private final PostgresConnection connection;
    private final DataSource dataSource;
    private final PostgresQueueTable table;
    private final MessageEnvelopeCodec codec = new MessageEnvelopeCodec();

    public PostgresChannelFactory(PostgresConnection connection) {
        this(connection, connection.createDataSource());
    }

    PostgresChannelFactory(PostgresConnection connection, DataSource dataSource) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.table = new PostgresQueueTable(connection);
    }

    public PostgresConnection getConnection() {
        return connection;
    }

    @Override
    public PostgresChannel createChannel(Subscription subscription) {
        if (!(subscription instanceof PostgresSubscription postgresSubscription)) {
            throw new IllegalArgumentException("PostgresChannelFactory requires a PostgresSubscription, got "
                    + subscription.getClass().getName());
        }

        table.ensure(dataSource, postgresSubscription.getMakeChannels());
        log.info("Postgres channel created: table={} queue={}", table.name(), postgresSubscription.getRoutingKey());
        return new PostgresChannel(postgresSubscription, dataSource, table, codec);
    }
}
