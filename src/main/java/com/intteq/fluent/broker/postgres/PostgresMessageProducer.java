package com.intteq.fluent.broker.postgres;

import com.intteq.fluent.broker.core.Message;
import com.intteq.fluent.broker.core.MessageProducer;
import com.intteq.fluent.broker.core.RetryPolicy;
import com.intteq.fluent.broker.exception.MessagingPublishException;
import com.intteq.fluent.broker.internal.MessageEnvelopeCodec;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Inserts one queue table row per message. Every send borrows its own JDBC connection.
 */
@Slf4j
public class PostgresMessageProducer implements MessageProducer {

    private final PostgresPublication publication;
    private final DataSource dataSource;
    private final PostgresQueueTable table;
    private final MessageEnvelopeCodec codec;
    private final RetryPolicy retryPolicy;

    PostgresMessageProducer(PostgresPublication publication,
                            DataSource dataSource,
                            PostgresQueueTable table,
                            MessageEnvelopeCodec codec,
                            RetryPolicy retryPolicy) {
        this.publication = publication;
        this.dataSource = dataSource;
        this.table = table;
        this.codec = codec;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public PostgresPublication publication() {
        return publication;
    }

    @Override
    public void send(Message message) {
        try {
            table.ensure(dataSource, publication.getMakeChannels());
            String payload = codec.encode(message);
            retryPolicy.execute("Postgres publish " + publication.getRoutingKey(), () -> insert(message, payload));

        } catch (RuntimeException ex) {
            log.error("Failed to publish message id={} table={} queue={}",
                    message.getId(), table.name(), publication.getRoutingKey(), ex);
            throw new MessagingPublishException("Failed to publish message " + message.getId(), ex);
        }
    }

    private void insert(Message message, String payload) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(table.insertSql)) {
            ps.setString(1, publication.getRoutingKey());
            ps.setString(2, message.getId());
            ps.setString(3, payload);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("SQL publish failed", e);
        }
    }

    @Override
    public void close() {
        log.debug("Postgres producer for {} closed", publication.getRoutingKey());
    }
}
