package com.intteq.fluent.broker.postgres;

import com.intteq.fluent.broker.core.Channel;
import com.intteq.fluent.broker.core.Message;
import com.intteq.fluent.broker.exception.MessagingOperationException;
import com.intteq.fluent.broker.internal.MessageEnvelopeCodec;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Claims rows of one routing key with {@code FOR UPDATE SKIP LOCKED}. A claimed row is hidden for
 * the visibility timeout; if it is neither acknowledged nor requeued in time it becomes visible
 * again.
 */
@Slf4j
public class PostgresChannel implements Channel {

    private static final Duration POLL_INTERVAL = Duration.ofMillis(100);

    private final PostgresSubscription subscription;
    private final DataSource dataSource;
    private final PostgresQueueTable table;
    private final MessageEnvelopeCodec codec;

    /** Row ids of claimed, unsettled messages keyed by message id. */
    private final Map<String, Long> pending = new HashMap<>();

    PostgresChannel(PostgresSubscription subscription,
                    DataSource dataSource,
                    PostgresQueueTable table,
                    MessageEnvelopeCodec codec) {
        this.subscription = subscription;
        this.dataSource = dataSource;
        this.table = table;
        this.codec = codec;
    }

    @Override
    public PostgresSubscription subscription() {
        return subscription;
    }

    @Override
    public Optional<Message> receive(Duration timeout) {
        Instant deadline = Instant.now().plus(timeout);
        try {
            while (true) {
                Optional<Message> claimed = claim();
                if (claimed.isPresent() || !Instant.now().isBefore(deadline)) {
                    return claimed;
                }
                Thread.sleep(Math.min(POLL_INTERVAL.toMillis(),
                        Math.max(1, Duration.between(Instant.now(), deadline).toMillis())));
            }
        } catch (SQLException e) {
            throw new MessagingOperationException("Failed to receive from " + table.name()
                    + " queue " + subscription.getRoutingKey(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    private Optional<Message> claim() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(table.claimSql)) {
            ps.setLong(1, subscription.getVisibilityTimeout().toMillis());
            ps.setString(2, subscription.getRoutingKey());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                long rowId = rs.getLong("id");
                Message message = codec.decode(rs.getString("payload"));
                pending.put(message.getId(), rowId);
                return Optional.of(message);
            }
        }
    }

    @Override
    public void acknowledge(Message message) {
        settle(message, "acknowledge", rowId -> update(table.deleteSql, ps -> ps.setLong(1, rowId)));
    }

    /** Deletes the row; the queue table has no dead letter store. */
    @Override
    public void reject(Message message) {
        settle(message, "reject", rowId -> {
            update(table.deleteSql, ps -> ps.setLong(1, rowId));
            log.warn("Message {} rejected and removed from {}", message.getId(), table.name());
        });
    }

    @Override
    public void requeue(Message message) {
        long delayMs = subscription.getRequeueDelay() != null ? subscription.getRequeueDelay().toMillis() : 0L;
        settle(message, "requeue", rowId -> update(table.releaseSql, ps -> {
            ps.setLong(1, delayMs);
            ps.setLong(2, rowId);
        }));
    }

    @Override
    public void close() {
        if (!pending.isEmpty()) {
            log.info("Closing channel for {} with {} unsettled messages; they reappear after the visibility timeout",
                    subscription.getRoutingKey(), pending.size());
        }
        pending.clear();
    }

    private void settle(Message message, String operation, RowAction action) {
        Long rowId = pending.remove(message.getId());
        if (rowId == null) {
            log.warn("Cannot {} message {} on {}: no pending delivery", operation, message.getId(), table.name());
            return;
        }
        try {
            action.apply(rowId);
            log.debug("{} message {} (row {}) on {}", operation, message.getId(), rowId, table.name());
        } catch (SQLException e) {
            throw new MessagingOperationException(
                    "Failed to " + operation + " message " + message.getId() + " on " + table.name(), e);
        }
    }

    private void update(String sql, StatementBinder binder) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            ps.executeUpdate();
        }
    }

    @FunctionalInterface
    private interface RowAction {
        void apply(long rowId) throws SQLException;
    }

    @FunctionalInterface
    interface StatementBinder {
        void bind(PreparedStatement ps) throws SQLException;
    }
}
