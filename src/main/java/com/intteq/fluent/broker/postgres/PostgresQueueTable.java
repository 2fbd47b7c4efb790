package com.intteq.fluent.broker.postgres;

import com.intteq.fluent.broker.core.OnMissingChannel;
import com.intteq.fluent.broker.exception.MessagingOperationException;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SQL of the queue table and its one-time creation or verification.
 *
 * <p>Table: {@code (id, queue, message_id, payload, visible_at, delivery_count, created_at)}.
 */
@Slf4j
class PostgresQueueTable {

    private final String table;
    private final AtomicBoolean checked = new AtomicBoolean();

    final String insertSql;
    final String claimSql;
    final String deleteSql;
    final String releaseSql;

    PostgresQueueTable(PostgresConnection connection) {
        this.table = connection.qualifiedQueueTable();
        this.insertSql = "INSERT INTO " + table + " (queue, message_id, payload) VALUES (?, ?, ?)";
        this.claimSql = "UPDATE " + table
                + " SET visible_at = now() + (? * interval '1 millisecond'), delivery_count = delivery_count + 1"
                + " WHERE id = (SELECT id FROM " + table
                + " WHERE queue = ? AND visible_at <= now() ORDER BY id LIMIT 1 FOR UPDATE SKIP LOCKED)"
                + " RETURNING id, payload";
        this.deleteSql = "DELETE FROM " + table + " WHERE id = ?";
        this.releaseSql = "UPDATE " + table + " SET visible_at = now() + (? * interval '1 millisecond') WHERE id = ?";
    }

    String name() {
        return table;
    }

    /**
     * Creates or verifies the table until one attempt succeeds. {@code ASSUME} does nothing.
     * Concurrent first calls may both run the DDL, which is idempotent.
     */
    void ensure(DataSource dataSource, OnMissingChannel makeChannels) {
        if (makeChannels == OnMissingChannel.ASSUME || checked.get()) {
            return;
        }
        try (Connection conn = dataSource.getConnection()) {
            if (makeChannels == OnMissingChannel.CREATE) {
                try (Statement statement = conn.createStatement()) {
                    statement.execute("CREATE TABLE IF NOT EXISTS " + table + " ("
                            + "id BIGSERIAL PRIMARY KEY, "
                            + "queue TEXT NOT NULL, "
                            + "message_id TEXT NOT NULL, "
                            + "payload TEXT NOT NULL, "
                            + "visible_at TIMESTAMPTZ NOT NULL DEFAULT now(), "
                            + "delivery_count INT NOT NULL DEFAULT 0, "
                            + "created_at TIMESTAMPTZ NOT NULL DEFAULT now())");
                    statement.execute("CREATE INDEX IF NOT EXISTS " + table.replace('.', '_') + "_queue_idx ON "
                            + table + " (queue, visible_at, id)");
                }
                log.info("Queue table ready: {}", table);
            } else {
                try (PreparedStatement ps = conn.prepareStatement("SELECT to_regclass(?)")) {
                    ps.setString(1, table);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next() || rs.getString(1) == null) {
                            throw new MessagingOperationException("Queue table does not exist: " + table);
                        }
                    }
                }
            }
            checked.set(true);
        } catch (SQLException e) {
            throw new MessagingOperationException("Failed to prepare queue table " + table, e);
        }
    }
}
