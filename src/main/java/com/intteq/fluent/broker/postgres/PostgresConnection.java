package com.intteq.fluent.broker.postgres;

import com.intteq.fluent.broker.exception.MissingRequiredFieldException;
import lombok.Getter;
import lombok.ToString;
import org.postgresql.ds.PGSimpleDataSource;

import javax.sql.DataSource;
import java.util.regex.Pattern;

/**
 * PostgreSQL database settings and the queue table the transport reads and writes.
 */
@Getter
@ToString(exclude = "password")
public final class PostgresConnection {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String jdbcUrl;
    private final String username;
    private final String password;
    private final String schema;
    private final String queueTable;

    private PostgresConnection(Builder builder) {
        this.jdbcUrl = builder.jdbcUrl;
        this.username = builder.username;
        this.password = builder.password;
        this.schema = builder.schema;
        this.queueTable = builder.queueTable;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Schema-qualified queue table name, safe to splice into SQL. */
    public String qualifiedQueueTable() {
        return schema + "." + queueTable;
    }

    public DataSource createDataSource() {
        PGSimpleDataSource dataSource = new PGSimpleDataSource();
        dataSource.setUrl(jdbcUrl);
        if (username != null) {
            dataSource.setUser(username);
        }
        if (password != null) {
            dataSource.setPassword(password);
        }
        return dataSource;
    }

    public static final class Builder {

        private String jdbcUrl;
        private String username;
        private String password;
        private String schema = "public";
        private String queueTable = "fluent_messages";

        private Builder() {
        }

        /** e.g. {@code jdbc:postgresql://localhost:5432/orders}. */
        public Builder setJdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
            return this;
        }

        public Builder setUsername(String username) {
            this.username = username;
            return this;
        }

        public Builder setPassword(String password) {
            this.password = password;
            return this;
        }

        public Builder setSchema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder setQueueTable(String queueTable) {
            this.queueTable = queueTable;
            return this;
        }

        public PostgresConnection build() {
            if (jdbcUrl == null || jdbcUrl.isBlank()) {
                throw new MissingRequiredFieldException("PostgresConnection", "jdbcUrl");
            }
            if (schema == null || !IDENTIFIER.matcher(schema).matches()) {
                throw new IllegalArgumentException("PostgresConnection: invalid schema name '" + schema + "'");
            }
            if (queueTable == null || !IDENTIFIER.matcher(queueTable).matches()) {
                throw new IllegalArgumentException("PostgresConnection: invalid queue table name '" + queueTable + "'");
            }
            return new PostgresConnection(this);
        }
    }
}
