package com.telcobright.provisioner.core.config;

import com.telcobright.provisioner.core.sql.DdlStatementBuilder;

/**
 * Connection settings for the benchmark server.
 *
 * <p>{@code jdbcUrl} may or may not name a database; administrative operations
 * strip it, benchmark operations replace it with {@code database}.
 */
public class DataSourceConfig {
    private final String jdbcUrl;
    private final String database;
    private final String username;
    private final String password;

    private DataSourceConfig(String jdbcUrl, String database, String username, String password) {
        this.jdbcUrl = jdbcUrl;
        this.database = database;
        this.username = username;
        this.password = password;
    }

    /**
     * Create a data source configuration with default credentials.
     */
    public static DataSourceConfig create(String jdbcUrl, String database) {
        return create(jdbcUrl, database, "postgres", "");
    }

    /**
     * Create a data source configuration with custom credentials.
     */
    public static DataSourceConfig create(String jdbcUrl, String database, String username, String password) {
        if (jdbcUrl == null || !jdbcUrl.startsWith("jdbc:postgresql://")) {
            throw new IllegalArgumentException("JDBC URL must start with jdbc:postgresql:// but was " + jdbcUrl);
        }
        if (!DdlStatementBuilder.isValidDatabaseName(database)) {
            throw new IllegalArgumentException("Invalid database name (lower-case identifier expected): " + database);
        }
        if (username == null) {
            username = "postgres";
        }
        if (password == null) {
            password = "";
        }
        return new DataSourceConfig(jdbcUrl, database, username, password);
    }

    public String getJdbcUrl() { return jdbcUrl; }
    public String getDatabase() { return database; }
    public String getUsername() { return username; }
    public String getPassword() { return password; }

    @Override
    public String toString() {
        return String.format("DataSource[%s -> %s]", jdbcUrl, database);
    }
}
