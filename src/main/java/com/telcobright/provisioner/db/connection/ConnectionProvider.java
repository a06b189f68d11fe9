package com.telcobright.provisioner.db.connection;

import com.telcobright.provisioner.core.config.DataSourceConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Hands out the two kinds of connection a provisioning run needs.
 *
 * <ul>
 *   <li>Administrative: server level, no target database, one fresh JDBC
 *       connection per call. Used to check, drop and create the database.</li>
 *   <li>Benchmark: scoped to the target database, drawn from a single-connection
 *       HikariCP pool that is only created on first use, after the database exists.</li>
 * </ul>
 *
 * Callers close each connection they obtain; {@link #releaseBenchmarkConnections()}
 * and {@link #close()} shut the pool down.
 */
public class ConnectionProvider implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionProvider.class);

    // jdbc:postgresql://host:port/database?params -> group 1 is everything up to the path
    private static final Pattern DATABASE_PATH = Pattern.compile("^(jdbc:postgresql://[^/?]*)(/[^?]*)?");
    private static final Pattern DATABASE_PARAM = Pattern.compile("(?i)(?<=[?&])(dbname|database)=[^&]*&?");

    private final String adminUrl;
    private final String benchmarkUrl;
    private final String username;
    private final String password;
    private final String database;

    private HikariDataSource benchmarkDataSource;

    public ConnectionProvider(DataSourceConfig config) {
        this.username = config.getUsername();
        this.password = config.getPassword();
        this.database = config.getDatabase();
        this.adminUrl = stripDatabase(config.getJdbcUrl());
        this.benchmarkUrl = withDatabase(adminUrl, database);

        logger.info("ConnectionProvider initialized: admin={}, benchmark={}", adminUrl, benchmarkUrl);
    }

    /**
     * Remove any database component from a PostgreSQL JDBC URL so it addresses
     * the server only.
     */
    public static String stripDatabase(String jdbcUrl) {
        Matcher path = DATABASE_PATH.matcher(jdbcUrl);
        String url = path.find() ? path.replaceFirst("$1/") : jdbcUrl;

        url = DATABASE_PARAM.matcher(url).replaceAll("");
        if (url.endsWith("?") || url.endsWith("&")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    /**
     * Insert a database name into a URL produced by {@link #stripDatabase(String)}.
     */
    public static String withDatabase(String serverUrl, String database) {
        int query = serverUrl.indexOf('?');
        if (query < 0) {
            return serverUrl + database;
        }
        return serverUrl.substring(0, query) + database + serverUrl.substring(query);
    }

    /**
     * Open a server-level connection. The caller owns and must close it.
     */
    public Connection getAdminConnection() throws SQLException {
        return DriverManager.getConnection(adminUrl, username, password);
    }

    /**
     * Borrow the connection to the target database. The caller must close it to
     * return it to the pool.
     */
    public synchronized Connection getBenchmarkConnection() throws SQLException {
        if (benchmarkDataSource == null) {
            try {
                benchmarkDataSource = new HikariDataSource(createBenchmarkConfig());
            } catch (HikariPool.PoolInitializationException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                String sqlState = cause instanceof SQLException ? ((SQLException) cause).getSQLState() : null;
                throw new SQLException("Cannot connect to benchmark database " + database + ": "
                    + cause.getMessage(), sqlState, e);
            }
        }
        return benchmarkDataSource.getConnection();
    }

    /**
     * Close the benchmark pool and its physical session. The next
     * {@link #getBenchmarkConnection()} opens a new pool.
     */
    public synchronized void releaseBenchmarkConnections() {
        if (benchmarkDataSource != null) {
            benchmarkDataSource.close();
            benchmarkDataSource = null;
            logger.info("Benchmark connection pool for {} closed", database);
        }
    }

    HikariConfig createBenchmarkConfig() {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(benchmarkUrl);
        config.setUsername(username);
        config.setPassword(password);
        config.setMaximumPoolSize(1);
        config.setMinimumIdle(0);
        config.setAutoCommit(true);
        config.setPoolName("provisioner-" + database);
        return config;
    }

    public String getAdminUrl() {
        return adminUrl;
    }

    public String getBenchmarkUrl() {
        return benchmarkUrl;
    }

    public String getDatabase() {
        return database;
    }

    @Override
    public void close() {
        releaseBenchmarkConnections();
    }
}
