package com.telcobright.provisioner.db.executor;

import com.telcobright.provisioner.core.schema.SchemaPlan;
import com.telcobright.provisioner.core.sql.DdlStatementBuilder;
import com.telcobright.provisioner.db.connection.ConnectionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Runs database and table DDL against the benchmark server.
 *
 * <p>Every operation opens its own connection and closes it before returning,
 * on success or failure. SQL errors are propagated, never retried.
 */
public class DdlExecutor {

    private static final Logger logger = LoggerFactory.getLogger(DdlExecutor.class);

    private final ConnectionProvider connectionProvider;
    private final DdlStatementBuilder ddl;

    public DdlExecutor(ConnectionProvider connectionProvider) {
        this(connectionProvider, new DdlStatementBuilder());
    }

    public DdlExecutor(ConnectionProvider connectionProvider, DdlStatementBuilder ddl) {
        this.connectionProvider = connectionProvider;
        this.ddl = ddl;
    }

    public boolean databaseExists(String database) throws SQLException {
        try (Connection conn = connectionProvider.getAdminConnection();
             PreparedStatement stmt = conn.prepareStatement(DdlStatementBuilder.DATABASE_EXISTS_QUERY)) {

            stmt.setString(1, database);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * Drop the database if present. Succeeds when it is already absent.
     */
    public void dropDatabaseIfExists(String database) throws SQLException {
        String sql = ddl.generateDropDatabaseIfExists(database);
        try (Connection conn = connectionProvider.getAdminConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
            logger.info("Dropped database (if it existed): {}", database);
        }
    }

    public void createDatabase(String database) throws SQLException {
        String sql = ddl.generateCreateDatabase(database);
        try (Connection conn = connectionProvider.getAdminConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
            logger.info("Created database: {}", database);
        }
    }

    /**
     * Execute the plan's statements in order on the benchmark connection. The first
     * failure stops the run; later statements are not attempted. The benchmark
     * session is closed before returning, on success or failure.
     *
     * @return number of statements executed
     */
    public int execute(SchemaPlan plan) throws SQLException {
        List<String> statements = plan.statements();
        int executed = 0;
        try (Connection conn = connectionProvider.getBenchmarkConnection();
             Statement stmt = conn.createStatement()) {

            for (String sql : statements) {
                logger.debug("Executing: {}", sql);
                try {
                    stmt.execute(sql);
                } catch (SQLException e) {
                    logger.error("DDL failed after {} of {} statements: {}", executed, statements.size(), sql);
                    throw new SQLException("Failed to execute: " + sql + ": " + e.getMessage(),
                        e.getSQLState(), e.getErrorCode(), e);
                }
                executed++;
            }
        } finally {
            connectionProvider.releaseBenchmarkConnections();
        }
        logger.info("Schema for {} created with {} statements", plan.getHypertable(), executed);
        return executed;
    }
}
