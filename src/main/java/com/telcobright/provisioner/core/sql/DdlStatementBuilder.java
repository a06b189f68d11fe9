package com.telcobright.provisioner.core.sql;

import java.time.Duration;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * PostgreSQL/TimescaleDB DDL generation for the benchmark schema.
 *
 * <p>Table and column names come from the dataset header, so every identifier is
 * checked against {@link #IDENTIFIER_PATTERN} before it is spliced into a statement.
 * Identifiers are emitted unquoted and therefore fold to lower case on the server.
 */
public class DdlStatementBuilder {

    public static final Pattern IDENTIFIER_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    // Database names are looked up in pg_database and in the JDBC URL as given, so they must already be folded
    public static final Pattern DATABASE_NAME_PATTERN = Pattern.compile("[a-z_][a-z0-9_]*");

    // NAMEDATALEN - 1
    public static final int MAX_IDENTIFIER_LENGTH = 63;

    public static final String DATABASE_EXISTS_QUERY = "SELECT 1 FROM pg_database WHERE datname = ?";

    public static final String TIMESCALE_EXTENSION = "timescaledb";

    /**
     * Validate an identifier and return it unchanged.
     *
     * @throws IllegalArgumentException if the name is empty, too long or contains
     *         characters outside the allowed set
     */
    public static String identifier(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }
        if (name.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(String.format(
                "Identifier '%s' exceeds %d characters", name, MAX_IDENTIFIER_LENGTH));
        }
        if (!IDENTIFIER_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid identifier '" + name + "'");
        }
        return name;
    }

    public static boolean isValidIdentifier(String name) {
        return name != null
            && !name.isEmpty()
            && name.length() <= MAX_IDENTIFIER_LENGTH
            && IDENTIFIER_PATTERN.matcher(name).matches();
    }

    /**
     * Validate a database name: a lower-case identifier.
     *
     * @throws IllegalArgumentException otherwise
     */
    public static String databaseName(String name) {
        identifier(name);
        if (!DATABASE_NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Database name must be lower case: '" + name + "'");
        }
        return name;
    }

    public static boolean isValidDatabaseName(String name) {
        return isValidIdentifier(name) && DATABASE_NAME_PATTERN.matcher(name).matches();
    }

    /**
     * Whole microseconds in {@code duration}.
     *
     * @throws IllegalArgumentException if the value does not fit in a long
     */
    public static long toMicros(Duration duration) {
        try {
            return Math.addExact(Math.multiplyExact(duration.getSeconds(), 1_000_000L), duration.getNano() / 1000);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Duration too large to express in microseconds: " + duration, e);
        }
    }

    // Database level

    public String generateDropDatabaseIfExists(String database) {
        return "DROP DATABASE IF EXISTS " + databaseName(database);
    }

    public String generateCreateDatabase(String database) {
        return "CREATE DATABASE " + databaseName(database);
    }

    // Tables

    /**
     * Tags table: a serial surrogate key plus one TEXT column per tag.
     */
    public String generateCreateTagsTable(String table, List<String> tagNames) {
        String columns = tagNames.stream()
            .map(tag -> identifier(tag) + " TEXT")
            .collect(Collectors.joining(", "));
        return String.format("CREATE TABLE %s(id SERIAL PRIMARY KEY, %s)", identifier(table), columns);
    }

    public String generateCreateTable(String table, List<ColumnDefinition> columns) {
        String columnList = columns.stream()
            .map(column -> identifier(column.getName()) + " " + column.getSqlType())
            .collect(Collectors.joining(", "));
        return String.format("CREATE TABLE %s (%s)", identifier(table), columnList);
    }

    // Indexes

    public String generateCreateIndex(String table, IndexKey... keys) {
        return "CREATE INDEX ON " + identifier(table) + "(" + render(keys) + ")";
    }

    public String generateCreateUniqueIndex(String indexName, String table, IndexKey... keys) {
        return String.format("CREATE UNIQUE INDEX %s ON %s(%s)",
            identifier(indexName), identifier(table), render(keys));
    }

    private static String render(IndexKey... keys) {
        if (keys.length == 0) {
            throw new IllegalArgumentException("An index needs at least one key column");
        }
        return Stream.of(keys).map(IndexKey::toSql).collect(Collectors.joining(", "));
    }

    // TimescaleDB

    public String generateCreateExtension(String extension) {
        return "CREATE EXTENSION IF NOT EXISTS " + identifier(extension) + " CASCADE";
    }

    /**
     * Convert a plain table into a hypertable partitioned on time and on a space
     * column. The chunk interval is given to TimescaleDB in microseconds.
     */
    public String generateCreateHypertable(String table, String timeColumn, String partitioningColumn,
                                           int numberPartitions, Duration chunkTime) {
        return String.format(
            "SELECT create_hypertable('%s'::regclass, '%s'::name, partitioning_column => '%s'::name, "
                + "number_partitions => %d::smallint, chunk_time_interval => %d, create_default_indexes=>FALSE)",
            identifier(table), identifier(timeColumn), identifier(partitioningColumn),
            numberPartitions, toMicros(chunkTime));
    }

    /**
     * One key column of an index, optionally descending.
     */
    public static final class IndexKey {
        private final String column;
        private final boolean descending;

        private IndexKey(String column, boolean descending) {
            this.column = identifier(column);
            this.descending = descending;
        }

        public static IndexKey asc(String column) {
            return new IndexKey(column, false);
        }

        public static IndexKey desc(String column) {
            return new IndexKey(column, true);
        }

        public String getColumn() { return column; }
        public boolean isDescending() { return descending; }

        String toSql() {
            return descending ? column + " DESC" : column;
        }

        @Override
        public String toString() {
            return toSql();
        }
    }
}
