package com.telcobright.provisioner.core.sql;

import java.util.Objects;

/**
 * Column of a generated table: name plus PostgreSQL type.
 */
public class ColumnDefinition {

    public static final String TIMESTAMPTZ = "timestamptz";
    public static final String INTEGER = "integer";
    public static final String TEXT = "TEXT";
    public static final String DOUBLE_PRECISION = "DOUBLE PRECISION";

    private final String name;
    private final String sqlType;

    public ColumnDefinition(String name, String sqlType) {
        this.name = Objects.requireNonNull(name, "name");
        this.sqlType = Objects.requireNonNull(sqlType, "sqlType");
    }

    public static ColumnDefinition text(String name) {
        return new ColumnDefinition(name, TEXT);
    }

    public static ColumnDefinition doublePrecision(String name) {
        return new ColumnDefinition(name, DOUBLE_PRECISION);
    }

    public String getName() { return name; }
    public String getSqlType() { return sqlType; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnDefinition)) return false;
        ColumnDefinition that = (ColumnDefinition) o;
        return name.equals(that.name) && sqlType.equals(that.sqlType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, sqlType);
    }

    @Override
    public String toString() {
        return name + " " + sqlType;
    }
}
