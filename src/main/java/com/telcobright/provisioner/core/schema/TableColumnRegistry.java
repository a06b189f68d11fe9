package com.telcobright.provisioner.core.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Table name to ordered column names, as declared by the dataset header.
 *
 * <p>Holds the {@code tags} entry and one entry for the hypertable. The row loader
 * uses it to serialize rows in the same column order the tables were created with.
 * Immutable, so it can be shared with loader workers without synchronization.
 */
public final class TableColumnRegistry {

    public static final String TAGS_TABLE = "tags";

    private final Map<String, List<String>> columnsByTable;

    private TableColumnRegistry(Map<String, List<String>> columnsByTable) {
        this.columnsByTable = Collections.unmodifiableMap(columnsByTable);
    }

    public static TableColumnRegistry of(List<String> tagNames, String hypertable, List<String> fieldNames) {
        if (TAGS_TABLE.equals(hypertable)) {
            throw new IllegalArgumentException("Hypertable cannot be named '" + TAGS_TABLE + "'");
        }
        Map<String, List<String>> columns = new LinkedHashMap<>();
        columns.put(TAGS_TABLE, List.copyOf(tagNames));
        columns.put(hypertable, List.copyOf(fieldNames));
        return new TableColumnRegistry(columns);
    }

    /**
     * @throws IllegalArgumentException if the table is not registered
     */
    public List<String> getColumns(String table) {
        List<String> columns = columnsByTable.get(table);
        if (columns == null) {
            throw new IllegalArgumentException("No columns registered for table " + table);
        }
        return columns;
    }

    public List<String> getTagColumns() {
        return columnsByTable.get(TAGS_TABLE);
    }

    public boolean contains(String table) {
        return columnsByTable.containsKey(table);
    }

    public Set<String> getTables() {
        return columnsByTable.keySet();
    }

    public Map<String, List<String>> asMap() {
        return columnsByTable;
    }

    public int size() {
        return columnsByTable.size();
    }

    @Override
    public String toString() {
        return "TableColumnRegistry" + columnsByTable;
    }
}
