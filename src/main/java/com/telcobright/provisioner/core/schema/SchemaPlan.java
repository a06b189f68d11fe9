package com.telcobright.provisioner.core.schema;

import com.telcobright.provisioner.core.sql.ColumnDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything needed to stand up the benchmark schema, in execution order.
 */
public class SchemaPlan {

    private final TableColumnRegistry registry;
    private final String hypertable;
    private final String partitioningField;
    private final List<ColumnDefinition> measurementColumns;
    private final List<String> tagsTableStatements;
    private final String createMeasurementTable;
    private final List<String> tableIndexStatements;
    private final List<String> fieldIndexStatements;
    private final List<String> hypertableStatements;

    SchemaPlan(TableColumnRegistry registry,
               String hypertable,
               String partitioningField,
               List<ColumnDefinition> measurementColumns,
               List<String> tagsTableStatements,
               String createMeasurementTable,
               List<String> tableIndexStatements,
               List<String> fieldIndexStatements,
               List<String> hypertableStatements) {
        this.registry = registry;
        this.hypertable = hypertable;
        this.partitioningField = partitioningField;
        this.measurementColumns = List.copyOf(measurementColumns);
        this.tagsTableStatements = List.copyOf(tagsTableStatements);
        this.createMeasurementTable = createMeasurementTable;
        this.tableIndexStatements = List.copyOf(tableIndexStatements);
        this.fieldIndexStatements = List.copyOf(fieldIndexStatements);
        this.hypertableStatements = List.copyOf(hypertableStatements);
    }

    public TableColumnRegistry getRegistry() { return registry; }
    public String getHypertable() { return hypertable; }
    public String getPartitioningField() { return partitioningField; }
    public List<ColumnDefinition> getMeasurementColumns() { return measurementColumns; }
    public List<String> getTagsTableStatements() { return tagsTableStatements; }
    public String getCreateMeasurementTable() { return createMeasurementTable; }
    public List<String> getTableIndexStatements() { return tableIndexStatements; }
    public List<String> getFieldIndexStatements() { return fieldIndexStatements; }
    public List<String> getHypertableStatements() { return hypertableStatements; }

    /**
     * All statements: tags table, measurement table, table-level indexes,
     * field indexes, then extension and hypertable conversion.
     */
    public List<String> statements() {
        List<String> all = new ArrayList<>();
        all.addAll(tagsTableStatements);
        all.add(createMeasurementTable);
        all.addAll(tableIndexStatements);
        all.addAll(fieldIndexStatements);
        all.addAll(hypertableStatements);
        return Collections.unmodifiableList(all);
    }

    @Override
    public String toString() {
        return String.format("SchemaPlan[%s, %d columns, %d statements]",
            hypertable, measurementColumns.size(), statements().size());
    }
}
