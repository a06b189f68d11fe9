package com.telcobright.provisioner.core.schema;

import com.telcobright.provisioner.core.config.ProvisioningConfig;
import com.telcobright.provisioner.core.exception.HeaderFormatException;
import com.telcobright.provisioner.core.header.HeaderDescriptor;
import com.telcobright.provisioner.core.index.IndexPlanner;
import com.telcobright.provisioner.core.sql.ColumnDefinition;
import com.telcobright.provisioner.core.sql.DdlStatementBuilder;
import com.telcobright.provisioner.core.sql.DdlStatementBuilder.IndexKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a dataset header into the tags table, the measurement table and its indexes.
 *
 * <p>Tags are categorical and always stored as TEXT. Measurement fields are always
 * DOUBLE PRECISION. Every measurement row carries {@code time} and a {@code tags_id}
 * surrogate pointing at the tags table; with the in-table tag option the first tag
 * is also copied into the measurement table.
 */
public class SchemaPlanner {

    private static final Logger logger = LoggerFactory.getLogger(SchemaPlanner.class);

    public static final String TIME_COLUMN = "time";
    public static final String TAGS_ID_COLUMN = "tags_id";
    public static final String TAGS_UNIQUE_INDEX = "uniq1";

    private final DdlStatementBuilder ddl;
    private final IndexPlanner indexPlanner;

    public SchemaPlanner() {
        this(new DdlStatementBuilder());
    }

    public SchemaPlanner(DdlStatementBuilder ddl) {
        this.ddl = ddl;
        this.indexPlanner = new IndexPlanner(ddl);
    }

    /**
     * @throws HeaderFormatException if the tag line marker is wrong, there are no tags,
     *         or a table or column name is not a valid identifier
     * @throws com.telcobright.provisioner.core.exception.IndexConfigurationException
     *         for an unknown field index token
     */
    public SchemaPlan plan(HeaderDescriptor header, ProvisioningConfig config) {
        if (!HeaderDescriptor.TAGS_MARKER.equals(header.getMarker())) {
            throw new HeaderFormatException(String.format(
                "input header in wrong format. got '%s', expected '%s'",
                header.getMarker(), HeaderDescriptor.TAGS_MARKER));
        }
        List<String> tagNames = header.getTagNames();
        if (tagNames.isEmpty() || tagNames.get(0).isEmpty()) {
            throw new HeaderFormatException("input header in wrong format: no tag names after '"
                + HeaderDescriptor.TAGS_MARKER + "'");
        }

        try {
            return buildPlan(header, config, tagNames);
        } catch (IllegalArgumentException e) {
            throw new HeaderFormatException("input header in wrong format: " + e.getMessage(), e);
        }
    }

    private SchemaPlan buildPlan(HeaderDescriptor header, ProvisioningConfig config, List<String> tagNames) {
        String hypertable = header.getHypertableName();
        TableColumnRegistry registry = TableColumnRegistry.of(tagNames, hypertable, header.getFieldNames());
        String partitioningField = tagNames.get(0);

        List<String> tagsTableStatements = planTagsTable(tagNames);

        List<String> pseudoColumns = new ArrayList<>();
        if (config.isInTableTag()) {
            pseudoColumns.add(partitioningField);
        }
        pseudoColumns.addAll(header.getFieldNames());

        List<ColumnDefinition> columns = new ArrayList<>();
        columns.add(new ColumnDefinition(TIME_COLUMN, ColumnDefinition.TIMESTAMPTZ));
        columns.add(new ColumnDefinition(TAGS_ID_COLUMN, ColumnDefinition.INTEGER));

        List<String> fieldIndexes = new ArrayList<>();
        int extraColumns = config.isInTableTag() ? 1 : 0;
        for (int position = 0; position < pseudoColumns.size(); position++) {
            String field = pseudoColumns.get(position);
            if (field.isEmpty()) {
                continue;
            }
            if (config.isInTableTag() && position == 0) {
                columns.add(ColumnDefinition.text(field));
                continue;
            }
            columns.add(ColumnDefinition.doublePrecision(field));
            if (IndexPlanner.isWithinIndexLimit(position, config.getFieldIndexCount(), extraColumns)) {
                fieldIndexes.addAll(indexPlanner.planIndexes(hypertable, field, config.getFieldIndex()));
            }
        }

        String createTable = ddl.generateCreateTable(hypertable, columns);
        List<String> tableIndexes = planTableIndexes(hypertable, config);
        List<String> hypertableStatements = planHypertable(hypertable, config);

        logger.debug("Planned {}: {} columns, {} table indexes, {} field indexes, hypertable={}",
            hypertable, columns.size(), tableIndexes.size(), fieldIndexes.size(), config.isUseHypertable());

        return new SchemaPlan(registry, hypertable, partitioningField, columns, tagsTableStatements,
            createTable, tableIndexes, fieldIndexes, hypertableStatements);
    }

    private List<String> planTagsTable(List<String> tagNames) {
        IndexKey[] allTags = tagNames.stream().map(IndexKey::asc).toArray(IndexKey[]::new);
        List<String> statements = new ArrayList<>();
        statements.add(ddl.generateCreateTagsTable(TableColumnRegistry.TAGS_TABLE, tagNames));
        statements.add(ddl.generateCreateUniqueIndex(TAGS_UNIQUE_INDEX, TableColumnRegistry.TAGS_TABLE, allTags));
        statements.add(ddl.generateCreateIndex(TableColumnRegistry.TAGS_TABLE, IndexKey.asc(tagNames.get(0))));
        return statements;
    }

    /**
     * The partition index is independent of the time indexes. Of the two time
     * indexes, time-partition wins over plain time.
     */
    private List<String> planTableIndexes(String hypertable, ProvisioningConfig config) {
        List<String> statements = new ArrayList<>();
        if (config.isPartitionIndex()) {
            statements.add(ddl.generateCreateIndex(hypertable,
                IndexKey.asc(TAGS_ID_COLUMN), IndexKey.desc(TIME_COLUMN)));
        }

        if (config.isPartitionIndex() && config.isTimePartitionIndex()) {
            logger.warn("Both partition-index and time-partition-index are enabled on {}; creating both", hypertable);
        }
        if (config.isTimePartitionIndex()) {
            if (config.isTimeIndex()) {
                logger.warn("time-index is ignored because time-partition-index is enabled on {}", hypertable);
            }
            statements.add(ddl.generateCreateIndex(hypertable,
                IndexKey.desc(TIME_COLUMN), IndexKey.asc(TAGS_ID_COLUMN)));
        } else if (config.isTimeIndex()) {
            statements.add(ddl.generateCreateIndex(hypertable, IndexKey.desc(TIME_COLUMN)));
        }
        return statements;
    }

    private List<String> planHypertable(String hypertable, ProvisioningConfig config) {
        List<String> statements = new ArrayList<>();
        if (config.isUseHypertable()) {
            statements.add(ddl.generateCreateExtension(DdlStatementBuilder.TIMESCALE_EXTENSION));
            statements.add(ddl.generateCreateHypertable(hypertable, TIME_COLUMN, TAGS_ID_COLUMN,
                config.getNumberPartitions(), config.getChunkTime()));
        }
        return statements;
    }
}
