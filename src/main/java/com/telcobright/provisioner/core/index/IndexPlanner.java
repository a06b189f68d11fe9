package com.telcobright.provisioner.core.index;

import com.telcobright.provisioner.core.sql.DdlStatementBuilder;
import com.telcobright.provisioner.core.sql.DdlStatementBuilder.IndexKey;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which per-field indexes are built on the measurement table.
 *
 * <p>Only fields in the first {@code fieldIndexCount} positions get indexes
 * ({@code -1} means every field). When the leading tag is stored in the
 * measurement table it occupies position 0, is never indexed here, and
 * shifts the limit by one.
 */
public class IndexPlanner {

    public static final int UNLIMITED = -1;

    private static final String TIME_COLUMN = "time";

    private final DdlStatementBuilder ddl;

    public IndexPlanner(DdlStatementBuilder ddl) {
        this.ddl = ddl;
    }

    /**
     * Index statements for one column.
     *
     * @param indexTypeSpec comma separated {@link FieldIndexType} tokens
     * @throws com.telcobright.provisioner.core.exception.IndexConfigurationException
     *         if any token is unknown; nothing is returned for the column in that case
     */
    public List<String> planIndexes(String tableName, String columnName, String indexTypeSpec) {
        List<String> statements = new ArrayList<>();
        for (FieldIndexType type : FieldIndexType.parseSpec(indexTypeSpec)) {
            switch (type) {
                case TIME_MAJOR:
                    statements.add(ddl.generateCreateIndex(tableName,
                        IndexKey.desc(TIME_COLUMN), IndexKey.asc(columnName)));
                    break;
                case VALUE_MAJOR:
                    statements.add(ddl.generateCreateIndex(tableName,
                        IndexKey.asc(columnName), IndexKey.desc(TIME_COLUMN)));
                    break;
                default:
                    throw new IllegalStateException("Unhandled index type " + type);
            }
        }
        return statements;
    }

    /**
     * Whether the pseudo-column at {@code position} falls inside the index budget.
     *
     * @param extraColumns 1 when an in-table tag occupies position 0, otherwise 0
     */
    public static boolean isWithinIndexLimit(int position, int fieldIndexCount, int extraColumns) {
        return fieldIndexCount == UNLIMITED || position < fieldIndexCount + extraColumns;
    }
}
