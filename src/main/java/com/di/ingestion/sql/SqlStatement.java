package com.di.ingestion.sql;

import java.util.List;

/**
 * Structured statements issued by the ingestion pipeline.
 *
 * <p>Each record carries identifiers and expressions only; a {@link SqlDialect}
 * turns it into engine SQL. Keeping the statements as data lets the merge
 * policies and the staging steps be tested against an in-memory interpreter.
 */
public interface SqlStatement {

    /** Short label used in logs and error messages. */
    default String kind() {
        return getClass().getSimpleName();
    }

    /** Whether the engine produces per-file or per-action count rows for this statement. */
    default boolean reportsSummary() {
        return false;
    }

    enum CreateMode { IF_NOT_EXISTS, OR_REPLACE }

    record CreateTable(TableRef table, List<ColumnDef> columns, CreateMode mode) implements SqlStatement {
        public CreateTable {
            columns = List.copyOf(columns);
        }
    }

    record AddColumn(TableRef table, ColumnDef column) implements SqlStatement {}

    /** Lists the files currently visible at a stage location. */
    record ListStageFiles(String stageLocation) implements SqlStatement {}

    /**
     * Bulk copy from a stage, extracting source fields by 1-based position.
     *
     * @param columns         target columns, in mapping order
     * @param sourcePositions source field position for each target column
     * @param onError         engine error policy, e.g. {@code CONTINUE}
     */
    record CopyInto(TableRef table,
                    List<String> columns,
                    List<Integer> sourcePositions,
                    String stageLocation,
                    String fileFormat,
                    String onError) implements SqlStatement {
        public CopyInto {
            if (columns.size() != sourcePositions.size()) {
                throw new IllegalArgumentException("Each copied column needs exactly one source position");
            }
            columns = List.copyOf(columns);
            sourcePositions = List.copyOf(sourcePositions);
        }

        @Override
        public boolean reportsSummary() {
            return true;
        }
    }

    /** Materialises one row per {@code partitionBy} tuple, first by {@code orderBy}. */
    record CreateDedupTable(TableRef table,
                            TableRef source,
                            List<String> partitionBy,
                            List<OrderTerm> orderBy) implements SqlStatement {
        public CreateDedupTable {
            if (partitionBy.isEmpty()) {
                throw new IllegalArgumentException("Deduplication requires at least one partition column");
            }
            partitionBy = List.copyOf(partitionBy);
            orderBy = List.copyOf(orderBy);
        }
    }

    record Assignment(String column, SqlExpr value) {}

    /** {@code WHEN MATCHED [AND condition] THEN UPDATE SET ...}. */
    record WhenMatchedUpdate(SqlExpr condition, List<Assignment> assignments) {
        public WhenMatchedUpdate {
            assignments = List.copyOf(assignments);
        }
    }

    /** {@code WHEN NOT MATCHED THEN INSERT (columns) VALUES (values)}. */
    record WhenNotMatchedInsert(List<String> columns, List<SqlExpr> values) {
        public WhenNotMatchedInsert {
            if (columns.size() != values.size()) {
                throw new IllegalArgumentException("Insert column and value counts differ");
            }
            columns = List.copyOf(columns);
            values = List.copyOf(values);
        }
    }

    record Merge(TableRef target,
                 String targetAlias,
                 TableRef source,
                 String sourceAlias,
                 SqlExpr on,
                 List<WhenMatchedUpdate> whenMatched,
                 WhenNotMatchedInsert whenNotMatched) implements SqlStatement {
        public Merge {
            whenMatched = List.copyOf(whenMatched);
            if (whenMatched.isEmpty() && whenNotMatched == null) {
                throw new IllegalArgumentException("Merge needs at least one WHEN clause");
            }
        }

        @Override
        public boolean reportsSummary() {
            return true;
        }
    }

    /** {@code INSERT INTO target (columns) SELECT values FROM source alias}. */
    record InsertSelect(TableRef target,
                        List<String> columns,
                        TableRef source,
                        String sourceAlias,
                        List<SqlExpr> values) implements SqlStatement {
        public InsertSelect {
            if (columns.size() != values.size()) {
                throw new IllegalArgumentException("Insert column and value counts differ");
            }
            columns = List.copyOf(columns);
            values = List.copyOf(values);
        }

        @Override
        public boolean reportsSummary() {
            return true;
        }
    }

    record CountRows(TableRef table) implements SqlStatement {}
}
