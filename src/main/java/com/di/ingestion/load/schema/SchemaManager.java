package com.di.ingestion.load.schema;

import com.di.ingestion.catalog.MappedColumn;
import com.di.ingestion.config.IngestionProperties;
import com.di.ingestion.load.ScdColumns;
import com.di.ingestion.sql.ColumnDef;
import com.di.ingestion.sql.SqlExpr;
import com.di.ingestion.sql.SqlStatement;
import com.di.ingestion.sql.SqlStatement.CreateMode;
import com.di.ingestion.sql.TableRef;
import com.di.ingestion.warehouse.StatementExecutionException;
import com.di.ingestion.warehouse.WarehouseClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Ensures destination and staging tables exist with the mapped columns, and
 * that destination tables carry the SCD bookkeeping columns.
 */
@Slf4j
@Service
public class SchemaManager {

    private final WarehouseClient warehouse;
    private final ScdColumns      scd;

    public SchemaManager(WarehouseClient warehouse, IngestionProperties properties) {
        this.warehouse = warehouse;
        this.scd = ScdColumns.from(properties);
    }

    /** Creates the destination table with the mapped columns if it does not exist yet. */
    public void ensureDestinationColumns(TableRef table, List<MappedColumn> mapping) {
        log.info("[SCHEMA] ensuring destination {} ({} mapped columns)", table, mapping.size());
        warehouse.execute(new SqlStatement.CreateTable(table, columnDefs(mapping), CreateMode.IF_NOT_EXISTS));
    }

    /**
     * Adds current-flag (default TRUE), start-date and end-date when missing.
     * An "already exists" answer from the engine counts as success.
     *
     * @throws StatementExecutionException for any other failure while adding a column
     */
    public void ensureScdColumns(TableRef table) {
        addColumnIfMissing(table, new ColumnDef(scd.currentFlag(), "BOOLEAN", SqlExpr.literal(Boolean.TRUE)));
        addColumnIfMissing(table, ColumnDef.of(scd.startDate(), scd.timestampType()));
        addColumnIfMissing(table, ColumnDef.of(scd.endDate(), scd.timestampType()));
    }

    /** Drops and recreates the staging table from the mapping; staging never survives a run. */
    public void recreateStagingTable(TableRef staging, List<MappedColumn> mapping) {
        log.info("[SCHEMA] recreating staging table {}", staging);
        warehouse.execute(new SqlStatement.CreateTable(staging, columnDefs(mapping), CreateMode.OR_REPLACE));
    }

    private void addColumnIfMissing(TableRef table, ColumnDef column) {
        try {
            warehouse.execute(new SqlStatement.AddColumn(table, column));
            log.info("[SCHEMA] added column {} to {}", column.name(), table);
        } catch (StatementExecutionException ex) {
            if (ex.isAlreadyExists()) {
                log.debug("[SCHEMA] column {} already present on {}", column.name(), table);
                return;
            }
            log.error("[SCHEMA] adding column {} to {} failed: {}", column.name(), table, ex.getMessage());
            throw ex;
        }
    }

    private static List<ColumnDef> columnDefs(List<MappedColumn> mapping) {
        return mapping.stream()
                .map(c -> ColumnDef.of(c.getColumnName(), c.getDataType()))
                .toList();
    }
}
