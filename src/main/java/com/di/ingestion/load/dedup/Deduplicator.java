package com.di.ingestion.load.dedup;

import com.di.ingestion.catalog.LoadType;
import com.di.ingestion.config.IngestionProperties;
import com.di.ingestion.sql.SqlStatement;
import com.di.ingestion.sql.TableRef;
import com.di.ingestion.warehouse.WarehouseClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Collapses staged rows to one row per unique-key tuple.
 *
 * <p>The surviving row is the first in the load type's tie-break order
 * ({@link LoadType#dedupOrder}). The result table is rebuilt on every call.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class Deduplicator {

    private final WarehouseClient     warehouse;
    private final IngestionProperties properties;

    /**
     * @return the freshly built dedup table, named after the staging table plus the dedup suffix
     */
    public TableRef deduplicate(TableRef stagingTable,
                                List<String> keyColumns,
                                LoadType loadType) {
        TableRef dedupTable = stagingTable.withName(
                stagingTable.name() + properties.getStaging().getDedupSuffix());

        warehouse.execute(new SqlStatement.CreateDedupTable(
                dedupTable, stagingTable, keyColumns, loadType.dedupOrder(keyColumns)));

        log.info("[DEDUP] {} → {} partitioned by {} ({} tie-break)",
                 stagingTable, dedupTable, keyColumns, loadType);
        return dedupTable;
    }
}
