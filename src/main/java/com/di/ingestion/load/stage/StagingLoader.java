package com.di.ingestion.load.stage;

import com.di.ingestion.catalog.MappedColumn;
import com.di.ingestion.config.IngestionProperties;
import com.di.ingestion.sql.SqlStatement;
import com.di.ingestion.sql.TableRef;
import com.di.ingestion.warehouse.StatementResult;
import com.di.ingestion.warehouse.WarehouseClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Copies raw files from a named stage location into the staging table.
 *
 * <h3>Steps</h3>
 * <ol>
 *   <li>List the files at the stage location (logged only).</li>
 *   <li>{@code COPY INTO} the staging table, extracting source fields by the
 *       mapped positions, with {@code ON_ERROR = CONTINUE} so malformed rows are
 *       skipped instead of failing the copy.</li>
 *   <li>Sum {@code rows_loaded} over the per-file copy results, or take the
 *       update count when the driver returned no result rows.</li>
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StagingLoader {

    static final String ROWS_LOADED = "rows_loaded";
    static final String ERRORS_SEEN = "errors_seen";

    private final WarehouseClient     warehouse;
    private final IngestionProperties properties;

    /**
     * @return number of rows successfully copied into {@code stagingTable}
     */
    public long loadStaging(TableRef stagingTable,
                            List<MappedColumn> mapping,
                            String sourceLocation,
                            String fileFormat) {

        StatementResult files = warehouse.execute(new SqlStatement.ListStageFiles(sourceLocation));
        log.info("[STAGING] {} file(s) visible at {}", files.getRows().size(), sourceLocation);

        SqlStatement.CopyInto copy = new SqlStatement.CopyInto(
                stagingTable,
                mapping.stream().map(MappedColumn::getColumnName).toList(),
                mapping.stream().map(MappedColumn::getSourcePosition).toList(),
                sourceLocation,
                fileFormat,
                properties.getStaging().getOnError());

        StatementResult result = warehouse.execute(copy);
        if (!result.hasRows()) {
            long loaded = Math.max(result.getUpdateCount(), 0);
            log.info("[STAGING] {} row(s) loaded into {} using format {} (update count)",
                     loaded, stagingTable, fileFormat);
            return loaded;
        }
        long loaded  = result.sumLong(ROWS_LOADED);
        long skipped = result.sumLong(ERRORS_SEEN);

        if (skipped > 0) {
            log.warn("[STAGING] {} malformed row(s) skipped while copying {} into {}",
                     skipped, sourceLocation, stagingTable);
        }
        log.info("[STAGING] {} row(s) loaded into {} using format {}", loaded, stagingTable, fileFormat);
        return loaded;
    }
}
