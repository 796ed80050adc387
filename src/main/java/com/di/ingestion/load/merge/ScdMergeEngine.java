package com.di.ingestion.load.merge;

import com.di.ingestion.catalog.LoadType;
import com.di.ingestion.config.IngestionProperties;
import com.di.ingestion.load.ScdColumns;
import com.di.ingestion.sql.SqlStatement;
import com.di.ingestion.sql.TableRef;
import com.di.ingestion.warehouse.StatementResult;
import com.di.ingestion.warehouse.WarehouseClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Applies a deduplicated batch to an SCD destination using the configured
 * {@link MergePolicy}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScdMergeEngine {

    static final String ROWS_INSERTED = "number of rows inserted";
    static final String ROWS_UPDATED  = "number of rows updated";

    private final WarehouseClient     warehouse;
    private final MergePolicy         policy;
    private final IngestionProperties properties;

    public MergeResult merge(TableRef destination,
                             TableRef dedupTable,
                             List<String> keyColumns,
                             List<String> columns,
                             LoadType loadType) {

        MergeRequest request = new MergeRequest(destination, dedupTable, keyColumns, columns,
                                                loadType, ScdColumns.from(properties));

        MergeResult total = MergeResult.NONE;
        for (SqlStatement statement : policy.plan(request)) {
            total = total.plus(toMergeResult(statement, warehouse.execute(statement)));
        }

        log.info("[MERGE] {} {} → {} ({}): inserted={}, closed={}",
                 loadType, dedupTable, destination, policy.name(), total.inserted(), total.closed());
        return total;
    }

    private static MergeResult toMergeResult(SqlStatement statement, StatementResult result) {
        if (result.hasRows()) {
            return new MergeResult(result.firstLong(ROWS_INSERTED).orElse(0L),
                                   result.firstLong(ROWS_UPDATED).orElse(0L));
        }
        long count = Math.max(result.getUpdateCount(), 0);
        if (statement instanceof SqlStatement.Merge merge
                && !merge.whenMatched().isEmpty() && merge.whenNotMatched() != null) {
            log.warn("[MERGE] Only an update count ({}) was reported for {}; inserted and closed rows cannot be told apart",
                     count, merge.target());
        }
        boolean insertOnly = statement instanceof SqlStatement.InsertSelect
                || statement instanceof SqlStatement.Merge merge && merge.whenMatched().isEmpty();
        return insertOnly ? new MergeResult(count, 0) : new MergeResult(0, count);
    }
}
