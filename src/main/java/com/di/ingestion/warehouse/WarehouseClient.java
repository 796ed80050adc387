package com.di.ingestion.warehouse;

import com.di.ingestion.sql.SqlStatement;
import com.di.ingestion.sql.TableRef;

/**
 * Opaque "run statement, get rows" capability of the warehouse.
 *
 * <p>Calls are synchronous and blocking; timeouts are whatever the engine applies.
 * Implementations throw {@link StatementExecutionException} on any engine error.
 */
public interface WarehouseClient {

    StatementResult execute(SqlStatement statement);

    default long count(TableRef table) {
        return execute(new SqlStatement.CountRows(table)).singleLong().orElse(0L);
    }
}
