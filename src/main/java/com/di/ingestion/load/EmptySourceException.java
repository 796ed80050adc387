package com.di.ingestion.load;

import com.di.ingestion.sql.TableRef;

/**
 * Raised when a load type that requires data (INCREMENTAL, BULK) copied zero
 * rows into staging.
 */
public class EmptySourceException extends RuntimeException {

    public EmptySourceException(TableRef stagingTable, String sourceLocation, long ingestionId) {
        super("No rows loaded into " + stagingTable + " from " + sourceLocation
                + " for ingestion " + ingestionId);
    }
}
