package com.di.ingestion.audit;

import com.di.ingestion.config.WarehouseContext;

/**
 * Source of unique ingestion-log ids.
 */
public interface LogIdGenerator {

    long nextId(WarehouseContext ctx);
}
