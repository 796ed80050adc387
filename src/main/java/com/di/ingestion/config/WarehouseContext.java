package com.di.ingestion.config;

/**
 * Session settings of one orchestration pass, passed explicitly to the components
 * that resolve or name tables instead of relying on {@code USE DATABASE/SCHEMA} session state.
 *
 * @param database       default database for unqualified identifiers
 * @param schema         default schema for destination tables
 * @param stagingSchema  schema that holds staging and dedup tables
 * @param catalogSchema  schema that holds the ingestion catalog and log tables
 */
public record WarehouseContext(
        String database,
        String schema,
        String stagingSchema,
        String catalogSchema) {
}
