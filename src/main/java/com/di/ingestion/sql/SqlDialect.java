package com.di.ingestion.sql;

/**
 * Renders the structured statement model into engine-specific SQL.
 */
public interface SqlDialect {

    /** Dialect name, for logging. */
    String name();

    String render(SqlStatement statement);

    String renderTable(TableRef table);

    String quoteIdentifier(String identifier);

    /**
     * Query that returns the result rows of the previous statement on the same
     * session, for drivers that report DML and {@code COPY} only as an update count.
     */
    String renderLastResult();
}
