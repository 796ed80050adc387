package com.di.ingestion.catalog;

/**
 * Configuration error in the ingestion catalog: unknown load type, missing
 * column mapping, unique key not covered by the mapping, unknown ingestion id.
 *
 * <p>The affected ingestion is not run and no state is mutated.
 */
public class CatalogValidationException extends RuntimeException {

    private final Long ingestionId;

    public CatalogValidationException(Long ingestionId, String message) {
        super(message);
        this.ingestionId = ingestionId;
    }

    public Long getIngestionId() {
        return ingestionId;
    }
}
