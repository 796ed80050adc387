package com.di.ingestion.catalog;

import java.util.List;

/**
 * Active definitions split into those that passed validation and those that
 * were rejected before any run started.
 */
public record CatalogLoadResult(List<IngestionDefinition> definitions, List<Rejected> rejected) {

    public CatalogLoadResult {
        definitions = List.copyOf(definitions);
        rejected = List.copyOf(rejected);
    }

    public record Rejected(Long ingestionId, String reason) {}
}
