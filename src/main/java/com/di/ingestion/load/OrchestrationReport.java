package com.di.ingestion.load;

import com.di.ingestion.catalog.CatalogLoadResult;

import java.util.List;

/**
 * Summary of one {@code runAll} pass: per-id run results plus definitions
 * rejected at catalog load.
 */
public record OrchestrationReport(List<IngestionRunResult> results,
                                  List<CatalogLoadResult.Rejected> rejected) {

    public OrchestrationReport {
        results = List.copyOf(results);
        rejected = List.copyOf(rejected);
    }

    public long succeeded() {
        return results.stream().filter(IngestionRunResult::isSuccess).count();
    }

    public long failed() {
        return results.size() - succeeded();
    }
}
