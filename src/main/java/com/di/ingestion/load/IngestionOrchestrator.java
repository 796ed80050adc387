package com.di.ingestion.load;

import com.di.ingestion.audit.RunStatus;
import com.di.ingestion.catalog.CatalogLoadResult;
import com.di.ingestion.catalog.IngestionCatalogReader;
import com.di.ingestion.catalog.IngestionDefinition;
import com.di.ingestion.config.IngestionProperties;
import com.di.ingestion.config.WarehouseContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for ingestion runs.
 *
 * <p>Definitions run one after another on the calling thread. Each run is
 * isolated: a failure is recorded for that ingestion id and the loop moves on.
 * The ingestion id is placed in the MDC under {@value #MDC_KEY} while its run
 * is in progress; any value already there (set by the request filter) is restored afterwards.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionOrchestrator {

    public static final String MDC_KEY = "ingestionId";

    private final IngestionCatalogReader catalogReader;
    private final IngestionPipeline      pipeline;
    private final IngestionProperties    properties;
    private final Clock                  clock;

    /** Runs every active, valid ingestion definition. */
    public OrchestrationReport runAll() {
        WarehouseContext  ctx     = properties.toContext();
        CatalogLoadResult catalog = catalogReader.loadActiveDefinitions(ctx);

        log.info("[ORCHESTRATOR] Running {} ingestion(s) in {}.{} ({} rejected at catalog load)",
                 catalog.definitions().size(), ctx.database(), ctx.schema(), catalog.rejected().size());

        List<IngestionRunResult> results = new ArrayList<>(catalog.definitions().size());
        for (IngestionDefinition definition : catalog.definitions()) {
            results.add(runIsolated(ctx, definition));
        }

        OrchestrationReport report = new OrchestrationReport(results, catalog.rejected());
        log.info("[ORCHESTRATOR] Completed: {} succeeded, {} failed, {} rejected",
                 report.succeeded(), report.failed(), report.rejected().size());
        return report;
    }

    /**
     * Runs a single ingestion id.
     *
     * @throws com.di.ingestion.catalog.CatalogValidationException when the id is unknown,
     *         inactive or misconfigured; nothing is run in that case
     */
    public IngestionRunResult runOne(long ingestionId) {
        WarehouseContext    ctx        = properties.toContext();
        IngestionDefinition definition = catalogReader.loadDefinition(ctx, ingestionId);
        return runIsolated(ctx, definition);
    }

    private IngestionRunResult runIsolated(WarehouseContext ctx, IngestionDefinition definition) {
        String previous = MDC.get(MDC_KEY);
        MDC.put(MDC_KEY, String.valueOf(definition.getIngestionId()));
        try {
            return pipeline.run(ctx, definition);
        } catch (RuntimeException e) {
            log.error("[ORCHESTRATOR] Ingestion {} aborted outside the pipeline: {}",
                      definition.getIngestionId(), e.getMessage(), e);
            LocalDateTime now = LocalDateTime.now(clock);
            return IngestionRunResult.builder()
                    .ingestionId(definition.getIngestionId())
                    .loadType(definition.getLoadType().name())
                    .destination(definition.getDestinationTable())
                    .status(RunStatus.FAILED)
                    .startTime(now)
                    .endTime(now)
                    .errorMessage(e.getMessage())
                    .build();
        } finally {
            if (previous != null) {
                MDC.put(MDC_KEY, previous);
            } else {
                MDC.remove(MDC_KEY);
            }
        }
    }
}
