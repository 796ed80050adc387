package com.di.ingestion.load;

import com.di.ingestion.audit.AuditLogger;
import com.di.ingestion.audit.IngestionLogEntry;
import com.di.ingestion.audit.RunStatus;
import com.di.ingestion.catalog.IngestionDefinition;
import com.di.ingestion.catalog.LoadType;
import com.di.ingestion.config.IngestionProperties;
import com.di.ingestion.config.WarehouseContext;
import com.di.ingestion.load.dedup.Deduplicator;
import com.di.ingestion.load.merge.MergeResult;
import com.di.ingestion.load.merge.ScdMergeEngine;
import com.di.ingestion.load.schema.SchemaManager;
import com.di.ingestion.load.stage.StagingLoader;
import com.di.ingestion.schedule.ScheduleDefinition;
import com.di.ingestion.schedule.ScheduleService;
import com.di.ingestion.sql.TableRef;
import com.di.ingestion.warehouse.WarehouseClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Runs one validated ingestion definition end to end.
 *
 * <pre>
 *  ensure destination ─► ensure SCD columns ─► recreate staging ─► COPY INTO staging
 *        ─► (empty check) ─► deduplicate ─► merge ─► count destination
 *        ─► audit SUCCESS ─► (FULL) advance schedule
 * </pre>
 *
 * <p>Any exception along the way ends the run with an audit row in status
 * FAILED carrying the exception text. The result is always returned, never
 * thrown, so one ingestion id cannot break another.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionPipeline {

    private final SchemaManager       schemaManager;
    private final StagingLoader       stagingLoader;
    private final Deduplicator        deduplicator;
    private final ScdMergeEngine      mergeEngine;
    private final WarehouseClient     warehouse;
    private final AuditLogger         auditLogger;
    private final ScheduleService     scheduleService;
    private final IngestionProperties properties;
    private final Clock               clock;

    public IngestionRunResult run(WarehouseContext ctx, IngestionDefinition definition) {
        long          id       = definition.getIngestionId();
        LoadType      loadType = definition.getLoadType();
        LocalDateTime start    = LocalDateTime.now(clock);

        IngestionRunResult.IngestionRunResultBuilder result = IngestionRunResult.builder()
                .ingestionId(id)
                .loadType(loadType.name())
                .destination(definition.getDestinationTable())
                .startTime(start);

        log.info("[PIPELINE] Starting ingestion {} ({} load, {} → {})",
                 id, loadType, definition.getSourceStage(), definition.getDestinationTable());

        long sourceCount = 0;
        try {
            TableRef destination = TableRef.resolve(definition.getDestinationTable(), ctx);
            TableRef staging     = stagingTableFor(ctx, destination);

            schemaManager.ensureDestinationColumns(destination, definition.getColumns());
            schemaManager.ensureScdColumns(destination);
            schemaManager.recreateStagingTable(staging, definition.getColumns());

            sourceCount = stagingLoader.loadStaging(staging, definition.getColumns(),
                                                    definition.getSourceStage(), definition.getFileFormat());
            result.sourceCount(sourceCount);

            if (sourceCount == 0) {
                if (loadType.emptySourceFails()) {
                    throw new EmptySourceException(staging, definition.getSourceStage(), id);
                }
                log.info("[PIPELINE] Ingestion {} staged no rows; {} load continues as a no-change run",
                         id, loadType);
            }

            TableRef    dedup  = deduplicator.deduplicate(staging, definition.getKeyColumns(), loadType);
            MergeResult merged = mergeEngine.merge(destination, dedup, definition.getKeyColumns(),
                                                   definition.columnNames(), loadType);
            long destinationCount = warehouse.count(destination);

            result.insertedCount(merged.inserted())
                  .closedCount(merged.closed())
                  .destinationCount(destinationCount)
                  .status(RunStatus.SUCCESS);

        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("[PIPELINE] Ingestion {} FAILED: {}", id, message, e);
            result.status(RunStatus.FAILED).errorMessage(message);
        }

        result.endTime(LocalDateTime.now(clock));
        IngestionRunResult outcome = result.build();
        outcome.setLogId(auditLogger.logRun(ctx, toLogEntry(definition, outcome)).orElse(null));

        if (outcome.isSuccess() && loadType.advancesSchedule()) {
            advanceSchedule(ctx, definition).ifPresent(s -> outcome.setNextRunAt(s.getNextRunAt()));
        }

        log.info("[PIPELINE] Ingestion {} finished {}: source={}, destination={}, inserted={}, closed={}",
                 id, outcome.getStatus(), outcome.getSourceCount(), outcome.getDestinationCount(),
                 outcome.getInsertedCount(), outcome.getClosedCount());
        return outcome;
    }

    /** Staging lives in the staging schema under the destination name plus the staging suffix. */
    TableRef stagingTableFor(WarehouseContext ctx, TableRef destination) {
        return destination.inSchema(ctx.stagingSchema())
                .withName(destination.name() + properties.getStaging().getTableSuffix());
    }

    private Optional<ScheduleDefinition> advanceSchedule(WarehouseContext ctx, IngestionDefinition definition) {
        ScheduleDefinition schedule = definition.getSchedule();
        if (schedule == null) {
            log.warn("[PIPELINE] Ingestion {} has no schedule row; next run not recorded",
                     definition.getIngestionId());
            return Optional.empty();
        }
        try {
            return scheduleService.advance(ctx, schedule);
        } catch (Exception e) {
            log.error("[PIPELINE] Ingestion {} loaded but schedule {} could not be advanced: {}",
                      definition.getIngestionId(), schedule.getScheduleId(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    private static IngestionLogEntry toLogEntry(IngestionDefinition definition, IngestionRunResult outcome) {
        return IngestionLogEntry.builder()
                .ingestionId(definition.getIngestionId())
                .source(definition.getSourceName())
                .destination(definition.getDestinationTable())
                .stage(definition.getSourceStage())
                .fileFormat(definition.getFileFormat())
                .loadType(definition.getLoadType().name())
                .startTime(outcome.getStartTime())
                .endTime(outcome.getEndTime())
                .sourceCount(outcome.getSourceCount())
                .destinationCount(outcome.getDestinationCount())
                .status(outcome.getStatus())
                .errorMessage(outcome.getErrorMessage())
                .build();
    }
}
