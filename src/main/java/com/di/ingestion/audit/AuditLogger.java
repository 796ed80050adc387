package com.di.ingestion.audit;

import com.di.ingestion.config.IngestionProperties;
import com.di.ingestion.config.WarehouseContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Writes one immutable log row per pipeline run.
 *
 * <p>Best effort: a failure to obtain an id or insert the row is reported on the
 * {@code [AUDIT]} channel at ERROR and never propagates to the pipeline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditLogger {

    private final LogIdGenerator         idGenerator;
    private final IngestionLogRepository repository;
    private final IngestionProperties    properties;

    /**
     * @return the assigned log id, or empty when the row could not be written
     */
    public Optional<Long> logRun(WarehouseContext ctx, IngestionLogEntry entry) {
        try {
            long logId = idGenerator.nextId(ctx);
            IngestionLogEntry row = entry.toBuilder()
                    .logId(logId)
                    .errorMessage(truncate(entry.getErrorMessage(), properties.getAudit().getMaxErrorLength()))
                    .build();
            repository.insert(ctx, row);
            log.info("[AUDIT] Ingestion {} logged as {} (logId={}, source={}, destination={})",
                     entry.getIngestionId(), entry.getStatus(), logId,
                     entry.getSourceCount(), entry.getDestinationCount());
            return Optional.of(logId);
        } catch (Exception e) {
            log.error("[AUDIT] Failed to write ingestion log for ingestion {} (status={}): {}",
                      entry.getIngestionId(), entry.getStatus(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    public List<IngestionLogEntry> recentRuns(WarehouseContext ctx, long ingestionId, int limit) {
        int safeLimit = Math.min(Math.max(1, limit), 500);
        return repository.findByIngestionId(ctx, ingestionId, safeLimit);
    }

    private static String truncate(String s, int maxLen) {
        if (s == null || s.length() <= maxLen) return s;
        return s.substring(0, maxLen) + "...";
    }
}
