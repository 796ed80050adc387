package com.di.ingestion.controller;

import com.di.ingestion.audit.AuditLogger;
import com.di.ingestion.audit.IngestionLogEntry;
import com.di.ingestion.config.IngestionProperties;
import com.di.ingestion.load.IngestionOrchestrator;
import com.di.ingestion.load.IngestionRunResult;
import com.di.ingestion.load.OrchestrationReport;
import com.di.ingestion.schedule.SchedulePreview;
import com.di.ingestion.schedule.ScheduleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for triggering ingestions and inspecting their history.
 *
 * <p><strong>Base path:</strong> {@code /api/ingestions}
 *
 * <table border="1">
 * <tr><th>Method</th><th>Path</th><th>Description</th></tr>
 * <tr><td>POST</td><td>/api/ingestions/run</td>
 *     <td>Run every active ingestion (synchronous)</td></tr>
 * <tr><td>POST</td><td>/api/ingestions/{id}/run</td>
 *     <td>Run one ingestion (synchronous); 500 when the run FAILED</td></tr>
 * <tr><td>GET</td><td>/api/ingestions/{id}/logs?limit=20</td>
 *     <td>Most recent ingestion log entries</td></tr>
 * <tr><td>GET</td><td>/api/ingestions/{id}/schedule/next</td>
 *     <td>Next run computed from the stored schedule (nothing persisted)</td></tr>
 * </table>
 */
@RestController
@RequestMapping("/api/ingestions")
@Slf4j
@RequiredArgsConstructor
public class IngestionController {

    private final IngestionOrchestrator orchestrator;
    private final AuditLogger           auditLogger;
    private final ScheduleService       scheduleService;
    private final IngestionProperties   properties;

    /* ------------------------------------------------------------------ */
    /* Trigger                                                              */
    /* ------------------------------------------------------------------ */

    @PostMapping("/run")
    public OrchestrationReport runAll() {
        log.info("[CONTROLLER] POST /api/ingestions/run");
        return orchestrator.runAll();
    }

    @PostMapping("/{id}/run")
    public ResponseEntity<IngestionRunResult> runOne(@PathVariable long id) {
        log.info("[CONTROLLER] POST /api/ingestions/{}/run", id);
        IngestionRunResult result = orchestrator.runOne(id);
        HttpStatus status = result.isSuccess() ? HttpStatus.OK : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(result);
    }

    /* ------------------------------------------------------------------ */
    /* Queries                                                              */
    /* ------------------------------------------------------------------ */

    @GetMapping("/{id}/logs")
    public List<IngestionLogEntry> recentLogs(@PathVariable long id,
                                              @RequestParam(defaultValue = "20") int limit) {
        return auditLogger.recentRuns(properties.toContext(), id, limit);
    }

    @GetMapping("/{id}/schedule/next")
    public ResponseEntity<SchedulePreview> nextRun(@PathVariable long id) {
        return scheduleService.preview(properties.toContext(), id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
