package com.di.ingestion.schedule;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Domain model for the ingestion schedule catalog table.
 *
 * <p>Run timestamps are stored without zone and are wall-clock times in
 * {@link #timezone} (the configured default when blank).
 *
 * <pre>State flow (per schedule):
 *   pending  (next run not yet computed, or due)
 *     → advanced (after a successful FULL load: last/next run recomputed)
 * </pre>
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleDefinition {

    private Long          scheduleId;
    private Long          ingestionId;

    /** {@code RECURRING} or {@code CRON}, as stored. */
    private String        scheduleType;
    /** Meaningful for RECURRING only. */
    private Integer       intervalMinutes;
    /** Five-field cron expression; meaningful for CRON only. */
    private String        cronExpression;
    private String        timezone;

    private LocalDateTime lastRunAt;
    private LocalDateTime nextRunAt;
    private LocalDateTime updatedAt;
}
