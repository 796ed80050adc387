package com.di.ingestion.schedule;

import java.time.LocalDateTime;
import java.time.ZonedDateTime;

/**
 * Read-only view of a schedule together with its freshly computed next run.
 *
 * @param computedNextRun null when the schedule is misconfigured
 */
public record SchedulePreview(long ingestionId,
                              Long scheduleId,
                              String scheduleType,
                              String timezone,
                              LocalDateTime lastRunAt,
                              LocalDateTime storedNextRunAt,
                              ZonedDateTime computedNextRun) {
}
