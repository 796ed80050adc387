package com.di.ingestion.schedule;

import com.di.ingestion.config.WarehouseContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Advances schedules after successful loads and previews upcoming runs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleService {

    private final ScheduleCalculator calculator;
    private final ScheduleRepository repository;
    private final Clock              clock;

    /**
     * Records a run that finished now: last-run = now, next-run computed from now,
     * updated-at = now, written in one update scoped by schedule id.
     *
     * @return the schedule as persisted, or empty when nothing was written
     */
    public Optional<ScheduleDefinition> advance(WarehouseContext ctx, ScheduleDefinition schedule) {
        if (schedule.getScheduleId() == null) {
            log.error("[SCHEDULE] Schedule for ingestion {} has no schedule id; not advanced",
                      schedule.getIngestionId());
            return Optional.empty();
        }
        Optional<ZoneId> zone = calculator.zoneOf(schedule);
        if (zone.isEmpty()) {
            return Optional.empty();
        }

        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(zone.get());
        Optional<ZonedDateTime> next = calculator.nextRunAfter(schedule, now);
        if (next.isEmpty()) {
            log.warn("[SCHEDULE] Schedule {} (ingestion {}) left unchanged: next run could not be computed",
                     schedule.getScheduleId(), schedule.getIngestionId());
            return Optional.empty();
        }

        LocalDateTime nowLocal  = now.toLocalDateTime();
        LocalDateTime lastRun   = later(schedule.getLastRunAt(), nowLocal);
        LocalDateTime nextRun   = later(schedule.getNextRunAt(), next.get().toLocalDateTime());

        int updated = repository.updateRunTimes(ctx, schedule.getScheduleId(), lastRun, nextRun, nowLocal);
        if (updated == 0) {
            log.warn("[SCHEDULE] Schedule {} (ingestion {}) no longer exists; nothing updated",
                     schedule.getScheduleId(), schedule.getIngestionId());
            return Optional.empty();
        }

        log.info("[SCHEDULE] Ingestion {} advanced: lastRun={}, nextRun={} ({})",
                 schedule.getIngestionId(), lastRun, nextRun, zone.get());
        return Optional.of(schedule.toBuilder()
                .lastRunAt(lastRun)
                .nextRunAt(nextRun)
                .updatedAt(nowLocal)
                .build());
    }

    /** Next run computed from the stored last run; nothing is persisted. */
    public Optional<SchedulePreview> preview(WarehouseContext ctx, long ingestionId) {
        return repository.findByIngestionId(ctx, ingestionId)
                .map(s -> new SchedulePreview(
                        ingestionId,
                        s.getScheduleId(),
                        s.getScheduleType(),
                        calculator.zoneOf(s).map(ZoneId::getId).orElse(s.getTimezone()),
                        s.getLastRunAt(),
                        s.getNextRunAt(),
                        calculator.nextRun(s).orElse(null)));
    }

    private static LocalDateTime later(LocalDateTime previous, LocalDateTime candidate) {
        return previous != null && previous.isAfter(candidate) ? previous : candidate;
    }
}
