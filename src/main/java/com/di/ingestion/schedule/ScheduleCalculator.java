package com.di.ingestion.schedule;

import com.di.ingestion.config.IngestionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Computes the next run of an ingestion schedule.
 *
 * <p>All arithmetic happens in the schedule's timezone (the configured default
 * when the row has none), so cron grid points such as "midnight" are local
 * midnight. A configuration problem never throws: it is logged and the result
 * is empty, leaving the persisted schedule untouched.
 *
 * <h3>Cron</h3>
 * Five-field expressions ({@code minute hour day-of-month month day-of-week}),
 * evaluated with Spring's {@link CronExpression}. When both day-of-month and
 * day-of-week are restricted, a day matching either field fires, as in the
 * classic cron daemon. {@code @daily}-style macros are accepted as well.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduleCalculator {

    private final Clock               clock;
    private final IngestionProperties properties;

    /**
     * Next run strictly after the last run, or after now when the schedule has never run.
     */
    public Optional<ZonedDateTime> nextRun(ScheduleDefinition schedule) {
        Optional<ZoneId> zone = zoneOf(schedule);
        if (zone.isEmpty()) {
            return Optional.empty();
        }
        ZonedDateTime from = schedule.getLastRunAt() != null
                ? schedule.getLastRunAt().atZone(zone.get())
                : ZonedDateTime.now(clock).withZoneSameInstant(zone.get());
        return nextRunAfter(schedule, from);
    }

    /**
     * Next run strictly after {@code from}, expressed in the schedule's zone.
     */
    public Optional<ZonedDateTime> nextRunAfter(ScheduleDefinition schedule, ZonedDateTime from) {
        Optional<ZoneId> zone = zoneOf(schedule);
        if (zone.isEmpty()) {
            return Optional.empty();
        }
        ZonedDateTime start = from.withZoneSameInstant(zone.get());

        Optional<ScheduleType> type = ScheduleType.parse(schedule.getScheduleType());
        if (type.isEmpty()) {
            log.error("[SCHEDULE] Schedule {} (ingestion {}) has unknown schedule type '{}'",
                      schedule.getScheduleId(), schedule.getIngestionId(), schedule.getScheduleType());
            return Optional.empty();
        }

        return switch (type.get()) {
            case RECURRING -> recurring(schedule, start);
            case CRON      -> cron(schedule, start);
        };
    }

    /** Schedule timezone, falling back to the configured default; empty when the id is invalid. */
    public Optional<ZoneId> zoneOf(ScheduleDefinition schedule) {
        String raw = schedule.getTimezone();
        if (raw == null || raw.isBlank()) {
            raw = properties.getSchedule().getDefaultTimezone();
        }
        try {
            return Optional.of(ZoneId.of(raw.trim()));
        } catch (DateTimeException e) {
            log.error("[SCHEDULE] Schedule {} (ingestion {}) has invalid timezone '{}': {}",
                      schedule.getScheduleId(), schedule.getIngestionId(), raw, e.getMessage());
            return Optional.empty();
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Optional<ZonedDateTime> recurring(ScheduleDefinition schedule, ZonedDateTime start) {
        Integer interval = schedule.getIntervalMinutes();
        if (interval == null || interval <= 0) {
            log.error("[SCHEDULE] RECURRING schedule {} (ingestion {}) needs a positive interval, got {}",
                      schedule.getScheduleId(), schedule.getIngestionId(), interval);
            return Optional.empty();
        }
        return Optional.of(start.plusMinutes(interval));
    }

    private Optional<ZonedDateTime> cron(ScheduleDefinition schedule, ZonedDateTime start) {
        String expression = schedule.getCronExpression();
        if (expression == null || expression.isBlank()) {
            log.error("[SCHEDULE] CRON schedule {} (ingestion {}) has no cron expression",
                      schedule.getScheduleId(), schedule.getIngestionId());
            return Optional.empty();
        }
        try {
            Optional<ZonedDateTime> next = nextCronTime(expression, start);
            if (next.isEmpty()) {
                log.error("[SCHEDULE] Cron '{}' of schedule {} never fires after {}",
                          expression, schedule.getScheduleId(), start);
            }
            return next;
        } catch (IllegalArgumentException e) {
            log.error("[SCHEDULE] Schedule {} (ingestion {}) has invalid cron '{}': {}",
                      schedule.getScheduleId(), schedule.getIngestionId(), expression, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * First grid point of a five-field cron expression strictly after {@code start}.
     *
     * @throws IllegalArgumentException if the expression is malformed
     */
    static Optional<ZonedDateTime> nextCronTime(String expression, ZonedDateTime start) {
        String trimmed = expression.trim();
        if (trimmed.startsWith("@")) {
            return Optional.ofNullable(CronExpression.parse(trimmed).next(start));
        }

        String[] f = trimmed.split("\\s+");
        if (f.length != 5) {
            throw new IllegalArgumentException(
                    "expected 5 fields (minute hour day-of-month month day-of-week), got " + f.length);
        }
        String minute = f[0], hour = f[1], dayOfMonth = f[2], month = f[3], dayOfWeek = f[4];

        if (!restricted(dayOfMonth) || !restricted(dayOfWeek)) {
            return Optional.ofNullable(CronExpression.parse("0 " + trimmed).next(start));
        }

        // Both day fields restricted: either one firing is enough.
        ZonedDateTime byDayOfMonth = CronExpression
                .parse(String.join(" ", "0", minute, hour, dayOfMonth, month, "?"))
                .next(start);
        ZonedDateTime byDayOfWeek = CronExpression
                .parse(String.join(" ", "0", minute, hour, "?", month, dayOfWeek))
                .next(start);

        if (byDayOfMonth == null) return Optional.ofNullable(byDayOfWeek);
        if (byDayOfWeek == null)  return Optional.of(byDayOfMonth);
        return Optional.of(byDayOfMonth.isBefore(byDayOfWeek) ? byDayOfMonth : byDayOfWeek);
    }

    private static boolean restricted(String field) {
        return !field.startsWith("*") && !"?".equals(field);
    }
}
