package com.di.ingestion.schedule;

import java.util.Locale;
import java.util.Optional;

public enum ScheduleType {
    RECURRING,
    CRON;

    public static Optional<ScheduleType> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
