package com.di.ingestion.warehouse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one executed statement: either result rows or an update count.
 *
 * <p>Column labels are normalised to lower case so callers can read
 * {@code rows_loaded} or {@code number of rows inserted} regardless of how
 * the driver reports them.
 */
public final class StatementResult {

    private static final StatementResult EMPTY = new StatementResult(List.of(), -1);

    private final List<Map<String, Object>> rows;
    private final long updateCount;

    private StatementResult(List<Map<String, Object>> rows, long updateCount) {
        this.rows = rows;
        this.updateCount = updateCount;
    }

    public static StatementResult empty() {
        return EMPTY;
    }

    public static StatementResult ofUpdateCount(long updateCount) {
        return new StatementResult(List.of(), updateCount);
    }

    public static StatementResult ofRows(List<Map<String, Object>> rows) {
        List<Map<String, Object>> normalised = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> copy = new LinkedHashMap<>();
            row.forEach((k, v) -> copy.put(k.toLowerCase(Locale.ROOT), v));
            normalised.add(Collections.unmodifiableMap(copy));
        }
        return new StatementResult(Collections.unmodifiableList(normalised), -1);
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    /** Update count reported by the driver, or {@code -1} when the statement returned rows. */
    public long getUpdateCount() {
        return updateCount;
    }

    public boolean hasRows() {
        return !rows.isEmpty();
    }

    /** Sum of a numeric column across all rows; non-numeric and missing values count as zero. */
    public long sumLong(String column) {
        String key = column.toLowerCase(Locale.ROOT);
        long total = 0;
        for (Map<String, Object> row : rows) {
            total += asLong(row.get(key)).orElse(0L);
        }
        return total;
    }

    /** Numeric value of {@code column} in the first row, if present. */
    public Optional<Long> firstLong(String column) {
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        return asLong(rows.get(0).get(column.toLowerCase(Locale.ROOT)));
    }

    /** Numeric value of the first column of the first row, if present. */
    public Optional<Long> singleLong() {
        if (rows.isEmpty() || rows.get(0).isEmpty()) {
            return Optional.empty();
        }
        return asLong(rows.get(0).values().iterator().next());
    }

    private static Optional<Long> asLong(Object value) {
        if (value instanceof Number n) {
            return Optional.of(n.longValue());
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Optional.of(Long.parseLong(s.trim()));
            } catch (NumberFormatException ignored) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return rows.isEmpty() ? "StatementResult{updateCount=" + updateCount + "}"
                              : "StatementResult{rows=" + rows.size() + "}";
    }
}
