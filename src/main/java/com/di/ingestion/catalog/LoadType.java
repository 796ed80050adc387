package com.di.ingestion.catalog;

import com.di.ingestion.sql.OrderTerm;
import com.di.ingestion.sql.SqlExpr;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Load strategy of an ingestion definition, with the per-strategy policies
 * the pipeline needs: deduplication tie-break, empty-source handling and
 * whether a successful run advances the schedule.
 *
 * <p>Parsed once when the catalog is read; an unknown value rejects the
 * definition before any run starts.
 */
public enum LoadType {

    /** Highest value of the first key column wins; empty source is a valid "no changes" run. */
    FULL {
        @Override
        public List<OrderTerm> dedupOrder(List<String> keyColumns) {
            return List.of(OrderTerm.descNullsLast(SqlExpr.col(null, keyColumns.get(0))));
        }

        @Override
        public boolean emptySourceFails() {
            return false;
        }

        @Override
        public boolean advancesSchedule() {
            return true;
        }
    },

    /** Load-order tie-break: all rows share the load timestamp, so the first materialised row wins. */
    INCREMENTAL {
        @Override
        public List<OrderTerm> dedupOrder(List<String> keyColumns) {
            return List.of(OrderTerm.asc(SqlExpr.now()));
        }

        @Override
        public boolean emptySourceFails() {
            return true;
        }
    },

    /** Lowest value of the first key column wins. */
    BULK {
        @Override
        public List<OrderTerm> dedupOrder(List<String> keyColumns) {
            return List.of(OrderTerm.asc(SqlExpr.col(null, keyColumns.get(0))));
        }

        @Override
        public boolean emptySourceFails() {
            return true;
        }
    },

    /** Pure append; the batch itself is collapsed in load order. */
    APPEND {
        @Override
        public List<OrderTerm> dedupOrder(List<String> keyColumns) {
            return List.of(OrderTerm.asc(SqlExpr.now()));
        }

        @Override
        public boolean emptySourceFails() {
            return false;
        }
    };

    /** Window ordering that decides which staged row survives per key tuple. */
    public abstract List<OrderTerm> dedupOrder(List<String> keyColumns);

    /** Whether zero rows copied into staging fails the run. */
    public abstract boolean emptySourceFails();

    /** Whether a successful run recomputes and persists the next scheduled run. */
    public boolean advancesSchedule() {
        return false;
    }

    /**
     * Case-insensitive lookup.
     *
     * @return the matching load type, or empty for {@code null}, blank or unknown values
     */
    public static Optional<LoadType> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (LoadType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
