package com.di.ingestion.schedule;

import com.di.ingestion.config.IngestionProperties;
import com.di.ingestion.config.WarehouseContext;
import com.di.ingestion.sql.SqlDialect;
import com.di.ingestion.sql.TableRef;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * JDBC repository for the ingestion schedule table.
 */
@Repository
@RequiredArgsConstructor
public class ScheduleRepository {

    private final JdbcTemplate        jdbc;
    private final SqlDialect          dialect;
    private final IngestionProperties properties;

    static final RowMapper<ScheduleDefinition> ROW_MAPPER = (rs, n) -> {
        ScheduleDefinition s = new ScheduleDefinition();
        s.setScheduleId(rs.getLong("schedule_id"));
        s.setIngestionId(rs.getLong("ingestion_id"));
        s.setScheduleType(rs.getString("schedule_type"));
        int interval = rs.getInt("interval_minutes");
        s.setIntervalMinutes(rs.wasNull() ? null : interval);
        s.setCronExpression(rs.getString("cron_expression"));
        s.setTimezone(rs.getString("timezone"));
        s.setLastRunAt(toLocal(rs.getTimestamp("last_run_at")));
        s.setNextRunAt(toLocal(rs.getTimestamp("next_run_at")));
        s.setUpdatedAt(toLocal(rs.getTimestamp("updated_at")));
        return s;
    };

    public Optional<ScheduleDefinition> findByIngestionId(WarehouseContext ctx, long ingestionId) {
        List<ScheduleDefinition> rows = jdbc.query("""
            SELECT schedule_id, ingestion_id, schedule_type, interval_minutes, cron_expression,
                   timezone, last_run_at, next_run_at, updated_at
              FROM %s
             WHERE ingestion_id = ?
             ORDER BY schedule_id
            """.formatted(table(ctx)), ROW_MAPPER, ingestionId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Persists last/next run in one statement scoped by schedule id.
     *
     * @return number of rows updated (0 when the schedule no longer exists)
     */
    public int updateRunTimes(WarehouseContext ctx,
                              long scheduleId,
                              LocalDateTime lastRunAt,
                              LocalDateTime nextRunAt,
                              LocalDateTime updatedAt) {
        return jdbc.update("""
            UPDATE %s
               SET last_run_at = ?,
                   next_run_at = ?,
                   updated_at  = ?
             WHERE schedule_id = ?
            """.formatted(table(ctx)),
            Timestamp.valueOf(lastRunAt), Timestamp.valueOf(nextRunAt), Timestamp.valueOf(updatedAt),
            scheduleId);
    }

    private String table(WarehouseContext ctx) {
        return dialect.renderTable(
                TableRef.of(ctx.database(), ctx.catalogSchema(), properties.getCatalog().getScheduleTable()));
    }

    private static LocalDateTime toLocal(Timestamp ts) {
        return ts == null ? null : ts.toLocalDateTime();
    }
}
