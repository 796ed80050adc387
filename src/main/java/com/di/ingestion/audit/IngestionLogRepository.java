package com.di.ingestion.audit;

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

/**
 * JDBC repository for the ingestion log table.
 */
@Repository
@RequiredArgsConstructor
public class IngestionLogRepository {

    private final JdbcTemplate        jdbc;
    private final SqlDialect          dialect;
    private final IngestionProperties properties;

    static final RowMapper<IngestionLogEntry> ROW_MAPPER = (rs, n) -> IngestionLogEntry.builder()
            .logId(rs.getLong("log_id"))
            .ingestionId(rs.getLong("ingestion_id"))
            .source(rs.getString("source"))
            .destination(rs.getString("destination"))
            .stage(rs.getString("stage"))
            .fileFormat(rs.getString("file_format"))
            .loadType(rs.getString("load_type"))
            .startTime(toLocal(rs.getTimestamp("start_time")))
            .endTime(toLocal(rs.getTimestamp("end_time")))
            .sourceCount(rs.getLong("source_count"))
            .destinationCount(rs.getLong("destination_count"))
            .status(RunStatus.valueOf(rs.getString("status")))
            .errorMessage(rs.getString("error_message"))
            .build();

    public void insert(WarehouseContext ctx, IngestionLogEntry e) {
        jdbc.update("""
            INSERT INTO %s
              (log_id, ingestion_id, source, destination, stage, file_format, load_type,
               start_time, end_time, source_count, destination_count, status, error_message)
            VALUES (?,?,?,?,?,?,?, ?,?,?,?,?,?)
            """.formatted(table(ctx)),
            e.getLogId(), e.getIngestionId(), e.getSource(), e.getDestination(),
            e.getStage(), e.getFileFormat(), e.getLoadType(),
            toTimestamp(e.getStartTime()), toTimestamp(e.getEndTime()),
            e.getSourceCount(), e.getDestinationCount(), e.getStatus().name(), e.getErrorMessage());
    }

    /** Most recent entries first. */
    public List<IngestionLogEntry> findByIngestionId(WarehouseContext ctx, long ingestionId, int limit) {
        return jdbc.query("""
            SELECT log_id, ingestion_id, source, destination, stage, file_format, load_type,
                   start_time, end_time, source_count, destination_count, status, error_message
              FROM %s
             WHERE ingestion_id = ?
             ORDER BY start_time DESC, log_id DESC
             LIMIT ?
            """.formatted(table(ctx)), ROW_MAPPER, ingestionId, limit);
    }

    private String table(WarehouseContext ctx) {
        return dialect.renderTable(
                TableRef.of(ctx.database(), ctx.catalogSchema(), properties.getCatalog().getLogTable()));
    }

    private static Timestamp toTimestamp(LocalDateTime t) {
        return t == null ? null : Timestamp.valueOf(t);
    }

    private static LocalDateTime toLocal(Timestamp ts) {
        return ts == null ? null : ts.toLocalDateTime();
    }
}
