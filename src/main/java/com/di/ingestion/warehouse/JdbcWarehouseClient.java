package com.di.ingestion.warehouse;

import com.di.ingestion.sql.SqlDialect;
import com.di.ingestion.sql.SqlStatement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.StatementCallback;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link WarehouseClient} backed by {@link JdbcTemplate}.
 *
 * <p>Statements are rendered by the configured {@link SqlDialect} and run with
 * {@link java.sql.Statement#execute(String)} so that both row-returning commands
 * ({@code LIST}, {@code SELECT}) and plain DDL/DML are handled.
 *
 * <p>The Snowflake driver reports {@code COPY}, {@code MERGE} and {@code INSERT}
 * as an update count only. For statements that {@linkplain SqlStatement#reportsSummary()
 * report a summary}, the count rows are read back on the same statement with
 * {@link SqlDialect#renderLastResult()}; if that yields nothing the update count is returned.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JdbcWarehouseClient implements WarehouseClient {

    private final JdbcTemplate jdbcTemplate;
    private final SqlDialect   dialect;

    @Override
    public StatementResult execute(SqlStatement statement) {
        String sql = dialect.render(statement);
        log.debug("[SQL] {} → {}", statement.kind(), sql);
        long started = System.currentTimeMillis();
        try {
            StatementResult result = jdbcTemplate.execute((StatementCallback<StatementResult>) stmt -> {
                boolean hasResultSet = stmt.execute(sql);
                if (hasResultSet) {
                    try (ResultSet rs = stmt.getResultSet()) {
                        return StatementResult.ofRows(readRows(rs));
                    }
                }
                long updateCount = stmt.getUpdateCount();
                if (statement.reportsSummary()) {
                    List<Map<String, Object>> summary = readSummary(stmt, statement);
                    if (!summary.isEmpty()) {
                        return StatementResult.ofRows(summary);
                    }
                }
                return StatementResult.ofUpdateCount(updateCount);
            });
            log.debug("[SQL] {} completed in {} ms: {}", statement.kind(),
                      System.currentTimeMillis() - started, result);
            return result != null ? result : StatementResult.empty();
        } catch (DataAccessException ex) {
            throw new StatementExecutionException(statement.kind(), sql, ex);
        }
    }

    private List<Map<String, Object>> readSummary(Statement stmt, SqlStatement statement) {
        try {
            if (stmt.execute(dialect.renderLastResult())) {
                try (ResultSet rs = stmt.getResultSet()) {
                    return readRows(rs);
                }
            }
        } catch (SQLException ex) {
            log.warn("[SQL] Could not read the result summary of {}, using the update count: {}",
                     statement.kind(), ex.getMessage());
        }
        return List.of();
    }

    private static List<Map<String, Object>> readRows(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int columns = meta.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>(columns * 2);
            for (int i = 1; i <= columns; i++) {
                row.put(meta.getColumnLabel(i), rs.getObject(i));
            }
            rows.add(row);
        }
        return rows;
    }
}
