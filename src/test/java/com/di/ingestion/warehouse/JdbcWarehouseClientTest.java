package com.di.ingestion.warehouse;

import com.di.ingestion.catalog.LoadType;
import com.di.ingestion.load.merge.InPlaceMergePolicy;
import com.di.ingestion.load.merge.MergeResult;
import com.di.ingestion.load.merge.ScdMergeEngine;
import com.di.ingestion.load.stage.StagingLoader;
import com.di.ingestion.sql.ColumnDef;
import com.di.ingestion.sql.SnowflakeDialect;
import com.di.ingestion.sql.SqlStatement;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.StatementCallback;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static com.di.ingestion.load.IngestionFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JdbcWarehouseClient Tests")
class JdbcWarehouseClientTest {

    private static final String LAST_RESULT = "SELECT * FROM TABLE(RESULT_SCAN(LAST_QUERY_ID()))";

    @Mock private JdbcTemplate jdbcTemplate;
    @Mock private Statement    statement;

    private JdbcWarehouseClient client;

    @BeforeEach
    void setUp() {
        client = new JdbcWarehouseClient(jdbcTemplate, new SnowflakeDialect());
    }

    @SuppressWarnings("unchecked")
    private void runCallbacksAgainstStatement() {
        when(jdbcTemplate.execute(any(StatementCallback.class))).thenAnswer(
                inv -> ((StatementCallback<Object>) inv.getArgument(0)).doInStatement(statement));
    }

    @Test
    @DisplayName("Result rows are read with lower-cased labels")
    void testExecute_Rows() throws SQLException {
        runCallbacksAgainstStatement();
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData meta = mock(ResultSetMetaData.class);
        when(statement.execute(anyString())).thenReturn(true);
        when(statement.getResultSet()).thenReturn(rs);
        when(rs.getMetaData()).thenReturn(meta);
        when(meta.getColumnCount()).thenReturn(1);
        when(meta.getColumnLabel(1)).thenReturn("COUNT(*)");
        when(rs.next()).thenReturn(true, false);
        when(rs.getObject(1)).thenReturn(42L);

        assertEquals(42L, client.count(CUSTOMER));
        verify(statement).execute("SELECT COUNT(*) FROM UT_DE_FRAMEWORK.RAW.CUSTOMER");
        verify(rs).close();
    }

    @Test
    @DisplayName("Statements without a result set report the update count")
    void testExecute_UpdateCount() throws SQLException {
        runCallbacksAgainstStatement();
        when(statement.execute(anyString())).thenReturn(false);
        when(statement.getUpdateCount()).thenReturn(3);

        StatementResult result = client.execute(new SqlStatement.CountRows(CUSTOMER));

        assertFalse(result.hasRows());
        assertEquals(3, result.getUpdateCount());
    }

    /** Stubs {@code statement.getResultSet()} with one row per entry of {@code values}. */
    private ResultSet resultSet(List<String> labels, Object... values) throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData meta = mock(ResultSetMetaData.class);
        when(statement.getResultSet()).thenReturn(rs);
        when(rs.getMetaData()).thenReturn(meta);
        when(meta.getColumnCount()).thenReturn(labels.size());
        for (int i = 0; i < labels.size(); i++) {
            when(meta.getColumnLabel(i + 1)).thenReturn(labels.get(i));
            when(rs.getObject(i + 1)).thenReturn(values[i]);
        }
        when(rs.next()).thenReturn(true, false);
        return rs;
    }

    @Test
    @DisplayName("COPY reported as an update count reads its per-file rows from the last result")
    void testExecute_CopySummaryFromLastResult() throws SQLException {
        runCallbacksAgainstStatement();
        when(statement.execute(startsWith("LIST"))).thenReturn(false);
        when(statement.execute(startsWith("COPY INTO"))).thenReturn(false);
        when(statement.execute(LAST_RESULT)).thenReturn(true);
        when(statement.getUpdateCount()).thenReturn(5);
        resultSet(List.of("file", "status", "rows_loaded", "errors_seen"),
                  "customers/data_0_0_0.csv.gz", "PARTIALLY_LOADED", 5L, 1L);

        long loaded = new StagingLoader(client, PROPERTIES).loadStaging(STAGING, customerMapping(), STAGE, FORMAT);

        assertEquals(5, loaded);
        verify(statement).execute(LAST_RESULT);
    }

    @Test
    @DisplayName("COPY falls back to the update count when the last result cannot be read")
    void testExecute_CopyFallsBackToUpdateCount() throws SQLException {
        runCallbacksAgainstStatement();
        when(statement.execute(startsWith("LIST"))).thenReturn(false);
        when(statement.execute(startsWith("COPY INTO"))).thenReturn(false);
        when(statement.execute(LAST_RESULT)).thenThrow(new SQLException("Result for query has expired"));
        when(statement.getUpdateCount()).thenReturn(5);

        long loaded = new StagingLoader(client, PROPERTIES).loadStaging(STAGING, customerMapping(), STAGE, FORMAT);

        assertEquals(5, loaded);
    }

    @Test
    @DisplayName("MERGE reported as an update count is split into inserted and updated from the last result")
    void testExecute_MergeSummaryFromLastResult() throws SQLException {
        runCallbacksAgainstStatement();
        when(statement.execute(startsWith("MERGE INTO"))).thenReturn(false);
        when(statement.execute(LAST_RESULT)).thenReturn(true);
        when(statement.getUpdateCount()).thenReturn(5);
        resultSet(List.of("number of rows inserted", "number of rows updated"), 3L, 2L);

        MergeResult merged = new ScdMergeEngine(client, new InPlaceMergePolicy(), PROPERTIES)
                .merge(CUSTOMER, DEDUP, List.of("ID"), List.of("ID", "NAME", "CITY"), LoadType.FULL);

        assertEquals(new MergeResult(3, 2), merged);
    }

    @Test
    @DisplayName("Statements without count rows never query the last result")
    void testExecute_NoSummaryForOtherStatements() throws SQLException {
        runCallbacksAgainstStatement();
        when(statement.execute(anyString())).thenReturn(false);
        when(statement.getUpdateCount()).thenReturn(0);

        client.execute(new SqlStatement.AddColumn(CUSTOMER, ColumnDef.of("CITY", "VARCHAR")));

        verify(statement, never()).execute(LAST_RESULT);
    }

    @Test
    @DisplayName("Driver errors are wrapped with the statement kind and SQL")
    void testExecute_Failure() {
        when(jdbcTemplate.execute(any(StatementCallback.class))).thenThrow(
                new BadSqlGrammarException("count", "SELECT", new SQLException("Object does not exist")));

        StatementExecutionException ex = assertThrows(StatementExecutionException.class,
                () -> client.execute(new SqlStatement.CountRows(CUSTOMER)));

        assertEquals("CountRows", ex.getStatementKind());
        assertEquals("SELECT COUNT(*) FROM UT_DE_FRAMEWORK.RAW.CUSTOMER", ex.getSql());
        assertTrue(ex.getMessage().contains("Object does not exist"));
    }
}
