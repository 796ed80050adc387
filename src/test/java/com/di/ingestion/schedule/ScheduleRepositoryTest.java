package com.di.ingestion.schedule;

import com.di.ingestion.config.IngestionProperties;
import com.di.ingestion.config.WarehouseContext;
import com.di.ingestion.sql.SnowflakeDialect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ScheduleRepository Tests")
class ScheduleRepositoryTest {

    private final WarehouseContext ctx =
            new WarehouseContext("UT_DE_FRAMEWORK", "RAW", "STAGING", "CONFIG");

    @Mock private JdbcTemplate jdbc;
    @Mock private ResultSet    rs;

    private ScheduleRepository repository;

    @BeforeEach
    void setUp() {
        repository = new ScheduleRepository(jdbc, new SnowflakeDialect(), new IngestionProperties());
    }

    @Test
    @DisplayName("The first schedule row of an ingestion id is returned")
    void testFindByIngestionId() {
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        ScheduleDefinition first = ScheduleDefinition.builder().scheduleId(3L).build();
        ScheduleDefinition second = ScheduleDefinition.builder().scheduleId(4L).build();
        when(jdbc.query(sql.capture(), eq(ScheduleRepository.ROW_MAPPER), eq(7L))).thenReturn(List.of(first, second));

        assertSame(first, repository.findByIngestionId(ctx, 7L).orElseThrow());
        assertTrue(sql.getValue().contains("FROM UT_DE_FRAMEWORK.CONFIG.INGESTION_SCHEDULE"));
        assertTrue(sql.getValue().contains("ORDER BY schedule_id"));
    }

    @Test
    @DisplayName("No schedule row yields an empty result")
    void testFindByIngestionId_None() {
        when(jdbc.query(anyString(), eq(ScheduleRepository.ROW_MAPPER), eq(8L))).thenReturn(List.of());

        assertTrue(repository.findByIngestionId(ctx, 8L).isEmpty());
    }

    @Test
    @DisplayName("Run times are bound as timestamps and scoped by schedule id")
    void testUpdateRunTimes() {
        LocalDateTime last = LocalDateTime.of(2024, 3, 10, 9, 0);
        LocalDateTime next = LocalDateTime.of(2024, 3, 10, 10, 0);
        LocalDateTime updated = LocalDateTime.of(2024, 3, 10, 9, 0, 5);
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        when(jdbc.update(sql.capture(), eq(Timestamp.valueOf(last)), eq(Timestamp.valueOf(next)),
                eq(Timestamp.valueOf(updated)), eq(3L))).thenReturn(1);

        assertEquals(1, repository.updateRunTimes(ctx, 3L, last, next, updated));
        assertTrue(sql.getValue().startsWith("UPDATE UT_DE_FRAMEWORK.CONFIG.INGESTION_SCHEDULE"));
        assertTrue(sql.getValue().contains("WHERE schedule_id = ?"));
    }

    @Test
    @DisplayName("RECURRING row with timestamps maps to local date-times")
    void testRowMapper_Recurring() throws SQLException {
        when(rs.getLong("schedule_id")).thenReturn(3L);
        when(rs.getLong("ingestion_id")).thenReturn(7L);
        when(rs.getString("schedule_type")).thenReturn("RECURRING");
        when(rs.getInt("interval_minutes")).thenReturn(60);
        when(rs.wasNull()).thenReturn(false);
        when(rs.getString("cron_expression")).thenReturn(null);
        when(rs.getString("timezone")).thenReturn("Europe/London");
        when(rs.getTimestamp("last_run_at")).thenReturn(Timestamp.valueOf("2024-03-10 09:00:00"));
        when(rs.getTimestamp("next_run_at")).thenReturn(Timestamp.valueOf("2024-03-10 10:00:00"));
        when(rs.getTimestamp("updated_at")).thenReturn(null);

        ScheduleDefinition s = ScheduleRepository.ROW_MAPPER.mapRow(rs, 0);

        assertEquals(3L, s.getScheduleId());
        assertEquals(7L, s.getIngestionId());
        assertEquals(60, s.getIntervalMinutes());
        assertNull(s.getCronExpression());
        assertEquals("Europe/London", s.getTimezone());
        assertEquals(LocalDateTime.of(2024, 3, 10, 9, 0), s.getLastRunAt());
        assertEquals(LocalDateTime.of(2024, 3, 10, 10, 0), s.getNextRunAt());
        assertNull(s.getUpdatedAt());
    }

    @Test
    @DisplayName("CRON row keeps a NULL interval as null instead of zero")
    void testRowMapper_NullInterval() throws SQLException {
        when(rs.getString("schedule_type")).thenReturn("CRON");
        when(rs.getInt("interval_minutes")).thenReturn(0);
        when(rs.wasNull()).thenReturn(true);
        when(rs.getString("cron_expression")).thenReturn("0 6 * * 1-5");
        when(rs.getString("timezone")).thenReturn(null);

        ScheduleDefinition s = ScheduleRepository.ROW_MAPPER.mapRow(rs, 0);

        assertNull(s.getIntervalMinutes());
        assertEquals("0 6 * * 1-5", s.getCronExpression());
        assertNull(s.getLastRunAt());
        assertNull(s.getNextRunAt());
    }
}
