package com.di.ingestion.catalog;

import com.di.ingestion.sql.OrderTerm;
import com.di.ingestion.sql.SqlExpr;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LoadType Tests")
class LoadTypeTest {

    private static final List<String> KEYS = List.of("ID", "CODE");

    @ParameterizedTest
    @CsvSource({"FULL,FULL", "full,FULL", " Incremental ,INCREMENTAL", "bulk,BULK", "Append,APPEND"})
    @DisplayName("Should parse load types case-insensitively")
    void testParse_Known(String raw, LoadType expected) {
        assertEquals(expected, LoadType.parse(raw).orElseThrow());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  ", "SCD1", "FULL_LOAD", "DELTA"})
    @DisplayName("Should not recognise unknown or blank load types")
    void testParse_Unknown(String raw) {
        assertTrue(LoadType.parse(raw).isEmpty());
        assertTrue(LoadType.parse(null).isEmpty());
    }

    @Test
    @DisplayName("FULL keeps the highest first-key value, nulls last")
    void testDedupOrder_Full() {
        assertEquals(List.of(OrderTerm.descNullsLast(SqlExpr.col(null, "ID"))), LoadType.FULL.dedupOrder(KEYS));
    }

    @Test
    @DisplayName("BULK keeps the lowest first-key value")
    void testDedupOrder_Bulk() {
        assertEquals(List.of(OrderTerm.asc(SqlExpr.col(null, "ID"))), LoadType.BULK.dedupOrder(KEYS));
    }

    @Test
    @DisplayName("INCREMENTAL and APPEND keep load order")
    void testDedupOrder_LoadOrder() {
        List<OrderTerm> loadOrder = List.of(OrderTerm.asc(SqlExpr.now()));
        assertEquals(loadOrder, LoadType.INCREMENTAL.dedupOrder(KEYS));
        assertEquals(loadOrder, LoadType.APPEND.dedupOrder(KEYS));
    }

    @Test
    @DisplayName("Only INCREMENTAL and BULK fail on an empty source")
    void testEmptySourceFails() {
        assertFalse(LoadType.FULL.emptySourceFails());
        assertTrue(LoadType.INCREMENTAL.emptySourceFails());
        assertTrue(LoadType.BULK.emptySourceFails());
        assertFalse(LoadType.APPEND.emptySourceFails());
    }

    @Test
    @DisplayName("Only FULL advances the schedule")
    void testAdvancesSchedule() {
        assertTrue(LoadType.FULL.advancesSchedule());
        assertFalse(LoadType.INCREMENTAL.advancesSchedule());
        assertFalse(LoadType.BULK.advancesSchedule());
        assertFalse(LoadType.APPEND.advancesSchedule());
    }
}
