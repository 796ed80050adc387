package com.di.ingestion.audit;

import com.di.ingestion.config.IngestionProperties;
import com.di.ingestion.config.WarehouseContext;
import com.di.ingestion.sql.SnowflakeDialect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("SequenceLogIdGenerator Tests")
class SequenceLogIdGeneratorTest {

    private static final String NEXTVAL = "SELECT UT_DE_FRAMEWORK.CONFIG.INGESTION_LOG_SEQ.NEXTVAL";

    private final WarehouseContext ctx =
            new WarehouseContext("UT_DE_FRAMEWORK", "RAW", "STAGING", "CONFIG");

    @Mock private JdbcTemplate jdbc;

    private SequenceLogIdGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new SequenceLogIdGenerator(jdbc, new SnowflakeDialect(), new IngestionProperties());
    }

    @Test
    @DisplayName("Next id comes from the catalog-schema sequence")
    void testNextId() {
        when(jdbc.queryForObject(NEXTVAL, Long.class)).thenReturn(101L);

        assertEquals(101L, generator.nextId(ctx));
    }

    @Test
    @DisplayName("A NULL sequence value is an error, not id zero")
    void testNextId_Null() {
        when(jdbc.queryForObject(NEXTVAL, Long.class)).thenReturn(null);

        EmptyResultDataAccessException ex = assertThrows(EmptyResultDataAccessException.class,
                () -> generator.nextId(ctx));
        assertTrue(ex.getMessage().contains("INGESTION_LOG_SEQ"));
    }
}
