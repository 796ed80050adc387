package com.di.ingestion.load;

import com.di.ingestion.audit.RunStatus;
import com.di.ingestion.catalog.CatalogLoadResult;
import com.di.ingestion.catalog.CatalogValidationException;
import com.di.ingestion.catalog.IngestionCatalogReader;
import com.di.ingestion.catalog.IngestionDefinition;
import com.di.ingestion.catalog.LoadType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.di.ingestion.load.IngestionFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionOrchestrator Tests")
class IngestionOrchestratorTest {

    @Mock private IngestionCatalogReader catalogReader;
    @Mock private IngestionPipeline      pipeline;

    private IngestionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new IngestionOrchestrator(catalogReader, pipeline, PROPERTIES,
                Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    private static IngestionRunResult result(long id, RunStatus status) {
        return IngestionRunResult.builder().ingestionId(id).loadType("FULL").status(status).build();
    }

    @Test
    @DisplayName("A failed run does not stop the following ingestion ids")
    void testRunAll_FailureIsolation() {
        IngestionDefinition x = customerDefinition(1, LoadType.FULL);
        IngestionDefinition y = customerDefinition(2, LoadType.INCREMENTAL);
        IngestionDefinition z = customerDefinition(3, LoadType.BULK);
        when(catalogReader.loadActiveDefinitions(CTX))
                .thenReturn(new CatalogLoadResult(List.of(x, y, z), List.of()));
        when(pipeline.run(CTX, x)).thenReturn(result(1, RunStatus.FAILED));
        when(pipeline.run(CTX, y)).thenThrow(new IllegalStateException("boom"));
        when(pipeline.run(CTX, z)).thenReturn(result(3, RunStatus.SUCCESS));

        OrchestrationReport report = orchestrator.runAll();

        assertEquals(3, report.results().size());
        assertEquals(1, report.succeeded());
        assertEquals(2, report.failed());
        IngestionRunResult aborted = report.results().get(1);
        assertEquals(2L, aborted.getIngestionId());
        assertEquals(RunStatus.FAILED, aborted.getStatus());
        assertEquals("boom", aborted.getErrorMessage());
        assertEquals("INCREMENTAL", aborted.getLoadType());
        verify(pipeline).run(CTX, z);
    }

    @Test
    @DisplayName("Definitions rejected at catalog load are reported and never run")
    void testRunAll_Rejected() {
        IngestionDefinition valid = customerDefinition(1, LoadType.FULL);
        CatalogLoadResult.Rejected rejected = new CatalogLoadResult.Rejected(5L, "Unsupported load type: MERGE");
        when(catalogReader.loadActiveDefinitions(CTX))
                .thenReturn(new CatalogLoadResult(List.of(valid), List.of(rejected)));
        when(pipeline.run(CTX, valid)).thenReturn(result(1, RunStatus.SUCCESS));

        OrchestrationReport report = orchestrator.runAll();

        assertEquals(List.of(rejected), report.rejected());
        assertEquals(1, report.results().size());
        verify(pipeline, times(1)).run(any(), any());
    }

    @Test
    @DisplayName("The ingestion id is in the MDC during its run and cleared afterwards")
    void testRunAll_Mdc() {
        IngestionDefinition a = customerDefinition(11, LoadType.FULL);
        IngestionDefinition b = customerDefinition(12, LoadType.FULL);
        when(catalogReader.loadActiveDefinitions(CTX))
                .thenReturn(new CatalogLoadResult(List.of(a, b), List.of()));
        List<String> seen = new ArrayList<>();
        when(pipeline.run(eq(CTX), any())).thenAnswer(inv -> {
            seen.add(MDC.get(IngestionOrchestrator.MDC_KEY));
            IngestionDefinition d = inv.getArgument(1);
            return result(d.getIngestionId(), RunStatus.SUCCESS);
        });

        orchestrator.runAll();

        assertEquals(List.of("11", "12"), seen);
        assertNull(MDC.get(IngestionOrchestrator.MDC_KEY));
    }

    @Test
    @DisplayName("A request-scoped ingestion id in the MDC survives a run")
    void testRunOne_RestoresMdc() {
        IngestionDefinition definition = customerDefinition(4, LoadType.APPEND);
        when(catalogReader.loadDefinition(CTX, 4L)).thenReturn(definition);
        when(pipeline.run(CTX, definition)).thenReturn(result(4, RunStatus.SUCCESS));

        MDC.put(IngestionOrchestrator.MDC_KEY, "4");
        try {
            orchestrator.runOne(4L);
            assertEquals("4", MDC.get(IngestionOrchestrator.MDC_KEY));
        } finally {
            MDC.remove(IngestionOrchestrator.MDC_KEY);
        }
    }

    @Test
    @DisplayName("Empty catalog produces an empty report")
    void testRunAll_Empty() {
        when(catalogReader.loadActiveDefinitions(CTX)).thenReturn(new CatalogLoadResult(List.of(), List.of()));

        OrchestrationReport report = orchestrator.runAll();

        assertTrue(report.results().isEmpty());
        assertEquals(0, report.failed());
        verifyNoInteractions(pipeline);
    }

    @Test
    @DisplayName("runOne runs the requested definition")
    void testRunOne() {
        IngestionDefinition definition = customerDefinition(4, LoadType.APPEND);
        when(catalogReader.loadDefinition(CTX, 4L)).thenReturn(definition);
        when(pipeline.run(CTX, definition)).thenReturn(result(4, RunStatus.SUCCESS));

        assertTrue(orchestrator.runOne(4L).isSuccess());
    }

    @Test
    @DisplayName("runOne propagates catalog validation errors without running anything")
    void testRunOne_Unknown() {
        when(catalogReader.loadDefinition(CTX, 99L))
                .thenThrow(new CatalogValidationException(99L, "Unknown ingestion id 99"));

        CatalogValidationException ex = assertThrows(CatalogValidationException.class,
                () -> orchestrator.runOne(99L));

        assertEquals(99L, ex.getIngestionId());
        verifyNoInteractions(pipeline);
    }
}
