package com.di.ingestion.audit;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One row of the append-only ingestion log. Times are UTC wall-clock.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class IngestionLogEntry {

    /** Assigned by the audit logger from the log-id sequence. */
    private Long          logId;
    private long          ingestionId;
    private String        source;
    private String        destination;
    private String        stage;
    private String        fileFormat;
    private String        loadType;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private long          sourceCount;
    private long          destinationCount;
    private RunStatus     status;
    /** Exception text for FAILED runs, null otherwise. */
    private String        errorMessage;
}
