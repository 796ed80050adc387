package com.di.ingestion.load;

import com.di.ingestion.audit.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Outcome of one pipeline run, as returned to callers and mirrored in the ingestion log.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionRunResult {

    private long          ingestionId;
    private String        loadType;
    private String        destination;
    private RunStatus     status;
    private long          sourceCount;
    private long          destinationCount;
    private long          insertedCount;
    private long          closedCount;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private String        errorMessage;
    /** Null when the audit row could not be written. */
    private Long          logId;
    /** Next run persisted by this run, if the schedule was advanced. */
    private LocalDateTime nextRunAt;

    public boolean isSuccess() {
        return status == RunStatus.SUCCESS;
    }
}
