package com.di.ingestion.catalog;

import com.di.ingestion.schedule.ScheduleDefinition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Validated, typed ingestion definition: header + ordered column mapping +
 * optional schedule. Only definitions that passed catalog validation exist
 * in this form.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionDefinition {

    private long               ingestionId;
    private String             sourceName;
    private String             sourceStage;
    private String             fileFormat;
    private String             destinationTable;
    private LoadType           loadType;

    /** Unique-key columns in configured order; never empty. */
    private List<String>       keyColumns;

    /** Column mapping in staging / extraction order; never empty. */
    private List<MappedColumn> columns;

    /** {@code null} when the ingestion has no schedule row. */
    private ScheduleDefinition schedule;

    public List<String> columnNames() {
        return columns.stream().map(MappedColumn::getColumnName).toList();
    }
}
