package com.di.ingestion.load;

import com.di.ingestion.config.IngestionProperties;

/**
 * Names of the SCD bookkeeping columns carried by every destination table.
 */
public record ScdColumns(String currentFlag, String startDate, String endDate, String timestampType) {

    public static ScdColumns from(IngestionProperties properties) {
        IngestionProperties.Scd scd = properties.getScd();
        return new ScdColumns(scd.getCurrentFlagColumn(), scd.getStartDateColumn(),
                              scd.getEndDateColumn(), scd.getTimestampType());
    }
}
