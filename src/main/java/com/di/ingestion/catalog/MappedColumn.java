package com.di.ingestion.catalog;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of an ingestion's column mapping.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MappedColumn {

    private String columnName;
    private String dataType;
    /** 1-based field position in the source file. */
    private int    sourcePosition;
}
