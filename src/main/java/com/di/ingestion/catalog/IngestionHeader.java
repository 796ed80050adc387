package com.di.ingestion.catalog;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw row of the ingestion header catalog table, as configured.
 *
 * <p>Values are kept as stored; {@link IngestionCatalogReader} validates and
 * types them into an {@link IngestionDefinition}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionHeader {

    private Long    ingestionId;

    // ---- source ------------------------------------------------------------
    private String  sourceName;
    /** Named stage location, e.g. {@code @RAW.LANDING_STAGE/customer/}. */
    private String  sourceStage;
    private String  fileFormat;

    // ---- destination -------------------------------------------------------
    private String  destinationTable;

    // ---- strategy ----------------------------------------------------------
    private String  loadType;
    /** Comma-separated, ordered unique-key column names. */
    private String  uniqueKey;

    private boolean active;
}
