package com.di.ingestion.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Single binding for all ingestion engine settings.
 *
 * <pre>
 * ingestion:
 *   run-on-startup: false
 *   warehouse:
 *     database: UT_DE_FRAMEWORK
 *     schema: RAW
 *     staging-schema: STAGING
 *     catalog-schema: CONFIG
 *     role: SYSADMIN
 *     warehouse: COMPUTE_WH
 *   catalog:
 *     header-table: INGESTION_HEADER
 *     mapping-table: INGESTION_COLUMN_MAPPING
 *     schedule-table: INGESTION_SCHEDULE
 *     log-table: INGESTION_LOG
 *     log-sequence: INGESTION_LOG_SEQ
 *   staging:
 *     table-suffix: _STG
 *     dedup-suffix: _DEDUP
 *     on-error: CONTINUE
 *   scd:
 *     current-flag-column: IS_CURRENT
 *     start-date-column: START_DATE
 *     end-date-column: END_DATE
 *   merge:
 *     versioning: IN_PLACE
 *   schedule:
 *     default-timezone: UTC
 *   audit:
 *     max-error-length: 4000
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "ingestion")
public class IngestionProperties {

    /** Run every active ingestion once when the application starts. */
    private boolean runOnStartup = false;

    @Valid
    private Warehouse warehouse = new Warehouse();

    @Valid
    private Catalog catalog = new Catalog();

    @Valid
    private Staging staging = new Staging();

    @Valid
    private Scd scd = new Scd();

    private Merge merge = new Merge();

    @Valid
    private Schedule schedule = new Schedule();

    @Valid
    private Audit audit = new Audit();

    public WarehouseContext toContext() {
        return new WarehouseContext(
                warehouse.getDatabase(),
                warehouse.getSchema(),
                warehouse.getStagingSchema(),
                warehouse.getCatalogSchema());
    }

    @Data
    public static class Warehouse {
        @NotBlank
        private String database = "UT_DE_FRAMEWORK";
        @NotBlank
        private String schema = "RAW";
        @NotBlank
        private String stagingSchema = "STAGING";
        @NotBlank
        private String catalogSchema = "CONFIG";
        /** Session role; fills the {@code role} parameter of the datasource URL. */
        @NotBlank
        private String role = "SYSADMIN";
        /** Compute warehouse; fills the {@code warehouse} parameter of the datasource URL. */
        @NotBlank
        private String warehouse = "COMPUTE_WH";
    }

    @Data
    public static class Catalog {
        @NotBlank
        private String headerTable = "INGESTION_HEADER";
        @NotBlank
        private String mappingTable = "INGESTION_COLUMN_MAPPING";
        @NotBlank
        private String scheduleTable = "INGESTION_SCHEDULE";
        @NotBlank
        private String logTable = "INGESTION_LOG";
        @NotBlank
        private String logSequence = "INGESTION_LOG_SEQ";
    }

    @Data
    public static class Staging {
        @NotBlank
        private String tableSuffix = "_STG";
        @NotBlank
        private String dedupSuffix = "_DEDUP";
        /** Snowflake {@code ON_ERROR} copy option; malformed rows are skipped by default. */
        @NotBlank
        private String onError = "CONTINUE";
    }

    @Data
    public static class Scd {
        @NotBlank
        private String currentFlagColumn = "IS_CURRENT";
        @NotBlank
        private String startDateColumn = "START_DATE";
        @NotBlank
        private String endDateColumn = "END_DATE";
        @NotBlank
        private String timestampType = "TIMESTAMP_NTZ";
    }

    @Data
    public static class Merge {
        /** {@code IN_PLACE} or {@code CLOSE_AND_INSERT}; see the merge policies. */
        @Pattern(regexp = "(?i)IN_PLACE|CLOSE_AND_INSERT")
        private String versioning = "IN_PLACE";
    }

    @Data
    public static class Schedule {
        @NotBlank
        private String defaultTimezone = "UTC";
    }

    @Data
    public static class Audit {
        /** Longer error messages are cut to this length plus {@code "..."} before they are logged. */
        @Min(1)
        private int maxErrorLength = 4000;
    }
}
