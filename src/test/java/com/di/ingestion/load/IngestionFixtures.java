package com.di.ingestion.load;

import com.di.ingestion.catalog.IngestionDefinition;
import com.di.ingestion.catalog.LoadType;
import com.di.ingestion.catalog.MappedColumn;
import com.di.ingestion.config.IngestionProperties;
import com.di.ingestion.config.WarehouseContext;
import com.di.ingestion.schedule.ScheduleDefinition;
import com.di.ingestion.sql.TableRef;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Shared catalog fixtures for the load tests: a CUSTOMER ingestion keyed by ID.
 */
public final class IngestionFixtures {

    public static final IngestionProperties PROPERTIES = new IngestionProperties();
    public static final WarehouseContext    CTX        = PROPERTIES.toContext();

    public static final String   STAGE       = "@RAW_STAGE/customers/";
    public static final String   FORMAT      = "CSV_FORMAT";
    public static final TableRef CUSTOMER    = TableRef.of("UT_DE_FRAMEWORK", "RAW", "CUSTOMER");
    public static final TableRef STAGING     = TableRef.of("UT_DE_FRAMEWORK", "STAGING", "CUSTOMER_STG");
    public static final TableRef DEDUP       = TableRef.of("UT_DE_FRAMEWORK", "STAGING", "CUSTOMER_STG_DEDUP");

    private IngestionFixtures() {}

    /** ID from field 1, NAME from field 2, CITY from field 4. */
    public static List<MappedColumn> customerMapping() {
        return List.of(
                MappedColumn.builder().columnName("ID").dataType("NUMBER(10,0)").sourcePosition(1).build(),
                MappedColumn.builder().columnName("NAME").dataType("VARCHAR(100)").sourcePosition(2).build(),
                MappedColumn.builder().columnName("CITY").dataType("VARCHAR(50)").sourcePosition(4).build());
    }

    public static List<String> fields(String id, String name, String ignored, String city) {
        return List.of(id, name, ignored, city);
    }

    public static ScheduleDefinition hourlySchedule(long ingestionId) {
        return ScheduleDefinition.builder()
                .scheduleId(100 + ingestionId)
                .ingestionId(ingestionId)
                .scheduleType("RECURRING")
                .intervalMinutes(60)
                .timezone("UTC")
                .lastRunAt(LocalDateTime.of(2023, 12, 31, 23, 0))
                .nextRunAt(LocalDateTime.of(2024, 1, 1, 0, 0))
                .build();
    }

    public static IngestionDefinition customerDefinition(long id, LoadType loadType) {
        return definition(id, loadType, "CUSTOMER", STAGE);
    }

    public static IngestionDefinition definition(long id, LoadType loadType, String destination, String stage) {
        return IngestionDefinition.builder()
                .ingestionId(id)
                .sourceName("crm")
                .sourceStage(stage)
                .fileFormat(FORMAT)
                .destinationTable(destination)
                .loadType(loadType)
                .keyColumns(List.of("ID"))
                .columns(customerMapping())
                .schedule(hourlySchedule(id))
                .build();
    }
}
