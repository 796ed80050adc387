package com.di.ingestion.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IngestionProperties Tests")
class IngestionPropertiesTest {

    @Configuration
    @EnableConfigurationProperties(IngestionProperties.class)
    static class PropertiesConfig {
    }

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfig.class);

    @Test
    @DisplayName("Defaults bind and build a four-part warehouse context")
    void testDefaults() {
        runner.run(context -> {
            IngestionProperties properties = context.getBean(IngestionProperties.class);
            assertEquals(new WarehouseContext("UT_DE_FRAMEWORK", "RAW", "STAGING", "CONFIG"), properties.toContext());
            assertEquals("SYSADMIN", properties.getWarehouse().getRole());
            assertEquals("COMPUTE_WH", properties.getWarehouse().getWarehouse());
            assertEquals(4000, properties.getAudit().getMaxErrorLength());
        });
    }

    @Test
    @DisplayName("Role, compute warehouse and audit length bind from kebab-case keys")
    void testBinding() {
        runner.withPropertyValues(
                        "ingestion.warehouse.role=LOADER",
                        "ingestion.warehouse.warehouse=INGEST_WH",
                        "ingestion.audit.max-error-length=512")
                .run(context -> {
                    IngestionProperties properties = context.getBean(IngestionProperties.class);
                    assertEquals("LOADER", properties.getWarehouse().getRole());
                    assertEquals("INGEST_WH", properties.getWarehouse().getWarehouse());
                    assertEquals(512, properties.getAudit().getMaxErrorLength());
                });
    }

    @Test
    @DisplayName("Invalid values fail at startup")
    void testValidation() {
        runner.withPropertyValues("ingestion.audit.max-error-length=0")
                .run(context -> assertNotNull(context.getStartupFailure()));
        runner.withPropertyValues("ingestion.warehouse.role= ")
                .run(context -> assertNotNull(context.getStartupFailure()));
        runner.withPropertyValues("ingestion.merge.versioning=SNAPSHOT")
                .run(context -> assertNotNull(context.getStartupFailure()));
    }
}
