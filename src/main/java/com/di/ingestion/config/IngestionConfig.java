package com.di.ingestion.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans for the ingestion engine.
 */
@Configuration
public class IngestionConfig {

    /** Wall clock for audit timestamps and schedule arithmetic; overridable in tests. */
    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock ingestionClock() {
        return Clock.systemUTC();
    }
}
