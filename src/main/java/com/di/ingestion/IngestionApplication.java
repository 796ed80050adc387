package com.di.ingestion;

import com.di.ingestion.config.IngestionProperties;
import com.di.ingestion.load.IngestionOrchestrator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@ConfigurationPropertiesScan
public class IngestionApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext ctx = SpringApplication.run(IngestionApplication.class, args);
		IngestionProperties props = ctx.getBean(IngestionProperties.class);
		// Without run-on-startup, runs are triggered through the HTTP API only.
		if (props.isRunOnStartup()) {
			ctx.getBean(IngestionOrchestrator.class).runAll();
		}
	}
}
