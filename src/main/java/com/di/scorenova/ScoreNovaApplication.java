package com.di.scorenova;

import com.di.scorenova.orchestrator.BatchOrchestrator;
import com.di.scorenova.orchestrator.OrchestratorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.ConfigurableApplicationContext;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ScoreNovaApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext ctx = SpringApplication.run(ScoreNovaApplication.class, args);
		OrchestratorProperties orchestratorProps = ctx.getBean(OrchestratorProperties.class);
		// With auto-initialize off, POST /api/scoring/initialize brings the orchestrator up; batches get 503 until then.
		if (orchestratorProps.isAutoInitialize()) {
			ctx.getBean(BatchOrchestrator.class).initialize();
		}
	}
}
