package com.di.scorenova.orchestrator;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * <pre>
 * scorenova:
 *   orchestrator:
 *     auto-initialize: true
 *     enable-scheduling: true
 *     enable-storage: true
 *     enable-monitoring: true
 *     schedule-frequency: daily
 *     model-version: "1.0"
 * </pre>
 * Schedule time and timezone come from {@code scorenova.scheduler}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "scorenova.orchestrator")
public class OrchestratorProperties {

    /** Initialize on application start. */
    private boolean autoInitialize = true;

    private boolean enableScheduling = true;

    private boolean enableStorage = true;

    private boolean enableMonitoring = true;

    private String scheduleFrequency = "daily";

    /** Stamped on every stored prediction. */
    private String modelVersion = "1.0";
}
