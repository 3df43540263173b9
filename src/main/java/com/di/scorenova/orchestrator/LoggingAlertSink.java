package com.di.scorenova.orchestrator;

import com.di.scorenova.monitor.Alert;
import com.di.scorenova.monitor.AlertSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default alert sink installed by the orchestrator: logs each alert with the
 * follow-up an operator should take for its type.
 */
@Slf4j
@Component
public class LoggingAlertSink implements AlertSink {

    @Override
    public void onAlert(Alert alert) {
        switch (alert.getType()) {
            case SLA_VIOLATION -> log.warn(
                    "[ALERT-SINK] SLA violation on run {} ({}): check predictor latency, batch size and max concurrency",
                    alert.getTriggeringRunId(), alert.getMessage());
            case HIGH_ERROR_RATE -> log.error(
                    "[ALERT-SINK] {}: check predictor health, input data quality and lake availability",
                    alert.getMessage());
        }
    }
}
