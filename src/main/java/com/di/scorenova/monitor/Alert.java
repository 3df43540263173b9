package com.di.scorenova.monitor;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class Alert {

    String id;
    AlertType type;
    AlertSeverity severity;
    String message;

    /** Run that tripped the alert; null for window-based alerts. */
    String triggeringRunId;

    Instant timestamp;

    /** Duration in ms for SLA alerts, error rate for error-rate alerts. */
    double observedValue;

    double threshold;
}
