package com.di.scorenova.monitor;

public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY
}
