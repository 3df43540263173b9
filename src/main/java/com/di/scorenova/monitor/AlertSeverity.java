package com.di.scorenova.monitor;

public enum AlertSeverity {
    HIGH,
    CRITICAL
}
