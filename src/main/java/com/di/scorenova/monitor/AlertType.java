package com.di.scorenova.monitor;

public enum AlertType {
    SLA_VIOLATION,
    HIGH_ERROR_RATE
}
