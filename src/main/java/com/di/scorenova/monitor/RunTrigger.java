package com.di.scorenova.monitor;

/** What started a run. */
public enum RunTrigger {
    MANUAL,
    SCHEDULED
}
