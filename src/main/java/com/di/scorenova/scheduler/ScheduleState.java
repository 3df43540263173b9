package com.di.scorenova.scheduler;

public enum ScheduleState {
    DISABLED,
    IDLE,
    TRIGGERED
}
