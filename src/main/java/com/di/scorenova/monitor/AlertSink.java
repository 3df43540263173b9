package com.di.scorenova.monitor;

/**
 * Receives alerts as they are raised. Called on the thread that recorded the run;
 * exceptions are logged and otherwise ignored.
 */
@FunctionalInterface
public interface AlertSink {

    void onAlert(Alert alert);
}
