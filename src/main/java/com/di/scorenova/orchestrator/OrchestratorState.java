package com.di.scorenova.orchestrator;

/**
 * <pre>
 * UNINITIALIZED → INITIALIZING → READY ⇄ RUNNING
 *                      │            │
 *                      └─(failure)──┴──▶ SHUTTING_DOWN → STOPPED
 * </pre>
 * A failed initialization returns to UNINITIALIZED.
 */
public enum OrchestratorState {
    UNINITIALIZED,
    INITIALIZING,
    READY,
    RUNNING,
    SHUTTING_DOWN,
    STOPPED
}
