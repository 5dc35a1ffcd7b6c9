package com.z254.conductor.domain.model;

/**
 * Lifecycle of an execution context.
 */
public enum WorkflowState {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
