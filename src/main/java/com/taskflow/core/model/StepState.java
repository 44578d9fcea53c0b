package com.taskflow.core.model;

/**
 * Completion state of a single technical step.
 */
public enum StepState {
    PENDING,
    IN_PROGRESS,
    DONE,
    SKIPPED;

    public boolean isFinished() {
        return this == DONE || this == SKIPPED;
    }
}
