package com.taskflow.core.model;

/**
 * Lifecycle status of a task.
 * <p>
 * The active statuses are ordered: a task only moves forward along the
 * declaration order, one gate at a time. {@link #BLOCKED} is reachable from any
 * active status and {@link #DONE} and {@link #ARCHIVED} are terminal.
 */
public enum TaskStatus {
    DRAFT,
    REQUIREMENTS_REVIEW,
    TEST_PLAN_REVIEW,
    TECHNICAL_REVIEW,
    SPLIT_EVALUATION,
    READY_FOR_IMPLEMENTATION,
    IN_PROGRESS,
    IN_REVIEW,
    DOCUMENTATION_UPDATE,
    READY_TO_MERGE,
    DONE,
    BLOCKED,
    ARCHIVED;

    public boolean isTerminal() {
        return this == DONE || this == ARCHIVED;
    }

    /** True for statuses on the forward path that still have work ahead. */
    public boolean isActive() {
        return ordinal() < DONE.ordinal();
    }

    /**
     * True when this status is at or past {@code other} on the forward path.
     * Side statuses never compare as reached.
     */
    public boolean hasReached(TaskStatus other) {
        if (this == BLOCKED || this == ARCHIVED || other == BLOCKED || other == ARCHIVED) {
            return false;
        }
        return ordinal() >= other.ordinal();
    }
}
