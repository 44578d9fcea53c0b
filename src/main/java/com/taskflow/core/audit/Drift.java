package com.taskflow.core.audit;

import com.taskflow.core.model.SyncOperation;
import com.taskflow.core.model.SyncResult;

/**
 * An external state implied by the task's status with no successful sync record behind it.
 *
 * @param taskId      the drifted task
 * @param operation   the sync call that would repair it
 * @param expectation human-readable description of the expected external state
 * @param lastResult  outcome of the most recent attempt, null when never attempted
 * @param lastDetail  detail of the most recent attempt, nullable
 */
public record Drift(
    String taskId,
    SyncOperation operation,
    String expectation,
    SyncResult lastResult,
    String lastDetail
) {

    public boolean neverAttempted() {
        return lastResult == null;
    }
}
