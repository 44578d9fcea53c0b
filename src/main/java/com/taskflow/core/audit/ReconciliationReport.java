package com.taskflow.core.audit;

import com.taskflow.core.model.TaskStatus;

import java.util.List;

/**
 * Outcome of reconciling one task.
 *
 * @param taskId    the task
 * @param status    its internal status at the time
 * @param detected  drift found before any repair
 * @param remaining drift still present afterwards (equal to {@code detected} when not repairing)
 */
public record ReconciliationReport(
    String taskId,
    TaskStatus status,
    List<Drift> detected,
    List<Drift> remaining
) {
    public ReconciliationReport {
        detected = List.copyOf(detected);
        remaining = List.copyOf(remaining);
    }

    public boolean inSync() {
        return remaining.isEmpty();
    }
}
