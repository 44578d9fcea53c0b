package com.taskflow.core.persistence;

import com.taskflow.core.TaskflowException;

/**
 * Thrown by {@link TaskStore#save} when the stored version no longer matches the
 * version the caller loaded. The caller must reload and retry.
 */
public class ConcurrentTaskModificationException extends TaskflowException {

    private final String taskId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrentTaskModificationException(String taskId, long expectedVersion, long actualVersion) {
        super("Task %s was modified concurrently (loaded version %d, stored version %d)"
                .formatted(taskId, expectedVersion, actualVersion));
        this.taskId = taskId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getTaskId() { return taskId; }
    public long getExpectedVersion() { return expectedVersion; }
    public long getActualVersion() { return actualVersion; }
}
