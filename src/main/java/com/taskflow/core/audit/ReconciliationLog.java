package com.taskflow.core.audit;

import com.taskflow.core.model.ExternalSyncRecord;

import java.util.List;

/**
 * Append-only record of every external-system call attempted for any task.
 * Records are never updated or removed; a retry appends a new record.
 */
public interface ReconciliationLog {

    void append(ExternalSyncRecord record);

    /** Records for one task, oldest first. */
    List<ExternalSyncRecord> recordsFor(String taskId);

    /** All records, oldest first. */
    List<ExternalSyncRecord> all();
}
