package com.taskflow.core.model;

import java.time.Instant;

/**
 * One attempted call to the version control system or the issue tracker.
 *
 * @param id                 unique record id
 * @param taskId             task the call was made for
 * @param targetSystem       which external system was called
 * @param operation          which adapter operation
 * @param requestPayloadHash SHA-256 of the canonical request payload; equal payloads mean equal intent
 * @param result             outcome of the call
 * @param detail             returned reference on success, error message otherwise
 * @param timestamp          when the call completed
 */
public record ExternalSyncRecord(
    String id,
    String taskId,
    SyncTarget targetSystem,
    SyncOperation operation,
    String requestPayloadHash,
    SyncResult result,
    String detail,
    Instant timestamp
) {

    public boolean succeeded() {
        return result == SyncResult.SUCCESS;
    }
}
