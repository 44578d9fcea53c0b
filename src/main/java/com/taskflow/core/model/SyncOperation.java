package com.taskflow.core.model;

/**
 * Adapter operations mirrored into the reconciliation log.
 */
public enum SyncOperation {
    ENSURE_BRANCH(SyncTarget.VERSION_CONTROL),
    ENSURE_ISSUE(SyncTarget.ISSUE_TRACKER),
    SYNC_STATUS(SyncTarget.ISSUE_TRACKER),
    OPEN_CHANGE_REQUEST(SyncTarget.VERSION_CONTROL),
    MERGE_CHANGE_REQUEST(SyncTarget.VERSION_CONTROL),
    COMMENT(SyncTarget.ISSUE_TRACKER);

    private final SyncTarget target;

    SyncOperation(SyncTarget target) {
        this.target = target;
    }

    public SyncTarget target() {
        return target;
    }
}
