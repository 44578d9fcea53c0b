package com.taskflow.core.model;

/**
 * External system an {@link ExternalSyncRecord} was addressed to.
 */
public enum SyncTarget {
    VERSION_CONTROL,
    ISSUE_TRACKER
}
