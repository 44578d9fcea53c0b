package com.taskflow.core.model;

/**
 * Result of an external call. {@code UNKNOWN} means the call timed out and its effect
 * on the remote side could not be determined.
 */
public enum SyncResult {
    SUCCESS,
    FAILED,
    UNKNOWN
}
