package com.taskflow.core.sync;

import com.taskflow.core.TaskflowException;

/**
 * An adapter call to the version control system or issue tracker failed.
 * <p>
 * {@link #isOutcomeUnknown()} is true when the call timed out and the remote may or may
 * not have applied it. Only {@link ExternalSyncService} catches these.
 */
public class ExternalSyncException extends TaskflowException {

    private final boolean outcomeUnknown;

    public ExternalSyncException(String message) {
        this(message, null, false);
    }

    public ExternalSyncException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public ExternalSyncException(String message, Throwable cause, boolean outcomeUnknown) {
        super(message, cause);
        this.outcomeUnknown = outcomeUnknown;
    }

    public boolean isOutcomeUnknown() {
        return outcomeUnknown;
    }
}
