package com.taskflow.core.dispatch;

/**
 * A failed sub-agent call, returned as a value. The gate controller treats it as a
 * system-authored NEEDS_REVISION.
 */
public record DispatchError(Kind kind, String message) {

    public enum Kind {
        /** The worker did not answer within the dispatch timeout. */
        TIMEOUT,
        /** The worker could not reach its backend (network, model endpoint). */
        TRANSPORT,
        /** The worker itself failed or produced an unusable answer. */
        AGENT_FAILURE,
        /** No worker is registered for the agent name. */
        UNKNOWN_AGENT
    }

    public String describe() {
        return kind + ": " + message;
    }
}
