package com.taskflow.core.model;

/**
 * Outcome of a gate invocation, produced either by a sub-agent or by an operator.
 */
public enum Verdict {
    APPROVED,
    NEEDS_REVISION,
    REJECTED
}
