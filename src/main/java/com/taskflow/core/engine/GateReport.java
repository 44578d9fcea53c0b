package com.taskflow.core.engine;

import com.taskflow.core.model.GateId;

/**
 * What a command did at one gate.
 */
public record GateReport(GateId gate, Result result, String note) {

    public enum Result {
        ALREADY_PASSED,
        APPROVED,
        NEEDS_REVISION,
        REJECTED,
        AWAITING_CONFIRMATION
    }
}
