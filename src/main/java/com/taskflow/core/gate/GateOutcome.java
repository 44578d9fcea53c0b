package com.taskflow.core.gate;

import com.taskflow.core.dispatch.DispatchResult;
import com.taskflow.core.model.GateId;
import com.taskflow.core.model.GateInvocation;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.Verdict;

/**
 * Result of a gate operation.
 *
 * @param task       the task as stored after the operation
 * @param gate       the gate operated on
 * @param invocation the invocation created or decided
 * @param dispatch   the sub-agent call behind the verdict, null for operator gates
 */
public record GateOutcome(
    Task task,
    GateId gate,
    GateInvocation invocation,
    DispatchResult dispatch
) {

    public Verdict verdict() {
        return invocation.verdict();
    }

    public boolean advanced() {
        return invocation.verdict() == Verdict.APPROVED;
    }

    public boolean awaitingConfirmation() {
        return invocation.awaitingVerdict();
    }
}
