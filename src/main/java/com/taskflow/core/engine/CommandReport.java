package com.taskflow.core.engine;

import com.taskflow.core.model.Task;

import java.util.List;

/**
 * Result of a lifecycle command: the task as stored afterwards and what happened at each
 * gate the command touched.
 */
public record CommandReport(String command, Task task, List<GateReport> gates, List<String> messages) {

    public CommandReport {
        gates = List.copyOf(gates);
        messages = List.copyOf(messages);
    }

    public boolean completed() {
        return gates.stream().allMatch(g -> g.result() == GateReport.Result.APPROVED
                || g.result() == GateReport.Result.ALREADY_PASSED);
    }
}
