package com.taskflow.core.gate;

import com.taskflow.core.TaskflowException;
import com.taskflow.core.model.GateId;

/**
 * A gate operation was attempted in a state that does not allow it. Fatal to the call,
 * never to the task: nothing has been written when this is thrown.
 */
public class OutOfOrderGateException extends TaskflowException {

    private final String taskId;
    private final GateId gate;

    public OutOfOrderGateException(String taskId, GateId gate, String reason) {
        super("Gate %s cannot be used on task %s: %s".formatted(gate == null ? "-" : gate.key(), taskId, reason));
        this.taskId = taskId;
        this.gate = gate;
    }

    public String getTaskId() { return taskId; }
    public GateId getGate() { return gate; }
}
