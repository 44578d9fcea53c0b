package com.taskflow.core.gate;

import com.taskflow.core.TaskflowException;
import com.taskflow.core.model.GateId;

/**
 * A gate exceeded its revision limit. Automatic progress on the task stops until an
 * operator calls {@link GateController#overrideStuckGate}.
 */
public class StuckGateException extends TaskflowException {

    private final String taskId;
    private final GateId gate;
    private final int revisions;

    public StuckGateException(String taskId, GateId gate, int revisions) {
        super("Gate %s of task %s is stuck after %d revision request(s); manual override required"
                .formatted(gate.key(), taskId, revisions));
        this.taskId = taskId;
        this.gate = gate;
        this.revisions = revisions;
    }

    public String getTaskId() { return taskId; }
    public GateId getGate() { return gate; }
    public int getRevisions() { return revisions; }
}
