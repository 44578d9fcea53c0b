package com.taskflow.core.dispatch;

import com.taskflow.core.model.TaskSnapshot;

/**
 * The bounded slice of task context handed to a worker.
 *
 * @param task      read-only projection of the task, never the stored aggregate
 * @param focusStep index of the step the call is about, nullable
 */
public record AgentContext(TaskSnapshot task, Integer focusStep) {

    public static AgentContext of(TaskSnapshot task) {
        return new AgentContext(task, null);
    }
}
