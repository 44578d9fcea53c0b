package com.taskflow.core.dispatch;

import com.taskflow.core.model.TaskSpec;

import java.util.List;

/**
 * A child task proposed by the splitter.
 *
 * @param spec               content of the child task
 * @param supersededSteps    indexes of the parent's steps whose work moves to this child
 */
public record ChildTaskSpec(TaskSpec spec, List<Integer> supersededSteps) {

    public ChildTaskSpec {
        supersededSteps = supersededSteps == null ? List.of() : List.copyOf(supersededSteps);
    }
}
