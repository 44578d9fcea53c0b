package com.taskflow.core.dispatch.workers;

import com.taskflow.core.model.TaskSpec;

import java.util.List;

/**
 * Structured answer of the splitter.
 *
 * @param split     true when the task should be divided
 * @param rationale why (or why not)
 * @param children  proposed child tasks, empty when not splitting
 */
public record SplitOutput(
    boolean split,
    String rationale,
    List<ChildProposal> children
) {

    /**
     * @param supersedesSteps zero-based indexes of the parent steps moved into this child
     */
    public record ChildProposal(
        String title,
        String requirements,
        String testPlan,
        List<TaskSpec.StepSpec> steps,
        List<Integer> supersedesSteps
    ) {}
}
