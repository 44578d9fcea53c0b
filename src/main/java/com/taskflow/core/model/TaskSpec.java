package com.taskflow.core.model;

import java.util.List;

/**
 * Everything needed to create a task. Also the shape of a child task proposed by the splitter.
 *
 * @param title        short name of the work
 * @param requirements business intent
 * @param testPlan     proposed test plan, may be empty
 * @param steps        initial technical steps
 * @param parentTaskId parent when created by a split, nullable
 */
public record TaskSpec(
    String title,
    String requirements,
    String testPlan,
    List<StepSpec> steps,
    String parentTaskId
) {
    public TaskSpec {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Task title must not be blank");
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public TaskSpec withParent(String parentId) {
        return new TaskSpec(title, requirements, testPlan, steps, parentId);
    }

    /**
     * A step as proposed before the task exists.
     */
    public record StepSpec(String description, String acceptanceCriteria) {}
}
