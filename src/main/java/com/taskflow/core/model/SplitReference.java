package com.taskflow.core.model;

import java.util.List;

/**
 * Marks a parent step whose work was delegated to a child task during split evaluation.
 *
 * @param childTaskId     the child task that now owns the work
 * @param childTitle      title of the child task
 * @param supersededSteps descriptions of the parent steps this child replaced
 */
public record SplitReference(
    String childTaskId,
    String childTitle,
    List<String> supersededSteps
) {
    public SplitReference {
        supersededSteps = supersededSteps == null ? List.of() : List.copyOf(supersededSteps);
    }
}
