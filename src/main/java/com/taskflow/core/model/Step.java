package com.taskflow.core.model;

/**
 * One technical step of a task.
 *
 * @param description        what the step does
 * @param acceptanceCriteria how completion is judged
 * @param state              current completion state
 * @param evidence           proof of completion (commit, test output, link), nullable
 * @param splitReference     set when the step was delegated to a child task, nullable
 */
public record Step(
    String description,
    String acceptanceCriteria,
    StepState state,
    String evidence,
    SplitReference splitReference
) {

    public static Step pending(String description, String acceptanceCriteria) {
        return new Step(description, acceptanceCriteria, StepState.PENDING, null, null);
    }

    public Step withCompletion(StepState newState, String newEvidence) {
        return new Step(description, acceptanceCriteria, newState, newEvidence, splitReference);
    }

    public boolean delegated() {
        return splitReference != null;
    }
}
