package com.taskflow.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/tasks.
 *
 * @param title        short name of the work
 * @param requirements business intent
 * @param testPlan     proposed test plan; nullable
 * @param steps        initial technical steps; nullable
 * @param draft        keep the task in DRAFT instead of submitting it; nullable, defaults to false
 */
public record CreateTaskRequest(
    String title,
    String requirements,
    @JsonProperty("test_plan") String testPlan,
    List<StepRequest> steps,
    Boolean draft
) {
    public record StepRequest(
        String description,
        @JsonProperty("acceptance_criteria") String acceptanceCriteria
    ) {}
}
