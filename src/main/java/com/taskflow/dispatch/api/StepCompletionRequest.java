package com.taskflow.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/tasks/{id}/continue-implementation.
 *
 * @param step     zero-based index of the finished step; nullable to only query the next step
 * @param evidence proof of completion; nullable
 * @param identity operator identity; nullable
 */
public record StepCompletionRequest(
    Integer step,
    String evidence,
    @JsonProperty("as") String identity
) {}
