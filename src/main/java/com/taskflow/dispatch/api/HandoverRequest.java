package com.taskflow.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record HandoverRequest(
    String summary,
    @JsonProperty("next_steps") List<String> nextSteps,
    @JsonProperty("open_questions") List<String> openQuestions,
    @JsonProperty("as") String identity
) {}
