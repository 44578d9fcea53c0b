package com.taskflow.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Continuation block written when control of a task passes between drivers.
 */
public record HandoverNote(
    String preparedBy,
    Instant preparedAt,
    String summary,
    List<String> nextSteps,
    List<String> openQuestions
) {
    public HandoverNote {
        nextSteps = nextSteps == null ? List.of() : List.copyOf(nextSteps);
        openQuestions = openQuestions == null ? List.of() : List.copyOf(openQuestions);
    }
}
