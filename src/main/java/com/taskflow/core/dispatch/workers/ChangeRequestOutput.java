package com.taskflow.core.dispatch.workers;

import java.util.List;

/**
 * Structured answer of the PR creator.
 */
public record ChangeRequestOutput(
    boolean ready,
    String title,
    String body,
    List<String> blockers
) {}
