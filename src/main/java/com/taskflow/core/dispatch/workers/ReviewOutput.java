package com.taskflow.core.dispatch.workers;

import com.taskflow.core.model.Verdict;

import java.util.List;

/**
 * Structured answer of a reviewing agent.
 */
public record ReviewOutput(
    Verdict verdict,
    String summary,
    List<String> issues
) {}
