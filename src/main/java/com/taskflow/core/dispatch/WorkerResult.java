package com.taskflow.core.dispatch;

import com.taskflow.core.model.Verdict;

/**
 * What a worker returns: a verdict, a free-form note and the agent-specific artifacts.
 */
public record WorkerResult(Verdict verdict, String note, Artifacts artifacts) {

    public WorkerResult {
        artifacts = artifacts == null ? Artifacts.none() : artifacts;
    }

    public static WorkerResult of(Verdict verdict, String note) {
        return new WorkerResult(verdict, note, Artifacts.none());
    }
}
