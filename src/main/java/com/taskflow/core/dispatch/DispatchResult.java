package com.taskflow.core.dispatch;

import com.taskflow.core.model.AgentName;
import com.taskflow.core.model.Verdict;

import java.util.List;

/**
 * Outcome of {@link SubAgentDispatcher#dispatch}. Exactly one of {@code verdict} and
 * {@code error} is set.
 *
 * @param agent        the agent that was called
 * @param verdict      the agent's verdict, null on error
 * @param note         the agent's note, null on error
 * @param artifacts    agent-specific output
 * @param createdTasks ids of child tasks created while applying a split
 * @param error        the failure, null on success
 * @param durationMs   wall time of the call
 */
public record DispatchResult(
    AgentName agent,
    Verdict verdict,
    String note,
    Artifacts artifacts,
    List<String> createdTasks,
    DispatchError error,
    long durationMs
) {

    public DispatchResult {
        artifacts = artifacts == null ? Artifacts.none() : artifacts;
        createdTasks = createdTasks == null ? List.of() : List.copyOf(createdTasks);
    }

    public static DispatchResult success(AgentName agent, WorkerResult result, long durationMs) {
        return new DispatchResult(agent, result.verdict(), result.note(), result.artifacts(), List.of(), null, durationMs);
    }

    public static DispatchResult failure(AgentName agent, DispatchError.Kind kind, String message, long durationMs) {
        return new DispatchResult(agent, null, null, Artifacts.none(), List.of(), new DispatchError(kind, message), durationMs);
    }

    public DispatchResult withCreatedTasks(List<String> taskIds) {
        return new DispatchResult(agent, verdict, note, artifacts, taskIds, error, durationMs);
    }

    public boolean failed() {
        return error != null;
    }
}
