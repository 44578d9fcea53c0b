package com.taskflow.core.dispatch;

import com.taskflow.core.model.AgentName;

/**
 * A specialized sub-agent. Every variant answers with the same {@link WorkerResult} shape,
 * so the gate controller never needs agent-specific control flow.
 * <p>
 * Implementations may throw; the dispatcher converts any failure into a {@link DispatchError}.
 */
public interface Worker {

    AgentName name();

    WorkerResult evaluate(AgentContext context);
}
