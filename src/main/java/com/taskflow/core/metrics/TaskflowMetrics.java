package com.taskflow.core.metrics;

import com.taskflow.core.model.AgentName;
import com.taskflow.core.model.GateId;
import com.taskflow.core.model.SyncOperation;
import com.taskflow.core.model.SyncResult;
import com.taskflow.core.model.Verdict;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for gate progression, sub-agent dispatch and external sync.
 */
@Service
public class TaskflowMetrics {

    private final MeterRegistry registry;

    public TaskflowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordVerdict(GateId gate, Verdict verdict) {
        Counter.builder("taskflow.gate.verdicts")
                .tag("gate", gate.key())
                .tag("verdict", verdict.name())
                .register(registry)
                .increment();
    }

    public void recordRevisionDepth(GateId gate, int depth) {
        DistributionSummary.builder("taskflow.gate.revision.depth")
                .tag("gate", gate.key())
                .register(registry)
                .record(depth);
    }

    public void incrementStuckGates(GateId gate) {
        Counter.builder("taskflow.gate.stuck")
                .tag("gate", gate.key())
                .register(registry)
                .increment();
    }

    public void recordDispatch(AgentName agent, long ms) {
        Timer.builder("taskflow.dispatch.duration")
                .tag("agent", agent.name())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param kind the {@code DispatchError.Kind} name
     */
    public void recordDispatchError(AgentName agent, String kind) {
        Counter.builder("taskflow.dispatch.errors")
                .description("Sub-agent calls that ended in a dispatch error")
                .tag("agent", agent == null ? "none" : agent.name())
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    public void recordSync(SyncOperation operation, SyncResult result) {
        Counter.builder("taskflow.sync.calls")
                .description("External system calls by operation and outcome")
                .tag("operation", operation.name())
                .tag("result", result.name())
                .register(registry)
                .increment();
    }

    public void recordDriftFound(int count) {
        DistributionSummary.builder("taskflow.reconciliation.drift")
                .description("Drifted expectations found per reconciled task")
                .register(registry)
                .record(count);
    }
}
