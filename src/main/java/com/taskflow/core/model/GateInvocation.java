package com.taskflow.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * One attempt to satisfy a gate.
 * <p>
 * Created open (no verdict) when the gate is entered. Once a verdict is recorded or the
 * invocation is abandoned it never changes again; a retry produces a new invocation.
 *
 * @param id             unique invocation id
 * @param taskId         owning task
 * @param gateId         the gate being satisfied
 * @param invokedAgent   agent the gate delegated to, null for operator gates
 * @param confirmedBy    operator identity for confirmation gates, nullable
 * @param inputSnapshot  task content at the time the gate was entered
 * @param verdict        null while open
 * @param note           review notes or the reason for the verdict
 * @param systemAuthored true when the verdict was produced by the system (e.g. dispatch failure)
 * @param openedAt       when the gate was entered
 * @param decidedAt      when the verdict was recorded, nullable
 * @param abandoned      true when the task was cancelled while this invocation was open
 */
public record GateInvocation(
    String id,
    String taskId,
    GateId gateId,
    AgentName invokedAgent,
    String confirmedBy,
    TaskSnapshot inputSnapshot,
    Verdict verdict,
    String note,
    boolean systemAuthored,
    Instant openedAt,
    Instant decidedAt,
    boolean abandoned
) {

    public static GateInvocation open(Task task, GateId gate, Instant now) {
        return new GateInvocation(UUID.randomUUID().toString(), task.id(), gate, gate.agent(),
                null, TaskSnapshot.of(task), null, null, false, now, null, false);
    }

    public boolean awaitingVerdict() {
        return verdict == null && !abandoned;
    }

    public GateInvocation decide(Verdict decided, String decisionNote, String confirmer,
                                 boolean bySystem, Instant now) {
        if (!awaitingVerdict()) {
            throw new IllegalStateException("Invocation " + id + " is already closed");
        }
        return new GateInvocation(id, taskId, gateId, invokedAgent, confirmer, inputSnapshot,
                decided, decisionNote, bySystem, openedAt, now, false);
    }

    public GateInvocation abandon(String reason, Instant now) {
        if (!awaitingVerdict()) {
            throw new IllegalStateException("Invocation " + id + " is already closed");
        }
        return new GateInvocation(id, taskId, gateId, invokedAgent, confirmedBy, inputSnapshot,
                null, reason, true, openedAt, now, true);
    }
}
