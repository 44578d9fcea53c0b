package com.taskflow.core.engine;

import com.taskflow.core.model.GateId;
import com.taskflow.core.model.TaskSnapshot;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Asks the operator to sign off an operator gate. Implementations may block for as long as
 * the operator takes; nothing is held while waiting apart from the loaded task version.
 */
@FunctionalInterface
public interface OperatorPrompt {

    OperatorDecision confirm(TaskSnapshot task, GateId gate);

    /** A prompt that gives the same answer at every operator gate. */
    static OperatorPrompt answering(OperatorDecision decision) {
        return (task, gate) -> decision;
    }

    /**
     * A single answer given up front, e.g. by an API caller. It is used at the first operator
     * gate asked about, and only if that gate is {@code target} when one is named. Every
     * other gate is deferred, so one answer never signs off two gates.
     */
    static OperatorPrompt answeringOnce(OperatorDecision decision, GateId target) {
        var used = new AtomicBoolean();
        return (task, gate) -> {
            if (target != null && gate != target) {
                return OperatorDecision.defer();
            }
            return used.compareAndSet(false, true) ? decision : OperatorDecision.defer();
        };
    }
}
