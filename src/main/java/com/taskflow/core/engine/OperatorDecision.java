package com.taskflow.core.engine;

/**
 * An operator's answer at a confirmation gate.
 */
public record OperatorDecision(Kind kind, String note) {

    public enum Kind {
        APPROVE,
        /** Send the gate back for rework; counts toward the revision limit. */
        REVISE,
        /** No answer yet; the gate stays open awaiting confirmation. */
        DEFER
    }

    public static OperatorDecision approve() {
        return new OperatorDecision(Kind.APPROVE, null);
    }

    public static OperatorDecision revise(String note) {
        return new OperatorDecision(Kind.REVISE, note);
    }

    public static OperatorDecision defer() {
        return new OperatorDecision(Kind.DEFER, null);
    }
}
