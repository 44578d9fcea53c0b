package com.taskflow.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The ordered gates of the task lifecycle.
 * <p>
 * Each gate is entered while the task sits in its {@link #entryStatus()} and, once
 * approved, moves the task to its {@link #exitStatus()}. Gates without an
 * {@link #agent()} are satisfied by explicit operator confirmation.
 */
public enum GateId {
    REQUIREMENTS("requirements", TaskStatus.REQUIREMENTS_REVIEW, TaskStatus.TEST_PLAN_REVIEW, null),
    TEST_PLAN("test_plan", TaskStatus.TEST_PLAN_REVIEW, TaskStatus.TECHNICAL_REVIEW, null),
    TECHNICAL_REVIEW("technical_review", TaskStatus.TECHNICAL_REVIEW, TaskStatus.SPLIT_EVALUATION, AgentName.PLAN_REVIEWER),
    SPLIT_EVALUATION("split_evaluation", TaskStatus.SPLIT_EVALUATION, TaskStatus.READY_FOR_IMPLEMENTATION, AgentName.SPLITTER),
    IMPLEMENTATION_START("implementation_start", TaskStatus.READY_FOR_IMPLEMENTATION, TaskStatus.IN_PROGRESS, null),
    CHANGE_REQUEST("change_request", TaskStatus.IN_PROGRESS, TaskStatus.IN_REVIEW, AgentName.PR_CREATOR),
    CODE_REVIEW("code_review", TaskStatus.IN_REVIEW, TaskStatus.DOCUMENTATION_UPDATE, AgentName.VALIDATOR),
    DOCUMENTATION("documentation", TaskStatus.DOCUMENTATION_UPDATE, TaskStatus.READY_TO_MERGE, AgentName.DOC_UPDATER),
    MERGE("merge", TaskStatus.READY_TO_MERGE, TaskStatus.DONE, null);

    private final String key;
    private final TaskStatus entryStatus;
    private final TaskStatus exitStatus;
    private final AgentName agent;

    GateId(String key, TaskStatus entryStatus, TaskStatus exitStatus, AgentName agent) {
        this.key = key;
        this.entryStatus = entryStatus;
        this.exitStatus = exitStatus;
        this.agent = agent;
    }

    public String key() { return key; }
    public TaskStatus entryStatus() { return entryStatus; }
    public TaskStatus exitStatus() { return exitStatus; }
    public AgentName agent() { return agent; }

    public boolean isHumanGate() {
        return agent == null;
    }

    /** The gate immediately before this one in canonical order, if any. */
    public Optional<GateId> predecessor() {
        return ordinal() == 0 ? Optional.empty() : Optional.of(values()[ordinal() - 1]);
    }

    /** The gate that is entered from the given status, if any. */
    public static Optional<GateId> enteredFrom(TaskStatus status) {
        return Arrays.stream(values()).filter(g -> g.entryStatus == status).findFirst();
    }

    /** Resolves a gate from its key ({@code technical_review}) or enum name ({@code TECHNICAL_REVIEW}). */
    public static GateId fromKey(String value) {
        for (GateId gate : values()) {
            if (gate.key.equalsIgnoreCase(value) || gate.name().equalsIgnoreCase(value)) {
                return gate;
            }
        }
        throw new IllegalArgumentException("Unknown gate: " + value);
    }
}
