package com.taskflow.core.model;

import java.util.List;

/**
 * Read-only projection of a task handed to sub-agents and kept as the input of a
 * gate invocation. It carries no version token, so it can never be saved back.
 */
public record TaskSnapshot(
    String id,
    String title,
    String requirements,
    String testPlan,
    TaskStatus status,
    List<GateId> gatesPassed,
    List<Step> steps,
    List<ChangelogEntry> changelog,
    String branchRef,
    String issueRef,
    String changeRequestRef,
    HandoverNote handover
) {

    public TaskSnapshot {
        gatesPassed = gatesPassed == null ? List.of() : List.copyOf(gatesPassed);
        steps = steps == null ? List.of() : List.copyOf(steps);
        changelog = changelog == null ? List.of() : List.copyOf(changelog);
    }

    public static TaskSnapshot of(Task task) {
        return new TaskSnapshot(task.id(), task.title(), task.requirements(), task.testPlan(),
                task.status(), task.gatesPassed(), task.steps(), task.changelog(),
                task.branchRef(), task.issueRef(), task.changeRequestRef(), task.handover());
    }
}
