package com.taskflow.core.model;

/**
 * Title and body for a change request, authored by the PR-creator agent.
 */
public record ChangeRequestDraft(String title, String body) {

    /**
     * A plain draft built from the task itself, used when no agent-authored draft is at hand.
     */
    public static ChangeRequestDraft forTask(TaskSnapshot task) {
        var body = new StringBuilder();
        body.append("Task: ").append(task.id()).append("\n\n");
        if (task.requirements() != null && !task.requirements().isBlank()) {
            body.append("## Requirements\n\n").append(task.requirements()).append("\n\n");
        }
        if (!task.steps().isEmpty()) {
            body.append("## Steps\n\n");
            for (var step : task.steps()) {
                body.append(step.state().isFinished() ? "- [x] " : "- [ ] ").append(step.description()).append('\n');
            }
        }
        return new ChangeRequestDraft(task.title() + " (" + task.id() + ")", body.toString());
    }
}
