package com.taskflow.core.dispatch.workers;

import com.taskflow.core.model.Step;
import com.taskflow.core.model.TaskSnapshot;

/**
 * Renders a task snapshot as the markdown brief sub-agents read.
 * Pure function, no Spring dependencies.
 */
public final class TaskBrief {

    private static final int MAX_CHANGELOG_ENTRIES = 15;

    private TaskBrief() {}

    public static String render(TaskSnapshot task) {
        var sb = new StringBuilder();
        sb.append("# Task ").append(task.id()).append(": ").append(task.title()).append("\n\n");
        sb.append("- **Status:** ").append(task.status()).append("\n");
        if (task.branchRef() != null) {
            sb.append("- **Branch:** ").append(task.branchRef()).append("\n");
        }
        if (task.changeRequestRef() != null) {
            sb.append("- **Change request:** #").append(task.changeRequestRef()).append("\n");
        }
        sb.append("\n## Requirements\n\n").append(orNone(task.requirements())).append("\n\n");
        sb.append("## Test Plan\n\n").append(orNone(task.testPlan())).append("\n\n");

        sb.append("## Technical Steps\n\n");
        if (task.steps().isEmpty()) {
            sb.append("(none)\n");
        }
        for (int i = 0; i < task.steps().size(); i++) {
            appendStep(sb, i, task.steps().get(i));
        }

        if (!task.changelog().isEmpty()) {
            sb.append("\n## Recent Changelog\n\n");
            var entries = task.changelog();
            for (var entry : entries.subList(Math.max(0, entries.size() - MAX_CHANGELOG_ENTRIES), entries.size())) {
                sb.append("- [").append(entry.component()).append("] ").append(entry.summary());
                if (entry.effect() != null && !entry.effect().isBlank()) {
                    sb.append(" -> ").append(entry.effect());
                }
                sb.append("\n");
            }
        }

        if (task.handover() != null) {
            sb.append("\n## Handover\n\n").append(task.handover().summary()).append("\n");
            task.handover().nextSteps().forEach(s -> sb.append("- next: ").append(s).append("\n"));
            task.handover().openQuestions().forEach(q -> sb.append("- open question: ").append(q).append("\n"));
        }
        return sb.toString();
    }

    private static void appendStep(StringBuilder sb, int index, Step step) {
        sb.append(index).append(". [").append(step.state()).append("] ").append(step.description()).append("\n");
        if (step.acceptanceCriteria() != null && !step.acceptanceCriteria().isBlank()) {
            sb.append("   - acceptance: ").append(step.acceptanceCriteria()).append("\n");
        }
        if (step.evidence() != null) {
            sb.append("   - evidence: ").append(step.evidence()).append("\n");
        }
        if (step.delegated()) {
            sb.append("   - delegated to ").append(step.splitReference().childTaskId()).append("\n");
        }
    }

    private static String orNone(String text) {
        return text == null || text.isBlank() ? "(none)" : text;
    }
}
