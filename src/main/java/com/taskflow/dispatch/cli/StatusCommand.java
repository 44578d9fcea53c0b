package com.taskflow.dispatch.cli;

import com.taskflow.core.engine.LifecycleService;
import com.taskflow.core.model.GateId;
import com.taskflow.core.model.Task;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: taskflow status &lt;task-id&gt;
 * <p>
 * Shows the task's status, gate progress, steps, external references and the tail of its
 * changelog.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show task status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = {"--changelog", "-c"}, description = "Changelog entries to show (default: ${DEFAULT-VALUE})",
            defaultValue = "10")
    private int changelogEntries;

    private final LifecycleService lifecycle;

    public StatusCommand(LifecycleService lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        Task task = lifecycle.status(taskId);

        System.out.println();
        System.out.println("TASK " + task.id() + "  " + task.title());
        if (task.parentTaskId() != null) {
            System.out.println("Parent: " + task.parentTaskId());
        }
        ConsoleOutput.status(task.status());
        if (task.blockedFrom() != null) {
            ConsoleOutput.warn("Blocked while " + task.blockedFrom());
        }
        if (task.stuckGate() != null) {
            ConsoleOutput.error("Stuck at " + task.stuckGate().key() + " after "
                    + task.revisionCount(task.stuckGate()) + " revisions");
        }

        // Gate progress
        System.out.println();
        for (GateId gate : GateId.values()) {
            String mark = task.hasPassed(gate) ? "x" : " ";
            int revisions = task.revisionCount(gate);
            System.out.printf("  [%s] %-22s %s%n", mark, gate.key(),
                    revisions > 0 ? revisions + " revision(s)" : "");
        }
        task.openInvocation().ifPresent(inv ->
                ConsoleOutput.info("Open gate: " + inv.gateId().key() + " since " + inv.openedAt()));

        // Steps
        if (!task.steps().isEmpty()) {
            System.out.println();
            System.out.printf("  %-4s %-8s %s%n", "#", "STATE", "DESCRIPTION");
            System.out.println("  " + "-".repeat(64));
            for (int i = 0; i < task.steps().size(); i++) {
                var step = task.steps().get(i);
                String suffix = step.delegated() ? " -> " + step.splitReference().childTaskId() : "";
                System.out.printf("  %-4d %-8s %s%s%n", i + 1, step.state(),
                        ConsoleOutput.truncate(step.description(), 50), suffix);
            }
        }

        // External references
        System.out.println();
        System.out.println("  Issue:          " + orDash(task.issueRef()));
        System.out.println("  Branch:         " + orDash(task.branchRef()));
        System.out.println("  Change request: " + orDash(task.changeRequestRef()));

        if (task.handover() != null) {
            System.out.println();
            ConsoleOutput.info("Handover by " + task.handover().preparedBy() + ": " + task.handover().summary());
            task.handover().nextSteps().forEach(s -> System.out.println("    next: " + s));
            task.handover().openQuestions().forEach(q -> System.out.println("    open: " + q));
        }

        var changelog = task.changelog();
        if (!changelog.isEmpty() && changelogEntries > 0) {
            System.out.println();
            System.out.println(ConsoleOutput.RULE);
            for (var entry : changelog.subList(Math.max(0, changelog.size() - changelogEntries), changelog.size())) {
                System.out.printf("  %s  %-18s %s (%s)%n", entry.timestamp(), entry.component(),
                        entry.summary(), entry.author());
            }
        }
    }

    private static String orDash(String value) {
        return value == null ? "-" : value;
    }
}
