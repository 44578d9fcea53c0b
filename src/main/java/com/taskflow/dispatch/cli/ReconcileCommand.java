package com.taskflow.dispatch.cli;

import com.taskflow.core.engine.LifecycleService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;

/**
 * CLI command: taskflow reconcile [task-id] [--repair]
 * <p>
 * Compares each task's status with the sync log and reports external calls that never
 * succeeded. With {@code --repair} the missing calls are re-issued.
 */
@Command(name = "reconcile", mixinStandardHelpOptions = true,
        description = "Detect (and optionally repair) drift between tasks and external systems")
@Component
public class ReconcileCommand implements Runnable {

    @Parameters(index = "0", arity = "0..1", description = "Task ID (default: all active tasks)")
    private String taskId;

    @Option(names = {"--repair"}, description = "Re-issue the missing external calls")
    private boolean repair;

    private final LifecycleService lifecycle;

    public ReconcileCommand(LifecycleService lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var reports = taskId == null
                ? lifecycle.reconcileAll(repair)
                : List.of(lifecycle.reconcile(taskId, repair));
        if (reports.isEmpty()) {
            ConsoleOutput.info("No tasks to reconcile");
            return;
        }
        reports.forEach(ConsoleOutput::reconciliation);
        long drifted = reports.stream().filter(r -> !r.inSync()).count();
        System.out.println(ConsoleOutput.RULE);
        if (drifted == 0) {
            ConsoleOutput.success("All " + reports.size() + " task(s) in sync");
        } else {
            ConsoleOutput.warn(drifted + " of " + reports.size() + " task(s) drifted"
                    + (repair ? "" : "; re-run with --repair"));
        }
    }
}
