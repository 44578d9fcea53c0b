package com.taskflow.dispatch.cli;

import com.taskflow.core.engine.LifecycleService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

/**
 * CLI command: taskflow start-review &lt;task-id&gt;
 * <p>
 * Runs the change request gate (opens the pull request) and then code review.
 */
@Command(name = "start-review", mixinStandardHelpOptions = true, description = "Open the change request and run code review")
@Component
public class StartReviewCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Mixin
    private OperatorOptions operator;

    private final LifecycleService lifecycle;

    public StartReviewCommand(LifecycleService lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.report(lifecycle.startReview(taskId, operator.identity()));
    }
}
