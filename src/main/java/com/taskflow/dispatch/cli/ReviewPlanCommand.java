package com.taskflow.dispatch.cli;

import com.taskflow.core.engine.LifecycleService;
import com.taskflow.core.engine.OperatorPrompt;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

/**
 * CLI command: taskflow review-plan &lt;task-id&gt;
 * <p>
 * Prompts for the two operator sign-offs, then dispatches the plan reviewer and the
 * splitter. Stops at the first gate that does not approve.
 */
@Command(name = "review-plan", mixinStandardHelpOptions = true, description = "Sign off requirements and test plan, then run technical review and split evaluation")
@Component
public class ReviewPlanCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Mixin
    private OperatorOptions operator;

    private final LifecycleService lifecycle;
    private final OperatorPrompt prompt;

    public ReviewPlanCommand(LifecycleService lifecycle, OperatorPrompt prompt) {
        this.lifecycle = lifecycle;
        this.prompt = prompt;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.report(lifecycle.reviewPlan(taskId, operator.identity(), prompt));
    }
}
