package com.taskflow.dispatch.cli;

import com.taskflow.core.engine.LifecycleService;
import com.taskflow.core.engine.OperatorPrompt;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

/**
 * CLI command: taskflow merge &lt;task-id&gt;
 * <p>
 * Asks for merge confirmation; on approval the change request is merged and the task is DONE.
 */
@Command(name = "merge", mixinStandardHelpOptions = true, description = "Confirm and merge the change request")
@Component
public class MergeCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Mixin
    private OperatorOptions operator;

    private final LifecycleService lifecycle;
    private final OperatorPrompt prompt;

    public MergeCommand(LifecycleService lifecycle, OperatorPrompt prompt) {
        this.lifecycle = lifecycle;
        this.prompt = prompt;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.report(lifecycle.merge(taskId, operator.identity(), prompt));
    }
}
