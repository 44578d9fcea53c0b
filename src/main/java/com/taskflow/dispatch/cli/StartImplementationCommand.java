package com.taskflow.dispatch.cli;

import com.taskflow.core.engine.LifecycleService;
import com.taskflow.core.engine.OperatorPrompt;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

/**
 * CLI command: taskflow start-implementation &lt;task-id&gt;
 */
@Command(name = "start-implementation", mixinStandardHelpOptions = true, description = "Confirm the task is ready to implement")
@Component
public class StartImplementationCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Mixin
    private OperatorOptions operator;

    private final LifecycleService lifecycle;
    private final OperatorPrompt prompt;

    public StartImplementationCommand(LifecycleService lifecycle, OperatorPrompt prompt) {
        this.lifecycle = lifecycle;
        this.prompt = prompt;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.report(lifecycle.startImplementation(taskId, operator.identity(), prompt));
    }
}
