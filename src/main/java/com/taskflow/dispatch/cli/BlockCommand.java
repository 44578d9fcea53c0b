package com.taskflow.dispatch.cli;

import com.taskflow.core.engine.LifecycleService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "block", mixinStandardHelpOptions = true, description = "Put a task on hold")
@Component
public class BlockCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = {"--reason"}, required = true, description = "Why the task is blocked")
    private String reason;

    @Mixin
    private OperatorOptions operator;

    private final LifecycleService lifecycle;

    public BlockCommand(LifecycleService lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var task = lifecycle.block(taskId, reason, operator.identity());
        ConsoleOutput.status(task.status());
    }
}
