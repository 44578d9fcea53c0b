package com.taskflow.dispatch.cli;

import com.taskflow.core.engine.LifecycleService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

@Command(name = "archive", mixinStandardHelpOptions = true, description = "Archive a finished or abandoned task")
@Component
public class ArchiveCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Mixin
    private OperatorOptions operator;

    private final LifecycleService lifecycle;

    public ArchiveCommand(LifecycleService lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var task = lifecycle.archive(taskId, operator.identity());
        ConsoleOutput.status(task.status());
    }
}
