package com.taskflow.dispatch.cli;

import com.taskflow.core.engine.LifecycleService;
import com.taskflow.core.model.GateId;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

/**
 * CLI command: taskflow override &lt;task-id&gt; &lt;gate&gt;
 * <p>
 * Clears the revision limit of a stuck gate so it can be entered again.
 */
@Command(name = "override", mixinStandardHelpOptions = true, description = "Release a gate stuck in its revision loop")
@Component
public class OverrideCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Parameters(index = "1", description = "Gate key, e.g. technical_review")
    private String gate;

    @Mixin
    private OperatorOptions operator;

    private final LifecycleService lifecycle;

    public OverrideCommand(LifecycleService lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var task = lifecycle.override(taskId, GateId.fromKey(gate), operator.identity());
        ConsoleOutput.success("Revision limit cleared for " + gate);
        ConsoleOutput.status(task.status());
    }
}
