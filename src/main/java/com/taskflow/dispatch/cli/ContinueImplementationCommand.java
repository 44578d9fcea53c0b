package com.taskflow.dispatch.cli;

import com.taskflow.core.engine.LifecycleService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * CLI command: taskflow continue-implementation &lt;task-id&gt; [--step N --evidence ...]
 * <p>
 * Steps are numbered from 1 on the command line.
 */
@Command(name = "continue-implementation", mixinStandardHelpOptions = true,
        description = "Record a finished step and show the next one")
@Component
public class ContinueImplementationCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = {"--step", "-s"}, description = "Number of the step just finished (1-based)")
    private Integer step;

    @Option(names = {"--evidence", "-e"}, description = "Commit, test output or link proving completion")
    private String evidence;

    @Mixin
    private OperatorOptions operator;

    private final LifecycleService lifecycle;

    public ContinueImplementationCommand(LifecycleService lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        Integer index = step == null ? null : step - 1;
        ConsoleOutput.report(lifecycle.continueImplementation(taskId, index, evidence, operator.identity()));
    }
}
