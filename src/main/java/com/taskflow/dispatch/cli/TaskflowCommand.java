package com.taskflow.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Taskflow.
 * Routes to the lifecycle commands, in the order a task goes through them, and the
 * operator commands.
 */
@Command(
        name = "taskflow",
        mixinStandardHelpOptions = true,
        version = "Taskflow 0.1.0",
        description = "Gated task lifecycle with sub-agent review and issue/branch sync",
        subcommands = {
                CreateTaskCommand.class,
                ReviewPlanCommand.class,
                StartImplementationCommand.class,
                ContinueImplementationCommand.class,
                PrepareHandoverCommand.class,
                StartReviewCommand.class,
                UpdateDocumentationCommand.class,
                MergeCommand.class,
                StatusCommand.class,
                ListCommand.class,
                ReconcileCommand.class,
                BlockCommand.class,
                UnblockCommand.class,
                OverrideCommand.class,
                ArchiveCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TaskflowCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}
