package com.taskflow.dispatch.cli;

import com.taskflow.core.gate.OutOfOrderGateException;
import com.taskflow.core.gate.StuckGateException;
import com.taskflow.core.persistence.ConcurrentTaskModificationException;
import com.taskflow.core.persistence.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments, delegates to the appropriate command and maps lifecycle errors to
 * exit codes.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int EXIT_NOT_FOUND = 3;
    static final int EXIT_OUT_OF_ORDER = 4;
    static final int EXIT_STUCK = 5;
    static final int EXIT_CONFLICT = 6;
    static final int EXIT_UNHEALTHY = 7;

    private final TaskflowCommand taskflowCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TaskflowCommand taskflowCommand, IFactory factory) {
        this.taskflowCommand = taskflowCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // In serve mode the embedded web server keeps the JVM alive; picocli is skipped.
        for (String arg : args) {
            if ("serve".equals(arg)) {
                return;
            }
        }
        exitCode = commandLine().execute(args);
    }

    CommandLine commandLine() {
        return new CommandLine(taskflowCommand, factory)
                .setExecutionExceptionHandler(CliRunner::handleExecutionException);
    }

    static int handleExecutionException(Exception e, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        ConsoleOutput.error(e.getMessage());
        if (e instanceof TaskNotFoundException) {
            return EXIT_NOT_FOUND;
        }
        if (e instanceof OutOfOrderGateException) {
            return EXIT_OUT_OF_ORDER;
        }
        if (e instanceof StuckGateException) {
            ConsoleOutput.info("Fix the task and run: taskflow override <id> <gate>");
            return EXIT_STUCK;
        }
        if (e instanceof ConcurrentTaskModificationException) {
            ConsoleOutput.info("The task changed concurrently; re-run the command");
            return EXIT_CONFLICT;
        }
        if (e instanceof IllegalArgumentException) {
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        log.error("Command '{}' failed", commandLine.getCommandName(), e);
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
