package com.taskflow.dispatch.cli;

import com.taskflow.core.engine.LifecycleService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;

@Command(name = "prepare-handover", mixinStandardHelpOptions = true,
        description = "Write a continuation note for whoever picks the task up next")
@Component
public class PrepareHandoverCommand implements Runnable {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    @Option(names = {"--summary"}, required = true, description = "Where the work stands")
    private String summary;

    @Option(names = {"--next", "-n"}, description = "Next step (repeatable)")
    private List<String> nextSteps = new ArrayList<>();

    @Option(names = {"--question", "-q"}, description = "Open question (repeatable)")
    private List<String> questions = new ArrayList<>();

    @Mixin
    private OperatorOptions operator;

    private final LifecycleService lifecycle;

    public PrepareHandoverCommand(LifecycleService lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var report = lifecycle.prepareHandover(taskId, summary,
                nextSteps == null ? List.of() : nextSteps,
                questions == null ? List.of() : questions,
                operator.identity());
        ConsoleOutput.report(report);
    }
}
