package com.taskflow.dispatch.cli;

import com.taskflow.core.engine.LifecycleService;
import com.taskflow.core.model.TaskSpec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: taskflow create-task "title" --requirements ... --step "desc::criteria"
 * <p>
 * Creates a task and, unless {@code --draft} is given, submits it for requirements review.
 */
@Command(name = "create-task", mixinStandardHelpOptions = true, description = "Create a new task")
@Component
public class CreateTaskCommand implements Runnable {

    static final String STEP_SEPARATOR = "::";

    @Parameters(index = "0", description = "Task title")
    private String title;

    @Option(names = {"--requirements", "-r"}, description = "Business intent", defaultValue = "")
    private String requirements;

    @Option(names = {"--test-plan", "-t"}, description = "Proposed test plan", defaultValue = "")
    private String testPlan;

    @Option(names = {"--step", "-s"}, description = "Technical step as \"description::acceptance criteria\" (repeatable)")
    private List<String> steps = new ArrayList<>();

    @Option(names = {"--draft"}, description = "Keep the task in DRAFT")
    private boolean draft;

    @Mixin
    private OperatorOptions operator;

    private final LifecycleService lifecycle;

    public CreateTaskCommand(LifecycleService lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var spec = new TaskSpec(title, requirements, testPlan, parseSteps(steps), null);
        var report = lifecycle.createTask(spec, draft, operator.identity());
        ConsoleOutput.report(report);
        ConsoleOutput.status(report.task().status());
    }

    static List<TaskSpec.StepSpec> parseSteps(List<String> raw) {
        if (raw == null) {
            return List.of();
        }
        return raw.stream().map(s -> {
            int split = s.indexOf(STEP_SEPARATOR);
            if (split < 0) {
                return new TaskSpec.StepSpec(s.trim(), "");
            }
            return new TaskSpec.StepSpec(s.substring(0, split).trim(), s.substring(split + STEP_SEPARATOR.length()).trim());
        }).toList();
    }
}
