package com.taskflow.dispatch.cli;

import com.taskflow.core.engine.LifecycleService;
import com.taskflow.core.model.TaskStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "list", mixinStandardHelpOptions = true, description = "List tasks")
@Component
public class ListCommand implements Runnable {

    @Option(names = {"--all", "-a"}, description = "Include archived tasks")
    private boolean all;

    private final LifecycleService lifecycle;

    public ListCommand(LifecycleService lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var tasks = lifecycle.list().stream()
                .filter(t -> all || t.status() != TaskStatus.ARCHIVED)
                .toList();
        if (tasks.isEmpty()) {
            ConsoleOutput.info("No tasks");
            return;
        }
        System.out.printf("  %-14s %-26s %-9s %s%n", "ID", "STATUS", "KIND", "TITLE");
        System.out.println("  " + "-".repeat(72));
        tasks.forEach(ConsoleOutput::taskRow);
    }
}
