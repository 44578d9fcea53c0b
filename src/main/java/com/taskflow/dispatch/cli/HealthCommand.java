package com.taskflow.dispatch.cli;

import com.taskflow.core.health.HealthCheckService;
import com.taskflow.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: taskflow health
 * <p>
 * Prints each component with its metadata, then whether lifecycle commands can run.
 * Exits with {@link CliRunner#EXIT_UNHEALTHY} when any component is down.
 */
@Command(name = "health", mixinStandardHelpOptions = true,
        description = "Check the task store, git, the issue tracker and the sub-agents")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return CliRunner.EXIT_UNHEALTHY;
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DEGRADED -> ConsoleOutput.warn(label);
                case DOWN -> ConsoleOutput.error(label);
            }
            check.metadata().forEach((key, value) -> System.out.println("    " + key + " = " + value));
        }

        System.out.println(ConsoleOutput.RULE);
        return switch (HealthStatus.overall(checks)) {
            case UP -> {
                ConsoleOutput.success("All components up");
                yield 0;
            }
            case DEGRADED -> {
                ConsoleOutput.warn("Degraded: lifecycle commands run, but "
                        + components(checks, HealthStatus.Status.DEGRADED) + " need attention");
                yield 0;
            }
            case DOWN -> {
                ConsoleOutput.error("Down: " + components(checks, HealthStatus.Status.DOWN)
                        + "; lifecycle commands will fail");
                yield CliRunner.EXIT_UNHEALTHY;
            }
        };
    }

    private static String components(List<HealthStatus> checks, HealthStatus.Status status) {
        return String.join(", ", checks.stream()
                .filter(check -> check.status() == status)
                .map(HealthStatus::component)
                .toList());
    }
}
