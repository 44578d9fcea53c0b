package com.taskflow.core.health;

import com.taskflow.core.config.TaskflowProperties;
import com.taskflow.core.dispatch.WorkerRegistry;
import com.taskflow.core.model.AgentName;
import com.taskflow.core.persistence.InMemoryTaskStore;
import com.taskflow.core.persistence.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Checks the collaborators a task needs to make progress: the task store, the git
 * binary, the GitHub configuration and the sub-agent roster.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final TaskStore taskStore;
    private final DataSource dataSource;
    private final WorkerRegistry workerRegistry;
    private final TaskflowProperties properties;

    public HealthCheckService(TaskStore taskStore,
                              @Autowired(required = false) DataSource dataSource,
                              WorkerRegistry workerRegistry,
                              TaskflowProperties properties) {
        this.taskStore = taskStore;
        this.dataSource = dataSource;
        this.workerRegistry = workerRegistry;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkTaskStore());
        results.add(checkGit());
        results.add(checkGitHub());
        results.add(checkWorkers());
        return results;
    }

    HealthStatus checkTaskStore() {
        if (taskStore instanceof InMemoryTaskStore || dataSource == null) {
            return HealthStatus.degraded("task-store",
                    "In-memory store; tasks are lost on restart", Map.of("type", "memory"));
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return HealthStatus.up("task-store",
                        "Database connection valid", Map.of("type", "jdbc"));
            }
            return HealthStatus.down("task-store",
                    "Database connection invalid", Map.of("type", "jdbc"));
        } catch (Exception e) {
            log.warn("Task store health check failed: {}", e.getMessage());
            return HealthStatus.down("task-store",
                    "Database error: " + e.getMessage(), Map.of("type", "jdbc"));
        }
    }

    HealthStatus checkGit() {
        try {
            var process = new ProcessBuilder("git", "--version").redirectErrorStream(true).start();
            var version = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).trim();
            if (process.waitFor(5, TimeUnit.SECONDS) && process.exitValue() == 0) {
                return HealthStatus.up("git", version,
                        Map.of("workDir", properties.getGit().getWorkDir()));
            }
            return HealthStatus.down("git", "git --version failed", Map.of());
        } catch (IOException e) {
            return HealthStatus.down("git", "git binary not found: " + e.getMessage(), Map.of());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HealthStatus.down("git", "interrupted", Map.of());
        }
    }

    HealthStatus checkGitHub() {
        var github = properties.getGithub();
        if (github.isConfigured()) {
            return HealthStatus.up("github",
                    "Repository " + github.getRepository(), Map.of("apiUrl", github.getApiUrl()));
        }
        return HealthStatus.degraded("github",
                "Token or repository not set; sync calls will be recorded as FAILED", Map.of());
    }

    HealthStatus checkWorkers() {
        var missing = EnumSet.allOf(AgentName.class);
        missing.removeAll(workerRegistry.registered());
        if (missing.isEmpty()) {
            return HealthStatus.up("workers",
                    workerRegistry.registered().size() + " agents registered", Map.of());
        }
        return HealthStatus.degraded("workers",
                "No worker for " + missing, Map.of());
    }
}
