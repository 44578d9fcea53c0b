package com.taskflow.core.dispatch;

import com.taskflow.core.config.TaskflowProperties;
import com.taskflow.core.logging.MdcContext;
import com.taskflow.core.metrics.TaskflowMetrics;
import com.taskflow.core.model.AgentName;
import com.taskflow.core.model.ChangelogEntry;
import com.taskflow.core.model.SplitReference;
import com.taskflow.core.model.Step;
import com.taskflow.core.model.StepState;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskSnapshot;
import com.taskflow.core.model.TaskStatus;
import com.taskflow.core.model.Verdict;
import com.taskflow.core.persistence.TaskStore;
import com.taskflow.core.sync.ExternalSyncService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Invokes sub-agents with a read-only view of a task and returns their verdict as a value.
 * <p>
 * Each call runs on a bounded worker pool and is abandoned after
 * {@code taskflow.dispatch.timeout-seconds}. Timeouts, transport problems, worker
 * exceptions and unknown agents all come back as a {@link DispatchError}; nothing is
 * thrown to the caller and nothing is retried.
 * <p>
 * The dispatcher also owns the two side effects an agent answer can have on the store:
 * creating the child tasks of a split and appending changelog entries.
 */
@Service
public class SubAgentDispatcher {

    private static final Logger log = LoggerFactory.getLogger(SubAgentDispatcher.class);

    private final WorkerRegistry registry;
    private final TaskStore taskStore;
    private final ExternalSyncService syncService;
    private final TaskflowMetrics metrics;
    private final Clock clock;
    private final long timeoutSeconds;
    private final ExecutorService executor;

    public SubAgentDispatcher(WorkerRegistry registry,
                              TaskStore taskStore,
                              ExternalSyncService syncService,
                              TaskflowProperties properties,
                              TaskflowMetrics metrics,
                              Clock clock) {
        this.registry = registry;
        this.taskStore = taskStore;
        this.syncService = syncService;
        this.metrics = metrics;
        this.clock = clock;
        this.timeoutSeconds = properties.getDispatch().getTimeoutSeconds();
        var counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(properties.getDispatch().getMaxConcurrent(), r -> {
            var thread = new Thread(r, "subagent-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    public DispatchResult dispatch(AgentName agent, TaskSnapshot task) {
        return dispatch(agent, AgentContext.of(task));
    }

    public DispatchResult dispatch(AgentName agent, AgentContext context) {
        var worker = registry.find(agent);
        if (worker.isEmpty()) {
            log.warn("No worker registered for {}", agent);
            metrics.recordDispatchError(agent, DispatchError.Kind.UNKNOWN_AGENT.name());
            return DispatchResult.failure(agent, DispatchError.Kind.UNKNOWN_AGENT, "No worker registered for " + agent, 0);
        }

        long start = System.currentTimeMillis();
        var mdc = MDC.getCopyOfContextMap();
        Callable<WorkerResult> call = () -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            MdcContext.setAgent(agent);
            try {
                return worker.get().evaluate(context);
            } finally {
                MDC.clear();
            }
        };

        log.info("Dispatching {} for task {}", agent, context.task().id());
        var future = executor.submit(call);
        DispatchResult result;
        try {
            var answer = future.get(timeoutSeconds, TimeUnit.SECONDS);
            long elapsed = System.currentTimeMillis() - start;
            if (answer == null || answer.verdict() == null) {
                result = DispatchResult.failure(agent, DispatchError.Kind.AGENT_FAILURE,
                        "Worker returned no verdict", elapsed);
            } else {
                result = DispatchResult.success(agent, answer, elapsed);
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            result = DispatchResult.failure(agent, DispatchError.Kind.TIMEOUT,
                    "No answer within " + timeoutSeconds + "s", System.currentTimeMillis() - start);
        } catch (ExecutionException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            var kind = isTransportFailure(cause) ? DispatchError.Kind.TRANSPORT : DispatchError.Kind.AGENT_FAILURE;
            result = DispatchResult.failure(agent, kind,
                    cause.getClass().getSimpleName() + ": " + cause.getMessage(), System.currentTimeMillis() - start);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            result = DispatchResult.failure(agent, DispatchError.Kind.AGENT_FAILURE,
                    "Dispatch interrupted", System.currentTimeMillis() - start);
        }

        metrics.recordDispatch(agent, result.durationMs());
        if (result.failed()) {
            log.warn("Dispatch to {} failed: {}", agent, result.error().describe());
            metrics.recordDispatchError(agent, result.error().kind().name());
            return result;
        }

        log.info("{} answered {} in {} ms", agent, result.verdict(), result.durationMs());
        if (agent == AgentName.SPLITTER && result.verdict() == Verdict.APPROVED
                && result.artifacts().childTasks().size() >= 2) {
            try {
                return result.withCreatedTasks(applySplit(context.task().id(), result.artifacts().childTasks()));
            } catch (RuntimeException e) {
                log.warn("Applying split of task {} failed: {}", context.task().id(), e.getMessage(), e);
                metrics.recordDispatchError(agent, DispatchError.Kind.AGENT_FAILURE.name());
                return DispatchResult.failure(agent, DispatchError.Kind.AGENT_FAILURE,
                        "Applying split failed: " + e.getMessage(), result.durationMs());
            }
        }
        return result;
    }

    /**
     * Authors and appends the changelog entry for a completed step. When the changelog
     * writer fails, a plain entry built from the step itself is written instead.
     */
    public ChangelogEntry describeChange(String taskId, int stepIndex) {
        var task = taskStore.load(taskId);
        var step = task.steps().get(stepIndex);
        var result = dispatch(AgentName.CHANGELOG_WRITER, new AgentContext(TaskSnapshot.of(task), stepIndex));

        ChangelogEntry entry;
        if (!result.failed() && result.artifacts().changelogEntry() != null) {
            var authored = result.artifacts().changelogEntry();
            entry = new ChangelogEntry(clock.instant(), authored.component(), authored.summary(),
                    authored.effect(), AgentName.CHANGELOG_WRITER.name());
        } else {
            entry = new ChangelogEntry(clock.instant(), "step " + (stepIndex + 1),
                    "Completed: " + step.description(),
                    step.evidence() == null ? "state " + step.state() : "evidence: " + step.evidence(),
                    "system");
        }
        taskStore.appendChangelog(taskId, entry);
        return entry;
    }

    /**
     * Creates one task per child spec, ensures an issue for each and rewrites the parent's
     * unfinished steps into one delegating step per child. Applying a split to a parent
     * that already has delegated steps returns the existing children instead.
     */
    List<String> applySplit(String parentId, List<ChildTaskSpec> children) {
        var parent = taskStore.load(parentId);
        var existing = parent.steps().stream()
                .filter(Step::delegated)
                .map(s -> s.splitReference().childTaskId())
                .toList();
        if (!existing.isEmpty()) {
            log.info("Task {} was already split into {}", parentId, existing);
            return existing;
        }

        var remaining = new LinkedHashMap<Integer, Step>();
        for (int i = 0; i < parent.steps().size(); i++) {
            if (parent.steps().get(i).state() != StepState.DONE) {
                remaining.put(i, parent.steps().get(i));
            }
        }
        var superseded = assignSteps(remaining, children);

        var created = new ArrayList<Task>();
        for (var child : children) {
            var task = taskStore.create(child.spec().withParent(parentId));
            created.add(task);
            syncService.ensureIssue(task);
            syncService.syncStatus(taskStore.load(task.id()), TaskStatus.DRAFT);
        }

        var childIds = created.stream().map(Task::id).toList();
        var summary = "Split into %d child tasks: %s".formatted(created.size(), String.join(", ", childIds));
        taskStore.update(parentId, current -> {
            var steps = new ArrayList<Step>();
            for (var step : current.steps()) {
                if (step.state() == StepState.DONE) {
                    steps.add(step);
                }
            }
            for (int i = 0; i < created.size(); i++) {
                var child = created.get(i);
                var reference = new SplitReference(child.id(), child.title(), superseded.get(i));
                steps.add(new Step("Delegated to " + child.id() + ": " + child.title(),
                        "Child task " + child.id() + " reaches DONE", StepState.PENDING, null, reference));
            }
            return current.toBuilder()
                    .steps(steps)
                    .addChangelog(new ChangelogEntry(clock.instant(), "split", summary,
                            remaining.size() + " unfinished step(s) delegated", AgentName.SPLITTER.name()))
                    .build();
        });
        log.info("Task {}: {}", parentId, summary);
        return childIds;
    }

    /**
     * Descriptions of the parent steps each child supersedes. Steps no child claimed go to
     * the last child so that none is dropped.
     */
    private static List<List<String>> assignSteps(Map<Integer, Step> remaining, List<ChildTaskSpec> children) {
        var assigned = new ArrayList<List<String>>();
        var claimed = new HashSet<Integer>();
        for (var child : children) {
            var descriptions = new ArrayList<String>();
            for (var index : child.supersededSteps()) {
                if (remaining.containsKey(index) && claimed.add(index)) {
                    descriptions.add(remaining.get(index).description());
                }
            }
            assigned.add(descriptions);
        }
        var last = assigned.get(assigned.size() - 1);
        remaining.forEach((index, step) -> {
            if (!claimed.contains(index)) {
                last.add(step.description());
            }
        });
        return assigned;
    }

    private static boolean isTransportFailure(Throwable error) {
        for (var t = error; t != null; t = t.getCause()) {
            if (t instanceof IOException || t instanceof UncheckedIOException) {
                return true;
            }
        }
        return false;
    }
}
