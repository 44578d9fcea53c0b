package com.taskflow.core.persistence;

import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link TaskStore}. The version check and the write happen inside a single
 * {@link ConcurrentHashMap#compute} call, so two saves from the same loaded version can
 * never both succeed. State is lost on restart.
 */
public class InMemoryTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskStore.class);

    private final ConcurrentHashMap<String, Task> tasks = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTaskStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Task create(TaskSpec spec) {
        var task = Task.draft(TaskStore.newTaskId(), spec, clock.instant()).withVersion(1L, clock.instant());
        tasks.put(task.id(), task);
        log.info("Created task {} ({})", task.id(), task.title());
        return task;
    }

    @Override
    public Task load(String taskId) {
        var task = tasks.get(taskId);
        if (task == null) {
            throw new TaskNotFoundException(taskId);
        }
        return task;
    }

    @Override
    public List<Task> list() {
        return tasks.values().stream()
                .sorted(Comparator.comparing(Task::createdAt).thenComparing(Task::id))
                .toList();
    }

    @Override
    public Task save(Task task) {
        return tasks.compute(task.id(), (id, stored) -> {
            if (stored == null) {
                throw new TaskNotFoundException(id);
            }
            if (stored.version() != task.version()) {
                throw new ConcurrentTaskModificationException(id, task.version(), stored.version());
            }
            return task.withVersion(stored.version() + 1, clock.instant());
        });
    }
}
