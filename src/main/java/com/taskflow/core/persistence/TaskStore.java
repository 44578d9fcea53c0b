package com.taskflow.core.persistence;

import com.taskflow.core.model.ChangelogEntry;
import com.taskflow.core.model.StepState;
import com.taskflow.core.model.Task;
import com.taskflow.core.model.TaskSpec;

import java.util.List;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Durable persistence of the task aggregate.
 * <p>
 * {@link #save} is a whole-aggregate overwrite guarded by an optimistic version check.
 * The changelog and step helpers are built on it and retry internally, because appending
 * an entry or completing a step commutes with any other change.
 */
public interface TaskStore {

    /** Attempts made by {@link #update} before giving up on a contended task. */
    int MAX_UPDATE_ATTEMPTS = 5;

    Task create(TaskSpec spec);

    Task load(String taskId);

    List<Task> list();

    /**
     * Persists the task if the stored version equals {@code task.version()}.
     *
     * @return the stored task carrying the incremented version
     * @throws ConcurrentTaskModificationException if the task changed since it was loaded
     * @throws TaskNotFoundException if the task does not exist
     */
    Task save(Task task);

    default Task appendChangelog(String taskId, ChangelogEntry entry) {
        return update(taskId, task -> task.appendChangelog(entry));
    }

    default Task updateStep(String taskId, int stepIndex, StepState state, String evidence) {
        return update(taskId, task -> task.withStep(stepIndex, state, evidence));
    }

    /**
     * Load-modify-save with reload on conflict. Only for changes that are valid against
     * any newer version of the task.
     */
    default Task update(String taskId, UnaryOperator<Task> change) {
        ConcurrentTaskModificationException last = null;
        for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
            Task current = load(taskId);
            try {
                return save(change.apply(current));
            } catch (ConcurrentTaskModificationException e) {
                last = e;
            }
        }
        throw last;
    }

    static String newTaskId() {
        return "TASK-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
