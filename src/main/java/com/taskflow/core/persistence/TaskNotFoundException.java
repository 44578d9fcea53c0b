package com.taskflow.core.persistence;

import com.taskflow.core.TaskflowException;

public class TaskNotFoundException extends TaskflowException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
