package com.taskflow.core;

/**
 * Base class for the lifecycle controller's own failures.
 */
public class TaskflowException extends RuntimeException {

    public TaskflowException(String message) {
        super(message);
    }

    public TaskflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
