package com.taskflow.core.persistence;

import com.taskflow.core.TaskflowException;

/**
 * The backing store could not be reached or rejected a statement.
 */
public class TaskStoreException extends TaskflowException {

    public TaskStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
