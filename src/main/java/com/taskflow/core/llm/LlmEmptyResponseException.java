package com.taskflow.core.llm;

import com.taskflow.core.TaskflowException;

/**
 * Thrown when the model returns null or blank content instead of a verdict.
 */
public class LlmEmptyResponseException extends TaskflowException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
