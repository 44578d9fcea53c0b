package com.taskflow.core.llm;

import com.taskflow.core.TaskflowException;

/**
 * Thrown when model output cannot be parsed into the expected verdict type.
 */
public class LlmParseException extends TaskflowException {

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
