package com.taskflow.dispatch.api;

import com.taskflow.core.gate.OutOfOrderGateException;
import com.taskflow.core.gate.StuckGateException;
import com.taskflow.core.persistence.ConcurrentTaskModificationException;
import com.taskflow.core.persistence.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps lifecycle errors onto HTTP statuses with an {@code {"error": ...}} body.
 */
@RestControllerAdvice(assignableTypes = TaskController.class)
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(TaskNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(OutOfOrderGateException.class)
    public ResponseEntity<Map<String, String>> outOfOrder(OutOfOrderGateException e) {
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(ConcurrentTaskModificationException.class)
    public ResponseEntity<Map<String, String>> conflict(ConcurrentTaskModificationException e) {
        log.warn("Concurrent modification surfaced to API caller: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(StuckGateException.class)
    public ResponseEntity<Map<String, String>> stuck(StuckGateException e) {
        return error(HttpStatus.LOCKED, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", message == null ? status.getReasonPhrase() : message);
        return ResponseEntity.status(status).body(body);
    }
}
