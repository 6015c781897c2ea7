package com.leadpilot.orchestrator.api;

import com.leadpilot.orchestrator.service.AlreadyCompletedException;
import com.leadpilot.orchestrator.service.ExecutionAlreadyRunningException;
import com.leadpilot.orchestrator.service.ExecutionNotFoundException;
import com.leadpilot.orchestrator.service.NoActiveExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps engine exceptions onto HTTP statuses.
 *
 * 404  unknown execution
 * 409  state conflict: nothing to stop, already completed, already running
 * 400  malformed input
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ExecutionNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(ExecutionNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({NoActiveExecutionException.class,
                       AlreadyCompletedException.class,
                       ExecutionAlreadyRunningException.class})
    public ResponseEntity<Map<String, String>> conflict(RuntimeException e) {
        return body(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return body(HttpStatus.BAD_REQUEST, e);
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, RuntimeException e) {
        log.debug("{} -> {}", e.getClass().getSimpleName(), status.value());
        return ResponseEntity.status(status).body(Map.of("error", String.valueOf(e.getMessage())));
    }
}
