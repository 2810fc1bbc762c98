package com.deploypilot.engine.api;

import com.deploypilot.engine.model.IllegalStateTransitionException;
import com.deploypilot.engine.retry.TriggerExhaustedException;
import com.deploypilot.engine.service.ExecutionNotFoundException;
import com.deploypilot.engine.service.InvalidDefinitionException;
import com.deploypilot.engine.service.NoRollbackTargetException;
import com.deploypilot.engine.service.PipelineNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain exceptions to HTTP responses with a small JSON body
 * ({@code {"error": "..."}} plus exception-specific fields).
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({PipelineNotFoundException.class, ExecutionNotFoundException.class})
    public ResponseEntity<Map<String, Object>> notFound(RuntimeException e) {
        return body(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(InvalidDefinitionException.class)
    public ResponseEntity<Map<String, Object>> invalidDefinition(InvalidDefinitionException e) {
        Map<String, Object> body = error(e.getMessage());
        body.put("errors", e.errors());
        return ResponseEntity.unprocessableEntity().body(body);
    }

    @ExceptionHandler({IllegalStateTransitionException.class, NoRollbackTargetException.class})
    public ResponseEntity<Map<String, Object>> conflict(RuntimeException e) {
        return body(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(TriggerExhaustedException.class)
    public ResponseEntity<Map<String, Object>> triggerExhausted(TriggerExhaustedException e) {
        log.warn("Trigger failed after {} attempt(s), recorded as execution {}", e.attempts(), e.executionId());
        Map<String, Object> body = error(e.lastError());
        body.put("attempts", e.attempts());
        body.put("executionId", e.executionId());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return body(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(error(message));
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        return body;
    }
}
