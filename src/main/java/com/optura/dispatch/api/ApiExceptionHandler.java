package com.optura.dispatch.api;

import com.optura.core.engine.DependencyEndpointNotFoundException;
import com.optura.core.engine.InvalidDependencyException;
import com.optura.core.engine.TransitionConflictException;
import com.optura.core.lifecycle.GateViolationException;
import com.optura.core.store.ProjectNotFoundException;
import com.optura.core.store.TaskNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Locale;
import java.util.Map;

/**
 * Maps core error kinds to HTTP statuses with a {@code {"error", "message"}} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleTaskNotFound(TaskNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "task_not_found", ex.getMessage(), request);
    }

    @ExceptionHandler(ProjectNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleProjectNotFound(ProjectNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "project_not_found", ex.getMessage(), request);
    }

    @ExceptionHandler(DependencyEndpointNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleEndpointNotFound(DependencyEndpointNotFoundException ex,
                                                                      HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "dependency_endpoint_not_found", ex.getMessage(), request);
    }

    @ExceptionHandler(GateViolationException.class)
    public ResponseEntity<Map<String, String>> handleGateViolation(GateViolationException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ex.gate().name().toLowerCase(Locale.ROOT), ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidDependencyException.class)
    public ResponseEntity<Map<String, String>> handleInvalidDependency(InvalidDependencyException ex,
                                                                       HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ex.reason().name().toLowerCase(Locale.ROOT), ex.getMessage(), request);
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception ex, HttpServletRequest request) {
        String message = ex.getMessage() != null ? ex.getMessage() : "Malformed request";
        return respond(HttpStatus.BAD_REQUEST, "bad_request", message, request);
    }

    @ExceptionHandler(TransitionConflictException.class)
    public ResponseEntity<Map<String, String>> handleConflict(TransitionConflictException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, "transition_conflict", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={} method={} errorType={}", request.getRequestURI(), request.getMethod(),
                ex.getClass().getSimpleName(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "internal_error", "message", "Unexpected server error"));
    }

    private ResponseEntity<Map<String, String>> respond(HttpStatus status, String error, String message,
                                                         HttpServletRequest request) {
        log.warn("HTTP_ERROR path={} method={} status={} error={} message={}",
                request.getRequestURI(), request.getMethod(), status.value(), error, message);
        return ResponseEntity.status(status).body(Map.of("error", error, "message", message));
    }
}
