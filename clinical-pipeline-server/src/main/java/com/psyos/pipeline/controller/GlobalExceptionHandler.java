package com.psyos.pipeline.controller;

import com.psyos.pipeline.exception.AccessDeniedException;
import com.psyos.pipeline.exception.JobEnqueueException;
import com.psyos.pipeline.exception.NotFoundException;
import com.psyos.pipeline.exception.RateLimitExceededException;
import com.psyos.pipeline.exception.TenantScopeViolationException;
import com.psyos.pipeline.exception.UnauthenticatedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

/**
 * Maps the exception taxonomy to HTTP responses. Bodies are fixed strings; exception
 * messages stay in the server log.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<Map<String, Object>> handleUnauthenticated(UnauthenticatedException ex) {
        log.debug("Unauthenticated request: {}", ex.getMessage());
        return error(HttpStatus.UNAUTHORIZED, "Unauthorized");
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleAccessDenied(AccessDeniedException ex) {
        log.warn("Access denied: {}", ex.getMessage());
        return error(HttpStatus.FORBIDDEN, "Forbidden");
    }

    @ExceptionHandler(TenantScopeViolationException.class)
    public ResponseEntity<Map<String, Object>> handleScopeViolation(TenantScopeViolationException ex) {
        log.error("Tenant scope violation reached the web layer: entity={}, operation={}",
                ex.getEntity(), ex.getOperation());
        return error(HttpStatus.FORBIDDEN, "Forbidden");
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, "Not found");
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<Map<String, Object>> handleRateLimit(RateLimitExceededException ex) {
        log.info("Rate limited: {}", ex.getMessage());
        return error(HttpStatus.TOO_MANY_REQUESTS, "Too many requests");
    }

    @ExceptionHandler(JobEnqueueException.class)
    public ResponseEntity<Map<String, Object>> handleEnqueueFailure(JobEnqueueException ex) {
        log.error("Job queue unavailable: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Service unavailable");
    }

    @ExceptionHandler({
        IllegalArgumentException.class,
        HttpMessageNotReadableException.class,
        MissingRequestHeaderException.class,
        MissingServletRequestParameterException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        log.debug("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid request");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .body(Map.of("error", message, "timestamp", Instant.now().toString()));
    }
}
