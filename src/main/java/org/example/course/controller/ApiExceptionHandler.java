package org.example.course.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.course.config.RequestContext;
import org.example.course.service.CourseNotFoundException;
import org.example.course.service.CourseStateException;
import org.example.course.service.GenerationException;
import org.example.course.service.UsageLimitExceededException;
import org.example.course.service.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine exceptions to {@code {error, code, ...}} bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException ex) {
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage());
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<Map<String, Object>> handleMissingHeader(MissingRequestHeaderException ex) {
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Missing header " + ex.getHeaderName());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Malformed request body");
    }

    @ExceptionHandler(CourseNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(CourseNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "COURSE_NOT_FOUND", "Course not found");
    }

    @ExceptionHandler(CourseStateException.class)
    public ResponseEntity<Map<String, Object>> handleState(CourseStateException ex) {
        return error(HttpStatus.CONFLICT, ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(UsageLimitExceededException.class)
    public ResponseEntity<Map<String, Object>> handleLimit(UsageLimitExceededException ex) {
        log.info("Usage limit {} reached on tier {} ({}/{})", ex.getCode(), ex.getTier(), ex.getUsed(), ex.getLimit());
        Map<String, Object> body = body(ex.getCode(), ex.getMessage());
        body.put("canUpgrade", ex.isCanUpgrade());
        body.put("currentTier", ex.getTier());
        body.put("used", ex.getUsed());
        body.put("limit", ex.getLimit());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(body);
    }

    @ExceptionHandler(GenerationException.class)
    public ResponseEntity<Map<String, Object>> handleGeneration(GenerationException ex, HttpServletRequest request) {
        log.warn("Generation failed ({}) for {} [requestId={}]: {}", ex.getFailureCause(), request.getRequestURI(),
                RequestContext.resolveRequestId(request), ex.getMessage());
        HttpStatus status = ex.getFailureCause() == GenerationException.Cause.TIMEOUT
                ? HttpStatus.GATEWAY_TIMEOUT
                : HttpStatus.BAD_GATEWAY;
        Map<String, Object> body = body("GENERATION_FAILED", ex.getMessage());
        body.put("cause", ex.getFailureCause().name());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handlePersistence(DataAccessException ex, HttpServletRequest request) {
        log.error("Persistence failure for {} [requestId={}]", request.getRequestURI(),
                RequestContext.resolveRequestId(request), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "PERSISTENCE_ERROR", "Failed to access stored data");
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(body(code, message));
    }

    private Map<String, Object> body(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", code);
        return body;
    }
}
