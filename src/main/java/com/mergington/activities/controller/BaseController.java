package com.mergington.activities.controller;

import com.mergington.activities.exception.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;

/**
 * Base controller with common error handling.
 * All controllers should extend this so roster errors map to the same status codes and body shape.
 */
@RestController
public abstract class BaseController {

    private static final Logger logger = LoggerFactory.getLogger(BaseController.class);

    /**
     * Error response DTO for consistent error formatting.
     * {@code detail} carries the human-readable reason shown to the student.
     */
    public static class ErrorResponse {
        private final String error;
        private final String detail;
        private final long timestamp;

        public ErrorResponse(String error, String detail) {
            this.error = error;
            this.detail = detail;
            this.timestamp = System.currentTimeMillis();
        }

        public String getError() { return error; }
        public String getDetail() { return detail; }
        public long getTimestamp() { return timestamp; }
    }

    // Common exception handlers

    @ExceptionHandler(ActivityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleActivityNotFound(ActivityNotFoundException e) {
        logger.debug("Activity not found: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse("ACTIVITY_NOT_FOUND", e.getMessage()));
    }

    @ExceptionHandler(AlreadyEnrolledException.class)
    public ResponseEntity<ErrorResponse> handleAlreadyEnrolled(AlreadyEnrolledException e) {
        logger.warn("Already enrolled: {}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("ALREADY_ENROLLED", e.getMessage()));
    }

    @ExceptionHandler(NotEnrolledException.class)
    public ResponseEntity<ErrorResponse> handleNotEnrolled(NotEnrolledException e) {
        logger.warn("Not enrolled: {}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("NOT_ENROLLED", e.getMessage()));
    }

    @ExceptionHandler(CapacityExceededException.class)
    public ResponseEntity<ErrorResponse> handleCapacityExceeded(CapacityExceededException e) {
        logger.warn("Capacity exceeded: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(new ErrorResponse("ACTIVITY_FULL", e.getMessage()));
    }

    @ExceptionHandler(jakarta.validation.ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(jakarta.validation.ConstraintViolationException e) {
        logger.warn("Validation constraint violation: {}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("VALIDATION_ERROR", "Invalid input parameters"));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        logger.warn("Missing request parameter: {}", e.getParameterName());
        return ResponseEntity.badRequest()
            .body(new ErrorResponse("VALIDATION_ERROR", "Missing required parameter: " + e.getParameterName()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneral(Exception e) {
        logger.error("Unexpected error: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse("INTERNAL_ERROR", "An unexpected error occurred"));
    }
}
