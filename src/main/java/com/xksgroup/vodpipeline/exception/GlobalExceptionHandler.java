package com.xksgroup.vodpipeline.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestNotUsableException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred", ex);
        return buildErrorResponse(
            HttpStatus.INTERNAL_SERVER_ERROR,
            "An unexpected error occurred",
            ex.getMessage()
        );
    }

    @ExceptionHandler(VideoNotFoundException.class)
    public ResponseEntity<Object> handleVideoNotFound(VideoNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.NOT_FOUND,
            "Video not found",
            ex.getMessage()
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Object> handleIllegalArgumentException(IllegalArgumentException ex) {
        log.warn("Invalid argument provided: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "Invalid request parameter",
            ex.getMessage()
        );
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Object> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "Invalid request parameter",
            ex.getName() + ": " + ex.getValue()
        );
    }

    @ExceptionHandler(QueueUnavailableException.class)
    public ResponseEntity<Object> handleQueueUnavailable(QueueUnavailableException ex) {
        log.error("Job queue unavailable: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.SERVICE_UNAVAILABLE,
            "Job queue unavailable",
            ex.getMessage()
        );
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<Object> handlePersistence(PersistenceException ex) {
        log.error("Metadata store error: {}", ex.getMessage(), ex);
        return buildErrorResponse(
            HttpStatus.SERVICE_UNAVAILABLE,
            "Metadata store unavailable",
            ex.getMessage()
        );
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Object> handleNoResourceFoundException(NoResourceFoundException ex) {
        return buildErrorResponse(
                HttpStatus.NOT_FOUND,
                "Resource not found",
                ex.getMessage()
        );
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Object> handleHttpMessageNotReadable(HttpMessageNotReadableException ex) {
        log.warn("Bad request - unreadable/missing body: {}", ex.getMessage());
        return buildErrorResponse(
            HttpStatus.BAD_REQUEST,
            "Invalid or missing request body",
            ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage()
        );
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Object> handleValidationErrors(MethodArgumentNotValidException ex) {
        String msg = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getField() + ": " + err.getDefaultMessage())
                .orElse("Validation failed");
        return buildErrorResponse(HttpStatus.BAD_REQUEST, "Validation error", msg);
    }

    private ResponseEntity<Object> buildErrorResponse(HttpStatus status, String message, String details) {
        Map<String, Object> errorResponse = Map.of(
            "timestamp", Instant.now(),
            "status", status.value(),
            "error", status.getReasonPhrase(),
            "message", message,
            "details", details != null ? details : "No additional details available"
        );
        return new ResponseEntity<>(errorResponse, status);
    }

    @ExceptionHandler({
        AsyncRequestNotUsableException.class,
        IOException.class
    })
    public ResponseEntity<Map<String, Object>> handleSseDisconnect(Exception ex) {
        Map<String, Object> body = Map.of(
            "timestamp", Instant.now().toString(),
            "status", 499, // client closed request
            "error", "Client Closed Request",
            "message", "SSE client disconnected or connection was lost",
            "details", ex.getClass().getSimpleName()
        );

        log.info("SSE client disconnected: {}", ex.getMessage());

        return ResponseEntity
                .status(499)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body);
    }
}
