package com.phillippitts.jukebox.presentation.exception;

import com.phillippitts.jukebox.exception.JukeboxException;
import com.phillippitts.jukebox.exception.NoSourcesException;
import com.phillippitts.jukebox.exception.ServiceNotReadyException;
import jakarta.validation.ConstraintViolationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Global exception handler for the control API.
 *
 * Converts application exceptions to HTTP responses with appropriate status codes.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Empty source rotation (HTTP 409).
     */
    @ExceptionHandler(NoSourcesException.class)
    ResponseEntity<ApiError> handleNoSources(NoSourcesException ex) {
        LOG.warn("Source operation rejected: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, ex.getClass().getSimpleName(),
                "No sources available", "Add a source before cycling");
    }

    /**
     * A playback worker was never started (HTTP 503).
     */
    @ExceptionHandler(ServiceNotReadyException.class)
    ResponseEntity<ApiError> handleNotReady(ServiceNotReadyException ex) {
        LOG.warn("Service not ready: component={}", ex.getComponent());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Service not ready", "Please retry in a few seconds");
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            HandlerMethodValidationException.class,
            ConstraintViolationException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Invalid request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "InvalidRequest", "Invalid request", ex.getMessage());
    }

    /**
     * Other application errors (HTTP 500) with the exception type exposed.
     */
    @ExceptionHandler(JukeboxException.class)
    ResponseEntity<ApiError> handleJukebox(JukeboxException ex) {
        LOG.error("Player operation failed", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getClass().getSimpleName(),
                "Player operation failed", ex.getMessage());
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
