package com.phillippitts.worktracker.presentation.exception;

import com.phillippitts.worktracker.exception.InvalidSiteException;
import com.phillippitts.worktracker.exception.InvalidTransitionException;
import com.phillippitts.worktracker.exception.ManualCommandConflictException;
import com.phillippitts.worktracker.exception.PersistenceException;
import com.phillippitts.worktracker.exception.SiteNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting internal details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Manual command against the wrong session state (HTTP 409).
     */
    @ExceptionHandler(ManualCommandConflictException.class)
    ResponseEntity<ApiError> handleConflict(ManualCommandConflictException ex) {
        LOG.info("Manual command rejected: site={}, reason={}", ex.getSiteId(), ex.getReason());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                ex.getReason().name(),
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Unknown site (HTTP 404).
     */
    @ExceptionHandler(SiteNotFoundException.class)
    ResponseEntity<ApiError> handleSiteNotFound(SiteNotFoundException ex) {
        LOG.info(ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Site not found",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Client error - malformed transition payload (HTTP 400).
     */
    @ExceptionHandler(InvalidTransitionException.class)
    ResponseEntity<ApiError> handleInvalidTransition(InvalidTransitionException ex) {
        LOG.warn("Invalid transition payload: reason={}", ex.getReason());
        return badRequest(ex.getClass().getSimpleName(), "Invalid transition", ex.getReason());
    }

    /**
     * Client error - site definition out of bounds (HTTP 400).
     */
    @ExceptionHandler(InvalidSiteException.class)
    ResponseEntity<ApiError> handleInvalidSite(InvalidSiteException ex) {
        LOG.warn("Invalid site: reason={}", ex.getReason());
        return badRequest(ex.getClass().getSimpleName(), "Invalid site", ex.getReason());
    }

    /**
     * Client error - request failed binding or validation (HTTP 400).
     */
    @ExceptionHandler({
        MethodArgumentNotValidException.class,
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
        HttpMessageNotReadableException.class,
        IllegalArgumentException.class
    })
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return badRequest("BadRequest", "Invalid request", ex.getMessage());
    }

    /**
     * Transient error - store write failed, retry possible (HTTP 503).
     */
    @ExceptionHandler(PersistenceException.class)
    ResponseEntity<ApiError> handlePersistence(PersistenceException ex) {
        LOG.error("Persistence failure: operation={}", ex.getOperation(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Tracking store temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> badRequest(String code, String message, String details) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
