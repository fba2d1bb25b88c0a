package com.phillippitts.sermonflow.presentation.exception;

import com.phillippitts.sermonflow.exception.RecordingTooShortException;
import com.phillippitts.sermonflow.exception.SermonFlowException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.NoSuchElementException;

/**
 * Global exception handler for the REST boundary.
 *
 * Most flow failures are part of the returned state (error phase); this handler covers what the
 * orchestrator throws: a too-short stop, an intent in the wrong phase, an unknown sermon, bad input.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Stop requested before the minimum duration; the recording keeps running (HTTP 409).
     */
    @ExceptionHandler(RecordingTooShortException.class)
    ResponseEntity<ApiError> handleRecordingTooShort(RecordingTooShortException ex) {
        LOG.info("Stop rejected: {}s of {}s", ex.getActualSeconds(), ex.getMinimumSeconds());
        return error(HttpStatus.CONFLICT, ex.getKind().name(), "Recording too short", ex.getMessage(), false);
    }

    /**
     * Intent not valid in the current phase (HTTP 409).
     */
    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<ApiError> handleIllegalState(IllegalStateException ex) {
        LOG.warn("Rejected intent: {}", ex.getMessage());
        return error(HttpStatus.CONFLICT, "InvalidPhase", "Action not allowed now", ex.getMessage(), false);
    }

    /**
     * Unknown sermon (HTTP 404).
     */
    @ExceptionHandler(NoSuchElementException.class)
    ResponseEntity<ApiError> handleNotFound(NoSuchElementException ex) {
        LOG.info("Not found: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, "NotFound", "Sermon not found", ex.getMessage(), false);
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class})
    ResponseEntity<ApiError> handleBadRequest(RuntimeException ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "BadRequest", "Invalid request", ex.getMessage(), false);
    }

    /**
     * Request body failed bean validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request body");
        LOG.warn("Invalid request body: {}", details);
        return error(HttpStatus.BAD_REQUEST, "BadRequest", "Invalid request", details, false);
    }

    /**
     * Any other flow failure thrown at the boundary (HTTP 422).
     */
    @ExceptionHandler(SermonFlowException.class)
    ResponseEntity<ApiError> handleFlowFailure(SermonFlowException ex) {
        LOG.warn("Sermon flow failure: kind={}, message={}", ex.getKind(), ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex.getKind().name(), "Sermon flow failed", ex.getMessage(),
                ex.isRetryable());
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError", "An unexpected error occurred",
                "Please contact support with request ID", false);
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details,
                                                  boolean retryable) {
        return ResponseEntity
            .status(status)
            .body(new ApiError(code, message, details, retryable, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        boolean retryable,
        Instant timestamp
    ) {}
}
