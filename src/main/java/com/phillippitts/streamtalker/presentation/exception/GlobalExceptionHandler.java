package com.phillippitts.streamtalker.presentation.exception;

import com.phillippitts.streamtalker.exception.CacheStorageException;
import com.phillippitts.streamtalker.exception.IllegalStateTransitionException;
import com.phillippitts.streamtalker.exception.MessageNotFoundException;
import com.phillippitts.streamtalker.exception.StreamTalkerException;
import com.phillippitts.streamtalker.exception.SynthesisException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for the control API.
 *
 * Converts domain exceptions to HTTP responses and logs them without echoing internal details
 * (file paths, server responses) to clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Unknown message id (HTTP 404).
     */
    @ExceptionHandler(MessageNotFoundException.class)
    ResponseEntity<ApiError> handleMessageNotFound(MessageNotFoundException ex) {
        LOG.debug("Message not found: {}", ex.getMessageId());
        return respond(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(),
                "Message not found", "No recent failed message with id " + ex.getMessageId());
    }

    /**
     * Client error - value out of range or malformed (HTTP 400).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        LOG.warn("Rejected request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "InvalidArgument", "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining("; "));
        LOG.warn("Validation failed: {}", details);
        return respond(HttpStatus.BAD_REQUEST, "ValidationFailed", "Invalid request", details);
    }

    /**
     * Command does not apply to the message's current state (HTTP 409).
     */
    @ExceptionHandler(IllegalStateTransitionException.class)
    ResponseEntity<ApiError> handleIllegalTransition(IllegalStateTransitionException ex) {
        LOG.info("Rejected state change: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getClass().getSimpleName(),
                "Message state changed", ex.getMessage());
    }

    /**
     * TTS server unreachable or failing - retry possible (HTTP 503).
     */
    @ExceptionHandler(SynthesisException.class)
    ResponseEntity<ApiError> handleSynthesisFailure(SynthesisException ex) {
        LOG.error("TTS server request failed: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "TTS server temporarily unavailable", "Please retry in a few seconds");
    }

    @ExceptionHandler(CacheStorageException.class)
    ResponseEntity<ApiError> handleCacheStorage(CacheStorageException ex) {
        LOG.error("Cache storage failure", ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Audio cache unavailable", "Check disk space and permissions of the cache directory");
    }

    @ExceptionHandler(StreamTalkerException.class)
    ResponseEntity<ApiError> handlePipelineFailure(StreamTalkerException ex) {
        LOG.error("Pipeline error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getClass().getSimpleName(),
                "Pipeline error", "See server logs");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
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
