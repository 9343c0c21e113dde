package com.phillippitts.callbridge.presentation.exception;

import com.phillippitts.callbridge.exception.CallAcceptException;
import com.phillippitts.callbridge.exception.ConfigDataException;
import com.phillippitts.callbridge.exception.InvalidSignatureException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for the HTTP boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting upstream details from callers.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Unauthenticated webhook (HTTP 401). Nothing of the event was processed.
     */
    @ExceptionHandler(InvalidSignatureException.class)
    ResponseEntity<ApiError> handleInvalidSignature(InvalidSignatureException ex) {
        LOG.warn("Rejected webhook with invalid signature: webhook-id={}", ex.getWebhookId());
        return ResponseEntity
            .status(HttpStatus.UNAUTHORIZED)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid signature",
                "Webhook signature verification failed",
                Instant.now()
            ));
    }

    /**
     * Call could not be accepted (HTTP 500). Scoped to this call only.
     */
    @ExceptionHandler(CallAcceptException.class)
    ResponseEntity<ApiError> handleAcceptFailure(CallAcceptException ex) {
        LOG.error("Accept failed: call={}, attempts={}, status={}",
            ex.getCallId(), ex.getAttempts(), ex.getStatusCode());
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Accept failed",
                "The call could not be accepted",
                Instant.now()
            ));
    }

    /**
     * Business configuration file unreadable during reload (HTTP 500).
     */
    @ExceptionHandler(ConfigDataException.class)
    ResponseEntity<ApiError> handleConfigData(ConfigDataException ex) {
        LOG.error("Config data reload failed: file={}", ex.getFileName(), ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Configuration reload failed",
                "Could not load " + ex.getFileName(),
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
