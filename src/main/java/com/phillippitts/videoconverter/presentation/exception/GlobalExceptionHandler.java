package com.phillippitts.videoconverter.presentation.exception;

import com.phillippitts.videoconverter.exception.ConversionNotFoundException;
import com.phillippitts.videoconverter.exception.ConversionQueueClosedException;
import com.phillippitts.videoconverter.exception.ConversionQueueFullException;
import com.phillippitts.videoconverter.exception.ConvertedFileNotFoundException;
import com.phillippitts.videoconverter.exception.InvalidRequestException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Unknown conversion id (HTTP 404).
     */
    @ExceptionHandler(ConversionNotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(ConversionNotFoundException ex) {
        LOG.debug("Conversion not found: {}", ex.getConversionId());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Conversion not found",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Missing converted file (HTTP 404).
     */
    @ExceptionHandler(ConvertedFileNotFoundException.class)
    ResponseEntity<ApiError> handleFileNotFound(ConvertedFileNotFoundException ex) {
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "File not found",
                ex.getFileName(),
                Instant.now()
            ));
    }

    /**
     * No handler or static resource for the path (HTTP 404).
     */
    @ExceptionHandler(NoResourceFoundException.class)
    ResponseEntity<ApiError> handleNoResource(NoResourceFoundException ex) {
        LOG.debug("No route for {}", ex.getResourcePath());
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(new ApiError(
                "NotFound",
                "No such endpoint",
                "/" + ex.getResourcePath(),
                Instant.now()
            ));
    }

    /**
     * Known path, wrong verb (HTTP 405).
     */
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    ResponseEntity<ApiError> handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex) {
        return ResponseEntity
            .status(HttpStatus.METHOD_NOT_ALLOWED)
            .body(new ApiError(
                "MethodNotAllowed",
                "Method not allowed",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Rejected client input (HTTP 400).
     */
    @ExceptionHandler({
        InvalidRequestException.class,
        ServletRequestBindingException.class,
        MissingServletRequestPartException.class,
        MethodArgumentTypeMismatchException.class,
        MultipartException.class
    })
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.debug("Bad request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Upload larger than the multipart limit (HTTP 413).
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    ResponseEntity<ApiError> handleTooLarge(MaxUploadSizeExceededException ex) {
        LOG.warn("Upload rejected: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.PAYLOAD_TOO_LARGE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Upload failed: file exceeds maximum allowed size",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Transient saturation - retry possible (HTTP 503).
     */
    @ExceptionHandler(ConversionQueueFullException.class)
    ResponseEntity<ApiError> handleQueueFull(ConversionQueueFullException ex) {
        LOG.warn("Conversion queue full: capacity={}, rejected={}", ex.getCapacity(), ex.getConversionId());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Server is busy",
                "Too many conversions in progress. Please retry shortly",
                Instant.now()
            ));
    }

    /**
     * Shutting down (HTTP 503).
     */
    @ExceptionHandler(ConversionQueueClosedException.class)
    ResponseEntity<ApiError> handleQueueClosed(ConversionQueueClosedException ex) {
        LOG.warn("Conversion rejected during shutdown: {}", ex.getConversionId());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Conversion service is shutting down",
                "Please retry later",
                Instant.now()
            ));
    }

    /**
     * Event stream pool exhausted (HTTP 503).
     */
    @ExceptionHandler(TaskRejectedException.class)
    ResponseEntity<ApiError> handleStreamRejected(TaskRejectedException ex) {
        LOG.warn("Event stream rejected: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                "EventStreamUnavailable",
                "Too many open event streams",
                "Fall back to polling or retry later",
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
