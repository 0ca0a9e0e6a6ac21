package com.topology.core.service.api.advice;

import com.topology.core.service.api.dto.ApiResponse;
import com.topology.core.service.discovery.DiscoveryException;
import com.topology.core.service.engine.GraphInvariantViolationException;
import com.topology.core.service.engine.SnapshotNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;

/**
 * Global exception handler for REST controllers.
 *
 * Provides consistent error responses across all endpoints.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidationException(
            MethodArgumentNotValidException ex) {

        List<String> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();

        log.warn("Validation error: {}", fieldErrors);

        return ResponseEntity.badRequest().body(ApiResponse.invalid(fieldErrors));
    }

    @ExceptionHandler(DiscoveryException.class)
    public ResponseEntity<ApiResponse<Void>> handleDiscoveryException(DiscoveryException ex) {
        HttpStatus status = switch (ex.getErrorCode()) {
            case DiscoveryException.QUEUE_FULL -> HttpStatus.TOO_MANY_REQUESTS;
            case DiscoveryException.ROUND_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case DiscoveryException.INVALID_PROBE, DiscoveryException.UNKNOWN_CREDENTIALS -> HttpStatus.BAD_REQUEST;
            case DiscoveryException.DISCOVERY_DISABLED -> HttpStatus.SERVICE_UNAVAILABLE;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };

        if (status.is5xxServerError()) {
            log.error("Discovery error: {} [{}]", ex.getMessage(), ex.getErrorCode());
        } else {
            log.warn("Discovery request rejected: {} [{}]", ex.getMessage(), ex.getErrorCode());
        }

        return ResponseEntity.status(status)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(SnapshotNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleSnapshotNotFound(SnapshotNotFoundException ex) {
        log.debug("Snapshot lookup failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error(ex.getMessage(), "VERSION_NOT_FOUND"));
    }

    @ExceptionHandler(GraphInvariantViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvariantViolation(GraphInvariantViolationException ex) {
        log.error("Graph invariant violated by {}: {}", ex.getRoundId(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(ex.getMessage(), "GRAPH_INVARIANT_VIOLATION"));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNoResourceFoundException(
            NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error("Resource not found", "NOT_FOUND"));
    }

    /**
     * Handles missing or unparseable query parameters.
     */
    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiResponse<Void>> handleBadParameter(Exception ex) {
        log.warn("Bad request parameter: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(ApiResponse.error(ex.getMessage(), "INVALID_ARGUMENT"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgumentException(
            IllegalArgumentException ex) {
        log.warn("Illegal argument: {}", ex.getMessage());

        return ResponseEntity.badRequest()
                .body(ApiResponse.error(ex.getMessage(), "INVALID_ARGUMENT"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(
                        "An unexpected error occurred",
                        "INTERNAL_ERROR"
                ));
    }
}
