package com.topology.core.service.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Envelope for every REST response of the service: {@code data} on success,
 * {@code error} otherwise.
 *
 * @param <T> the type of the response data
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, ErrorInfo error, Instant timestamp) {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, data, null, Instant.now());
    }

    public static <T> ApiResponse<T> error(String message, String code) {
        return new ApiResponse<>(false, null, new ErrorInfo(code, message, null), Instant.now());
    }

    /**
     * Request validation failure listing each rejected field.
     */
    public static <T> ApiResponse<T> invalid(List<String> fieldErrors) {
        return new ApiResponse<>(false, null,
                new ErrorInfo("VALIDATION_ERROR", "Validation failed", List.copyOf(fieldErrors)), Instant.now());
    }

    /**
     * Error response for a missing round, device or snapshot.
     */
    public static <T> ApiResponse<T> notFound(String what) {
        return error(what + " not found", "NOT_FOUND");
    }

    /**
     * @param fieldErrors "field: message" per rejected request field; validation errors only
     */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record ErrorInfo(String code, String message, List<String> fieldErrors) {
    }
}
