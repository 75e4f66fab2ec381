package com.fintech.marketdata.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * Error body returned by every endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error response with details about the failure")
public record ErrorResponse(

    @Schema(description = "HTTP status code", example = "404")
    int status,

    @Schema(description = "Error category", example = "NO_DATA")
    String error,

    @Schema(description = "Human-readable error message", example = "No data found for the specified range.")
    String message,

    @Schema(description = "Request path that caused the error", example = "/data")
    String path,

    @Schema(description = "Timestamp of the error", example = "2024-05-02T10:30:00Z")
    Instant timestamp,

    @Schema(description = "Series key the error relates to, if any", example = "AAPL")
    String assetId,

    @Schema(description = "Detailed validation errors (if applicable)")
    List<ValidationError> validationErrors
) {

    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, Instant.now(), null, null);
    }

    public ErrorResponse(int status, String error, String message, String path, String assetId) {
        this(status, error, message, path, Instant.now(), assetId, null);
    }

    public ErrorResponse(int status, String error, String message, String path, List<ValidationError> validationErrors) {
        this(status, error, message, path, Instant.now(), null, validationErrors);
    }

    /**
     * Individual field validation error.
     */
    @Schema(description = "Field-level validation error")
    public record ValidationError(
        @Schema(description = "Parameter that failed validation", example = "start_date")
        String field,

        @Schema(description = "Rejected value", example = "2023-13-01")
        String rejectedValue,

        @Schema(description = "Validation error message", example = "Invalid date format. Use YYYY-MM-DD.")
        String message
    ) {}
}
