package com.fintech.marketmaking.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * Error body returned by the backtest API.
 * {@code security} is set when a single security's session or configuration caused the failure.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Why a backtest request was rejected or failed")
public record ErrorResponse(

    @Schema(description = "HTTP status code", example = "400")
    int status,

    @Schema(description = "Error code, e.g. SERVICE_VALIDATION_ERROR, INVALID_CONFIGURATION, BACKTEST_ERROR",
            example = "INVALID_CONFIGURATION")
    String error,

    @Schema(description = "Human-readable reason", example = "Spread must be in [0, 100) percent for EMAAR: 100.0")
    String message,

    @Schema(description = "Request path", example = "/api/v1/backtests")
    String path,

    @Schema(description = "Security whose session failed", example = "EMAAR")
    String security,

    @Schema(description = "When the error was produced", example = "2025-03-03T10:30:00Z")
    Instant timestamp,

    @Schema(description = "Rejected request fields, for body validation failures")
    List<FieldRejection> fieldRejections
) {

    public ErrorResponse(int status, String error, String message, String path) {
        this(status, error, message, path, null, Instant.now(), null);
    }

    public ErrorResponse(int status, String error, String message, String path, String security) {
        this(status, error, message, path, security, Instant.now(), null);
    }

    public ErrorResponse(int status, String error, String message, String path, List<FieldRejection> fieldRejections) {
        this(status, error, message, path, null, Instant.now(), fieldRejections);
    }

    /**
     * A request field that failed bean validation.
     */
    @Schema(description = "Request field that failed validation")
    public record FieldRejection(
        @Schema(description = "Field path", example = "events")
        String field,

        @Schema(description = "Rejected value", example = "{}")
        String rejectedValue,

        @Schema(description = "Constraint message", example = "At least one security with events is required")
        String message
    ) {}
}
