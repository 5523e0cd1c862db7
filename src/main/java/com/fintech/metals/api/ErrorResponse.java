package com.fintech.metals.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;

/**
 * Error body shared by every endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Error response with details about the failure")
public record ErrorResponse(

    @Schema(description = "Always false", example = "false")
    boolean success,

    @Schema(description = "HTTP status code", example = "400")
    int status,

    @Schema(description = "Error category", example = "VALIDATION_ERROR")
    String error,

    @Schema(description = "Human-readable error message", example = "Unsupported month 'fourth'. Allowed: current, next, third")
    String message,

    @Schema(description = "Request path that caused the error", example = "/api/v1/aggregates")
    String path,

    @Schema(description = "Timestamp of the error", example = "2025-01-10T05:00:00Z")
    Instant timestamp,

    @Schema(description = "True when the same request may succeed later (store or upstream unavailable)", example = "false")
    boolean retryable,

    @Schema(description = "Field-level problems, if any")
    List<FieldProblem> fieldProblems
) {

    public static ErrorResponse of(HttpStatus status, String error, String message, String path) {
        return new ErrorResponse(false, status.value(), error, message, path, Instant.now(),
            status == HttpStatus.SERVICE_UNAVAILABLE, null);
    }

    public static ErrorResponse withProblems(HttpStatus status, String error, String message, String path,
                                             List<FieldProblem> problems) {
        return new ErrorResponse(false, status.value(), error, message, path, Instant.now(), false, problems);
    }

    @Schema(description = "One rejected request parameter")
    public record FieldProblem(
        @Schema(example = "month")
        String field,

        @Schema(example = "fourth")
        String rejectedValue,

        @Schema(example = "Allowed: current, next, third")
        String message
    ) {}
}
