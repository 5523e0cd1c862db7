package com.fintech.metals.api;

import com.fintech.metals.ingestion.CycleOutcome;
import com.fintech.metals.ingestion.SchedulerStatus;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * State of the ingestion loop.
 */
@Schema(description = "Ingestion loop state and the outcome of its most recent cycle")
public record IngestionStatusResponse(
    @Schema(example = "true")
    boolean enabled,
    @Schema(description = "Current step of the loop", example = "IDLE")
    String state,
    Instant lastAttemptAt,
    Instant nextRunAt,
    @Schema(example = "0")
    int consecutiveFailures,
    @Schema(description = "Configured feed names")
    List<String> feeds,
    List<CycleOutcome> lastOutcomes
) {

    public static IngestionStatusResponse from(SchedulerStatus status, List<String> feeds) {
        return new IngestionStatusResponse(
            status.enabled(),
            status.state().name(),
            status.lastAttemptAt(),
            status.nextRunAt(),
            status.consecutiveFailures(),
            feeds,
            status.lastOutcomes()
        );
    }
}
