package com.fintech.metals.ingestion;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of the ingestion loop.
 *
 * @param enabled Whether background polling is switched on
 * @param state Current step of the loop
 * @param lastAttemptAt Start of the most recent cycle, {@code null} before the first one
 * @param nextRunAt When the next background cycle is due, {@code null} if none is scheduled
 * @param consecutiveFailures Cycles in a row in which at least one feed failed
 * @param lastOutcomes Per-feed outcomes of the most recent cycle
 */
public record SchedulerStatus(
    boolean enabled,
    CycleState state,
    Instant lastAttemptAt,
    Instant nextRunAt,
    int consecutiveFailures,
    List<CycleOutcome> lastOutcomes
) {
}
