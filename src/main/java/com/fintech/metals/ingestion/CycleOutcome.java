package com.fintech.metals.ingestion;

import java.time.Instant;

/**
 * Result of one feed within one ingestion cycle.
 *
 * @param feed Feed name, or {@code "*"} when the whole cycle was skipped
 * @param status What happened
 * @param inserted Rows appended to history
 * @param duplicates Candidates suppressed as consecutive duplicates
 * @param dailyUpserts Same-day rows written or replaced
 * @param message Human-readable detail (reason for skip or error)
 * @param completedAt When the outcome was decided
 */
public record CycleOutcome(
    String feed,
    Status status,
    int inserted,
    int duplicates,
    int dailyUpserts,
    String message,
    Instant completedAt
) {

    public static final String ALL_FEEDS = "*";

    public enum Status {
        PERSISTED(false),
        DUPLICATE_SKIPPED(false),
        NO_DATA(false),
        CALENDAR_BLOCKED(false),
        BUSY(false),
        FETCH_TIMEOUT(true),
        FETCH_ERROR(true),
        PARSE_ERROR(true),
        STORE_ERROR(true);

        private final boolean failure;

        Status(boolean failure) {
            this.failure = failure;
        }

        public boolean isFailure() {
            return failure;
        }
    }

    public static CycleOutcome failed(String feed, Status status, String message, Instant at) {
        return new CycleOutcome(feed, status, 0, 0, 0, message, at);
    }

    public static CycleOutcome skipped(Status status, String reason, Instant at) {
        return new CycleOutcome(ALL_FEEDS, status, 0, 0, 0, reason, at);
    }

    public boolean isFailure() {
        return status.isFailure();
    }
}
