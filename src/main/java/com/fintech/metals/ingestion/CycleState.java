package com.fintech.metals.ingestion;

/**
 * Where the ingestion loop currently is. Exposed for status reporting.
 */
public enum CycleState {
    IDLE,
    CHECKING_CALENDAR,
    SKIPPED,
    FETCHING,
    PARSING,
    GATING,
    PERSISTING
}
