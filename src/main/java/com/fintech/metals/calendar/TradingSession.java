package com.fintech.metals.calendar;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Trading session of one calendar date. Derived from the calendar policy, never stored.
 *
 * <p>The window is half-open: {@code start} is inside the session, {@code end} is the
 * first instant after it. Every query that clips by session uses this same rule.
 *
 * @param date Trading date in the calendar timezone
 * @param start First instant of the session (inclusive)
 * @param end First instant after the session (exclusive)
 */
public record TradingSession(LocalDate date, Instant start, Instant end) {

    /** Returns true if {@code instant} lies inside {@code [start, end)}. */
    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public boolean isOpen(Instant now) {
        return contains(now);
    }
}
