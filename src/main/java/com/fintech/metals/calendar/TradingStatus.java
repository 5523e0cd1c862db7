package com.fintech.metals.calendar;

import java.time.Instant;

/**
 * Answer to "is ingestion permitted now", with a human-readable reason.
 *
 * @param allowed Whether the instant is inside a trading session
 * @param reason One of {@link #IN_SESSION}, {@link #WEEKEND}, {@link #HOLIDAY}, {@link #OUTSIDE_HOURS}
 * @param checkedAt Instant the decision was made for
 */
public record TradingStatus(boolean allowed, String reason, Instant checkedAt) {

    public static final String IN_SESSION = "in-session";
    public static final String WEEKEND = "weekend";
    public static final String HOLIDAY = "holiday";
    public static final String OUTSIDE_HOURS = "outside-hours";

    static TradingStatus open(Instant now) {
        return new TradingStatus(true, IN_SESSION, now);
    }

    static TradingStatus closed(String reason, Instant now) {
        return new TradingStatus(false, reason, now);
    }
}
