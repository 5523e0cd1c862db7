package com.fintech.metals.api;

import com.fintech.metals.calendar.TradingCalendar;
import com.fintech.metals.calendar.TradingStatus;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

/**
 * Market state as reported to API clients.
 */
@Schema(description = "Whether the market is open for ingestion right now")
public record TradingStatusResponse(
    @Schema(description = "True while inside a trading session", example = "true")
    boolean open,

    @Schema(description = "in-session, weekend, holiday or outside-hours", example = "in-session")
    String reason,

    @Schema(description = "Session hours and timezone", example = "09:00 - 23:30 Asia/Kolkata")
    String hours,

    @Schema(description = "Instant the status was evaluated for", example = "2025-01-10T05:00:00Z")
    Instant checkedAt
) {

    public static TradingStatusResponse from(TradingStatus status, TradingCalendar calendar) {
        return new TradingStatusResponse(status.allowed(), status.reason(), calendar.describeHours(), status.checkedAt());
    }
}
