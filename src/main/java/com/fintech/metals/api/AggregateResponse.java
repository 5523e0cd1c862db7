package com.fintech.metals.api;

import com.fintech.metals.aggregation.AggregationReport;
import com.fintech.metals.calendar.TradingCalendar;
import com.fintech.metals.domain.AggregateResult;
import com.fintech.metals.domain.PricePoint;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Chart-ready aggregate of one series.
 *
 * Example response:
 * {
 *   "success": true,
 *   "instrument": "mcx-aluminium",
 *   "contractMonth": "JAN25",
 *   "data": [{"time": "2025-01-10T03:35:00Z", "value": 241.00}],
 *   "stats": {"count": 1, "min": 241.00, ...},
 *   "tradingStatus": {"open": true, "reason": "in-session", ...},
 *   "cached": false
 * }
 */
@Schema(description = "Minute-collapsed price series with statistics")
public record AggregateResponse(
    @Schema(description = "Always true for a 200 response", example = "true")
    boolean success,

    @Schema(description = "Instrument name", example = "mcx-aluminium")
    String instrument,

    @Schema(description = "Resolved contract-month label", example = "JAN25")
    String contractMonth,

    @Schema(description = "One point per minute, oldest first")
    List<PricePoint> data,

    @Schema(description = "Statistics over the whole series, regardless of limit")
    AggregateResult stats,

    TradingStatusResponse tradingStatus,

    @Schema(description = "Explanation when data is empty", example = "No data for mcx-aluminium in the requested window")
    String message,

    @Schema(description = "True when served from the last good result because the store is unavailable", example = "false")
    boolean cached
) {

    public static AggregateResponse from(AggregationReport report, TradingCalendar calendar) {
        return new AggregateResponse(
            true,
            report.instrument(),
            report.contractMonth(),
            report.points(),
            report.stats(),
            TradingStatusResponse.from(report.tradingStatus(), calendar),
            report.message(),
            report.cached()
        );
    }
}
