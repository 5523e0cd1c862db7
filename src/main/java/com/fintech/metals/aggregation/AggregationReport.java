package com.fintech.metals.aggregation;

import com.fintech.metals.calendar.TradingStatus;
import com.fintech.metals.domain.AggregateResult;
import com.fintech.metals.domain.PricePoint;

import java.util.List;

/**
 * Aggregated view of one series over one window.
 *
 * @param instrument Instrument name
 * @param contractMonth Resolved contract-month label, {@code null} if the slot is empty
 * @param points Minute-collapsed series, truncated to the most recent {@code limit} points
 * @param stats Statistics over the full collapsed series
 * @param tradingStatus Market state at request time
 * @param message Explanation when there is nothing to show
 * @param cached True when served from the last good result instead of the store
 */
public record AggregationReport(
    String instrument,
    String contractMonth,
    List<PricePoint> points,
    AggregateResult stats,
    TradingStatus tradingStatus,
    String message,
    boolean cached
) {

    public AggregationReport {
        points = List.copyOf(points);
    }

    public AggregationReport asCached() {
        return new AggregationReport(instrument, contractMonth, points, stats, tradingStatus, message, true);
    }
}
