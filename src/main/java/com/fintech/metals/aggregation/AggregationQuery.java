package com.fintech.metals.aggregation;

import com.fintech.metals.domain.MonthSlot;

import java.time.Instant;
import java.util.Objects;

/**
 * What to aggregate.
 *
 * @param instrument Instrument name
 * @param slot Contract-month slot; ignored for series without contract months
 * @param rangeStart Start of the window (inclusive), {@code null} for the effective session
 * @param rangeEnd End of the window (exclusive), {@code null} for the effective session
 * @param limit Maximum number of points returned; statistics always cover the whole series
 */
public record AggregationQuery(String instrument, MonthSlot slot, Instant rangeStart, Instant rangeEnd, int limit) {

    public AggregationQuery {
        Objects.requireNonNull(instrument, "Instrument cannot be null");
        slot = slot == null ? MonthSlot.CURRENT : slot;
        if ((rangeStart == null) != (rangeEnd == null)) {
            throw new IllegalArgumentException("rangeStart and rangeEnd must be given together");
        }
        if (rangeStart != null && !rangeEnd.isAfter(rangeStart)) {
            throw new IllegalArgumentException("rangeEnd must be after rangeStart");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }

    public boolean usesSessionDefault() {
        return rangeStart == null;
    }
}
