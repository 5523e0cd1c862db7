package com.fintech.metals.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Statistics over a session-clipped, minute-collapsed price series.
 *
 * <p>When {@code count == 0} every numeric field is zero; callers must look at
 * {@link #count()} to tell "no data" apart from a zero price.
 *
 * @param count Number of points after collapsing duplicate minutes
 * @param min Lowest price
 * @param max Highest price
 * @param avg Arithmetic mean price
 * @param first Earliest price in the window
 * @param last Latest price in the window
 * @param delta {@code last - first}
 * @param deltaPercent {@code delta / first * 100}, zero when {@code first == 0}
 * @param rangeStart Start of the queried window (the requested range, or the effective session), inclusive
 * @param rangeEnd End of the queried window, exclusive; points outside trading hours are dropped, the bounds are not narrowed
 */
public record AggregateResult(
    int count,
    BigDecimal min,
    BigDecimal max,
    BigDecimal avg,
    BigDecimal first,
    BigDecimal last,
    BigDecimal delta,
    BigDecimal deltaPercent,
    Instant rangeStart,
    Instant rangeEnd
) {

    public static AggregateResult empty(Instant rangeStart, Instant rangeEnd) {
        BigDecimal zero = BigDecimal.ZERO;
        return new AggregateResult(0, zero, zero, zero, zero, zero, zero, zero, rangeStart, rangeEnd);
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
