package com.fintech.metals.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Objects;

/**
 * One observation of an instrument at a point in time.
 *
 * <p>Numeric fields may be {@code null} straight out of the parser: an absent value means
 * "unknown", which is different from a true zero price. {@link #normalized()} is the single
 * place where that policy is decided.
 *
 * @param family Instrument family the snapshot belongs to
 * @param instrument Stable instrument name (e.g. "mcx-aluminium")
 * @param contractMonth Contract-month label (e.g. "JAN25"), or {@link #NO_CONTRACT} for non-futures series
 * @param observedAt Upstream-reported observation time, or ingestion time as fallback
 * @param price Quoted price, {@code null} if unknown
 * @param delta Signed change against the reference price, {@code null} if unknown
 * @param deltaPercent Signed change in percent, {@code null} if unknown
 * @param source Provenance tag of the process that produced the snapshot
 */
public record QuoteSnapshot(
    SeriesFamily family,
    String instrument,
    String contractMonth,
    Instant observedAt,
    BigDecimal price,
    BigDecimal delta,
    BigDecimal deltaPercent,
    String source
) {

    /** Label used for series that have no contract month. */
    public static final String NO_CONTRACT = "SPOT";

    /** Decimal places every stored numeric value is rounded to. */
    public static final int SCALE = 2;

    public QuoteSnapshot {
        Objects.requireNonNull(family, "Family cannot be null");
        Objects.requireNonNull(instrument, "Instrument cannot be null");
        Objects.requireNonNull(observedAt, "Observation time cannot be null");
        Objects.requireNonNull(source, "Source cannot be null");
        if (contractMonth == null || contractMonth.isBlank()) {
            contractMonth = NO_CONTRACT;
        }
    }

    /** Returns the natural instrument key, e.g. "mcx-aluminium:JAN25". */
    public String instrumentKey() {
        return instrument + ":" + contractMonth;
    }

    public boolean hasPrice() {
        return price != null;
    }

    /**
     * Returns a copy with every numeric field rounded to {@link #SCALE} places and absent
     * deltas replaced by zero.
     *
     * @throws IllegalStateException if the price is unknown
     */
    public QuoteSnapshot normalized() {
        if (price == null) {
            throw new IllegalStateException("Cannot normalize snapshot without a price: " + instrumentKey());
        }
        return new QuoteSnapshot(
            family,
            instrument,
            contractMonth,
            observedAt,
            scale(price),
            scale(orZero(delta)),
            scale(orZero(deltaPercent)),
            source
        );
    }

    public QuoteSnapshot withPrice(BigDecimal newPrice) {
        return new QuoteSnapshot(family, instrument, contractMonth, observedAt, newPrice, delta, deltaPercent, source);
    }

    /** Rounds to the storage scale with HALF_UP. */
    public static BigDecimal scale(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
