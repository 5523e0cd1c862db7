package com.fintech.metals.domain;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Latest-wins snapshot for one (instrument, contract month, trade date).
 *
 * @param tradeDate Trading date in the calendar timezone
 * @param snapshot Normalized snapshot that replaces any existing row for the day
 */
public record DailyQuote(LocalDate tradeDate, QuoteSnapshot snapshot) {

    public DailyQuote {
        Objects.requireNonNull(tradeDate, "Trade date cannot be null");
        Objects.requireNonNull(snapshot, "Snapshot cannot be null");
    }
}
