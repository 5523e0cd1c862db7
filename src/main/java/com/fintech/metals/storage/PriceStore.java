package com.fintech.metals.storage;

import com.fintech.metals.domain.ContractRoll;
import com.fintech.metals.domain.QuoteSnapshot;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for quote snapshots.
 *
 * Two write regimes are kept apart: history is append-only (rows are never
 * updated), while the daily table keeps one row per instrument, contract month
 * and trade date, replaced by the newest write.
 *
 * All methods throw {@link StoreException} when the backing store fails.
 */
public interface PriceStore {

    /**
     * Writes the whole batch in one transaction.
     *
     * @return Snapshots appended to history, in input order
     */
    List<QuoteSnapshot> persist(PersistBatch batch);

    /**
     * Finds the most recent history row from {@code source} for the same series whose
     * price, delta and percent equal the given (already scaled) values and whose
     * observation time lies in {@code (from, to]}.
     */
    Optional<QuoteSnapshot> findRecentMatch(
        String source,
        String instrument,
        String contractMonth,
        BigDecimal price,
        BigDecimal delta,
        BigDecimal deltaPercent,
        Instant from,
        Instant to
    );

    /**
     * Returns history rows observed in {@code [from, to)}, ordered by observation time
     * and then insertion order.
     */
    List<QuoteSnapshot> findRange(String instrument, String contractMonth, Instant from, Instant to);

    /** Most recent history row of one series. */
    Optional<QuoteSnapshot> findLatest(String instrument, String contractMonth);

    /** Most recent history row per contract month of an instrument, ordered by label. */
    List<QuoteSnapshot> latest(String instrument);

    /** Daily rows of an instrument for one trade date. */
    List<QuoteSnapshot> findDaily(String instrument, LocalDate tradeDate);

    Optional<ContractRoll> findRoll(String instrument);

    long count();

    boolean isHealthy();
}
