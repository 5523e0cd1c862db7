package com.fintech.metals.ingestion;

import com.fintech.metals.domain.QuoteSnapshot;
import com.fintech.metals.domain.SeriesFamily;
import com.fintech.metals.storage.PriceStore;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Lookback-window duplicate suppression for the append-only history.
 *
 * <p>A candidate is a duplicate when a stored row from the same source and series has
 * equal price, delta and percent at two decimal places, and was observed less than the
 * lookback before the candidate. Any such row matches, not only the most recent one. A row
 * exactly one lookback old no longer counts.
 *
 * <p>{@link #admit(List)} lets supplier running totals through unchecked: each one is a
 * newer update already, and dropping it would lose its change from every later total.
 */
public class DedupGate {

    private final PriceStore priceStore;
    private final Duration lookback;

    public DedupGate(PriceStore priceStore, Duration lookback) {
        this.priceStore = Objects.requireNonNull(priceStore, "Price store cannot be null");
        if (lookback == null || lookback.isNegative() || lookback.isZero()) {
            throw new IllegalArgumentException("Dedup lookback must be positive");
        }
        this.lookback = lookback;
    }

    /**
     * Outcome of gating a batch.
     *
     * @param fresh Candidates to append
     * @param duplicates Already stored rows matched by the suppressed candidates
     */
    public record Admission(List<QuoteSnapshot> fresh, List<QuoteSnapshot> duplicates) {
    }

    public boolean isDuplicate(QuoteSnapshot candidate) {
        return findDuplicate(candidate).isPresent();
    }

    /**
     * Returns the stored row that makes {@code candidate} a duplicate, if any.
     */
    public Optional<QuoteSnapshot> findDuplicate(QuoteSnapshot candidate) {
        QuoteSnapshot normalized = candidate.normalized();
        Instant to = normalized.observedAt();
        return priceStore.findRecentMatch(
            normalized.source(),
            normalized.instrument(),
            normalized.contractMonth(),
            normalized.price(),
            normalized.delta(),
            normalized.deltaPercent(),
            to.minus(lookback),
            to
        );
    }

    public Admission admit(List<QuoteSnapshot> candidates) {
        List<QuoteSnapshot> fresh = new ArrayList<>(candidates.size());
        List<QuoteSnapshot> duplicates = new ArrayList<>();
        for (QuoteSnapshot candidate : candidates) {
            if (candidate.family() == SeriesFamily.SUPPLIER) {
                fresh.add(candidate.normalized());
                continue;
            }
            Optional<QuoteSnapshot> existing = findDuplicate(candidate);
            if (existing.isPresent()) {
                duplicates.add(existing.get());
            } else {
                fresh.add(candidate.normalized());
            }
        }
        return new Admission(fresh, duplicates);
    }

    public Duration lookback() {
        return lookback;
    }
}
