package com.fintech.metals.ingestion;

import com.fintech.metals.domain.QuoteSnapshot;
import com.fintech.metals.domain.SeriesFamily;
import com.fintech.metals.storage.InMemoryPriceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.fintech.metals.TestFixtures.spot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DedupGate Tests")
class DedupGateTest {

    private static final Instant T0 = Instant.parse("2025-01-10T05:00:00Z");
    private static final Duration LOOKBACK = Duration.ofMinutes(5);

    private InMemoryPriceStore store;
    private DedupGate gate;

    @BeforeEach
    void setUp() {
        store = new InMemoryPriceStore();
        gate = new DedupGate(store, LOOKBACK);
    }

    @Test
    @DisplayName("Equal values inside the lookback are duplicates")
    void duplicateInsideLookback() {
        store.seed(spot("spot-aluminium", T0, "240.00"));

        assertThat(gate.isDuplicate(spot("spot-aluminium", T0.plusSeconds(60), "240.00"))).isTrue();
    }

    @Test
    @DisplayName("A row exactly one lookback old no longer suppresses")
    void boundaryIsNotDuplicate() {
        store.seed(spot("spot-aluminium", T0, "240.00"));

        assertThat(gate.isDuplicate(spot("spot-aluminium", T0.plus(LOOKBACK).minusMillis(1), "240.00"))).isTrue();
        assertThat(gate.isDuplicate(spot("spot-aluminium", T0.plus(LOOKBACK), "240.00"))).isFalse();
    }

    @Test
    @DisplayName("Values equal at two decimal places are duplicates")
    void comparesAtTwoDecimals() {
        store.seed(spot("spot-aluminium", T0, "240.001"));

        assertThat(gate.isDuplicate(spot("spot-aluminium", T0.plusSeconds(30), "240.004"))).isTrue();
        assertThat(gate.isDuplicate(spot("spot-aluminium", T0.plusSeconds(30), "240.01"))).isFalse();
    }

    @Test
    @DisplayName("A different change pair makes the candidate new")
    void differentDeltaIsNew() {
        store.seed(spot("spot-aluminium", T0, "240.00"));
        QuoteSnapshot moved = new QuoteSnapshot(SeriesFamily.SPOT, "spot-aluminium", null, T0.plusSeconds(60),
            new BigDecimal("240.00"), new BigDecimal("0.50"), new BigDecimal("0.21"), "scheduled-poll");

        assertThat(gate.isDuplicate(moved)).isFalse();
    }

    @Test
    @DisplayName("Only rows from the same source count")
    void scopedBySource() {
        store.seed(new QuoteSnapshot(SeriesFamily.SPOT, "spot-aluminium", null, T0,
            new BigDecimal("240.00"), BigDecimal.ZERO, BigDecimal.ZERO, "manual-import"));

        assertThat(gate.isDuplicate(spot("spot-aluminium", T0.plusSeconds(60), "240.00"))).isFalse();
    }

    @Test
    @DisplayName("admit splits fresh candidates from duplicates and returns the stored match")
    void admitReturnsExisting() {
        QuoteSnapshot stored = spot("spot-aluminium", T0, "240.00").normalized();
        store.seed(stored);

        DedupGate.Admission admission = gate.admit(List.of(
            spot("spot-aluminium", T0.plusSeconds(60), "240.00"),
            spot("spot-copper", T0.plusSeconds(60), "810.00")
        ));

        assertThat(admission.duplicates()).containsExactly(stored);
        assertThat(admission.fresh()).extracting(QuoteSnapshot::instrument).containsExactly("spot-copper");
    }

    @Test
    @DisplayName("Lookback must be positive")
    void rejectsZeroLookback() {
        assertThatThrownBy(() -> new DedupGate(store, Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Supplier running totals are admitted even when an equal row is stored")
    void admitsSupplierTotals() {
        QuoteSnapshot earlier = new QuoteSnapshot(SeriesFamily.SUPPLIER, "Hindalco", null, T0,
            new BigDecimal("105.00"), new BigDecimal("5.00"), new BigDecimal("5.00"), "scheduled-poll");
        store.seed(earlier);
        QuoteSnapshot revisited = new QuoteSnapshot(SeriesFamily.SUPPLIER, "Hindalco", null, T0.plusSeconds(120),
            new BigDecimal("105.00"), new BigDecimal("5.00"), new BigDecimal("5.00"), "scheduled-poll");

        DedupGate.Admission admission = gate.admit(List.of(revisited));

        assertThat(admission.fresh()).containsExactly(revisited.normalized());
        assertThat(admission.duplicates()).isEmpty();
    }
}
