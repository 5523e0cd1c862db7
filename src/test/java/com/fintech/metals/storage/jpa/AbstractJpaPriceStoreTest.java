package com.fintech.metals.storage.jpa;

import com.fintech.metals.domain.ContractRoll;
import com.fintech.metals.domain.DailyQuote;
import com.fintech.metals.domain.QuoteSnapshot;
import com.fintech.metals.domain.SeriesFamily;
import com.fintech.metals.storage.PersistBatch;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.fintech.metals.TestFixtures.FRIDAY;
import static com.fintech.metals.TestFixtures.SOURCE;
import static com.fintech.metals.TestFixtures.contract;
import static com.fintech.metals.TestFixtures.ist;
import static com.fintech.metals.TestFixtures.spot;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Behaviour shared by every database the JPA store runs on.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ActiveProfiles("test")
abstract class AbstractJpaPriceStoreTest {

    private static final String MCX = "mcx-aluminium";
    private static final String SPOT = "spot-aluminium";

    @Autowired
    private QuoteSnapshotJpaRepository snapshotRepository;

    @Autowired
    private DailyQuoteJpaRepository dailyRepository;

    @Autowired
    private ContractRollJpaRepository rollRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    private JpaPriceStore store;

    @BeforeEach
    void setUp() {
        snapshotRepository.deleteAll();
        dailyRepository.deleteAll();
        rollRepository.deleteAll();
        store = new JpaPriceStore(snapshotRepository, dailyRepository, rollRepository, transactionManager,
            new SimpleMeterRegistry());
    }

    private static PersistBatch appends(QuoteSnapshot... snapshots) {
        return new PersistBatch(List.of(snapshots), List.of(), null);
    }

    @Test
    @DisplayName("Should append snapshots and read them back in observation order")
    void appendAndRange() {
        store.persist(appends(
            spot(SPOT, ist(FRIDAY, 10, 2), "242").normalized(),
            spot(SPOT, ist(FRIDAY, 10, 0), "240").normalized(),
            spot(SPOT, ist(FRIDAY, 10, 1), "241").normalized()));

        List<QuoteSnapshot> range = store.findRange(SPOT, QuoteSnapshot.NO_CONTRACT, ist(FRIDAY, 10, 0), ist(FRIDAY, 10, 2));

        assertThat(range).extracting(QuoteSnapshot::observedAt)
            .containsExactly(ist(FRIDAY, 10, 0), ist(FRIDAY, 10, 1));
        assertThat(range.get(0).price()).isEqualByComparingTo("240");
        assertThat(range.get(0).family()).isEqualTo(SeriesFamily.SPOT);
        assertThat(store.count()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should find a matching row only inside the lookback window")
    void recentMatchWindow() {
        QuoteSnapshot stored = spot(SPOT, ist(FRIDAY, 10, 0), "240.5").normalized();
        store.persist(appends(stored));
        BigDecimal price = new BigDecimal("240.50");

        Optional<QuoteSnapshot> inside = store.findRecentMatch(SOURCE, SPOT, QuoteSnapshot.NO_CONTRACT,
            price, stored.delta(), stored.deltaPercent(), ist(FRIDAY, 9, 58), ist(FRIDAY, 10, 3));
        Optional<QuoteSnapshot> lowerBoundExcluded = store.findRecentMatch(SOURCE, SPOT, QuoteSnapshot.NO_CONTRACT,
            price, stored.delta(), stored.deltaPercent(), ist(FRIDAY, 10, 0), ist(FRIDAY, 10, 5));
        Optional<QuoteSnapshot> otherPrice = store.findRecentMatch(SOURCE, SPOT, QuoteSnapshot.NO_CONTRACT,
            new BigDecimal("240.51"), stored.delta(), stored.deltaPercent(), ist(FRIDAY, 9, 58), ist(FRIDAY, 10, 3));

        assertThat(inside).isPresent();
        assertThat(lowerBoundExcluded).isEmpty();
        assertThat(otherPrice).isEmpty();
    }

    @Test
    @DisplayName("Should keep one daily row per contract month and replace it on re-upsert")
    void dailyUpsertReplaces() {
        QuoteSnapshot morning = contract(MCX, "JAN25", ist(FRIDAY, 10, 0), "241").normalized();
        QuoteSnapshot evening = contract(MCX, "JAN25", ist(FRIDAY, 18, 0), "245").normalized();

        store.persist(new PersistBatch(List.of(), List.of(new DailyQuote(FRIDAY, morning)), null));
        store.persist(new PersistBatch(List.of(), List.of(new DailyQuote(FRIDAY, evening)), null));

        List<QuoteSnapshot> daily = store.findDaily(MCX, FRIDAY);
        assertThat(daily).hasSize(1);
        assertThat(daily.get(0).price()).isEqualByComparingTo("245");
        assertThat(daily.get(0).observedAt()).isEqualTo(ist(FRIDAY, 18, 0));
        assertThat(store.findDaily(MCX, FRIDAY.minusDays(1))).isEmpty();
    }

    @Test
    @DisplayName("Should store and replace the contract roll")
    void rollRoundTrip() {
        store.persist(new PersistBatch(List.of(), List.of(),
            new ContractRoll(MCX, List.of("JAN25", "FEB25", "MAR25"), ist(FRIDAY, 10, 0))));
        store.persist(new PersistBatch(List.of(), List.of(),
            new ContractRoll(MCX, List.of("FEB25", "MAR25"), ist(FRIDAY, 11, 0))));

        Optional<ContractRoll> roll = store.findRoll(MCX);

        assertThat(roll).isPresent();
        assertThat(roll.get().labels()).containsExactly("FEB25", "MAR25");
        assertThat(roll.get().updatedAt()).isEqualTo(ist(FRIDAY, 11, 0));
    }

    @Test
    @DisplayName("Should return the newest row per contract month in calendar order")
    void latestPerMonth() {
        store.persist(appends(
            contract(MCX, "FEB25", ist(FRIDAY, 10, 0), "243").normalized(),
            contract(MCX, "JAN25", ist(FRIDAY, 10, 0), "240").normalized(),
            contract(MCX, "JAN25", ist(FRIDAY, 10, 5), "241").normalized()));

        List<QuoteSnapshot> latest = store.latest(MCX);

        assertThat(latest).extracting(QuoteSnapshot::contractMonth).containsExactly("JAN25", "FEB25");
        assertThat(latest.get(0).price()).isEqualByComparingTo("241");
        assertThat(store.findLatest(MCX, "JAN25")).map(QuoteSnapshot::observedAt).contains(ist(FRIDAY, 10, 5));
    }

    @Test
    @DisplayName("Empty batch is a no-op")
    void emptyBatch() {
        assertThat(store.persist(new PersistBatch(List.of(), List.of(), null))).isEmpty();
        assertThat(store.count()).isZero();
        assertThat(store.isHealthy()).isTrue();
    }

    @Test
    @DisplayName("Instants survive the round trip exactly")
    void instantPrecision() {
        Instant at = ist(FRIDAY, 10, 0, 42);
        store.persist(appends(spot(SPOT, at, "240").normalized()));

        assertThat(store.findLatest(SPOT, QuoteSnapshot.NO_CONTRACT)).map(QuoteSnapshot::observedAt).contains(at);
    }
}
