package com.fintech.metals.storage.jpa;

import com.fintech.metals.domain.ContractMonth;
import com.fintech.metals.domain.ContractRoll;
import com.fintech.metals.domain.DailyQuote;
import com.fintech.metals.domain.QuoteSnapshot;
import com.fintech.metals.domain.SeriesFamily;
import com.fintech.metals.storage.PersistBatch;
import com.fintech.metals.storage.PriceStore;
import com.fintech.metals.storage.StoreException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Relational implementation of {@link PriceStore} on Spring Data JPA.
 *
 * Writes run through a {@link TransactionTemplate} rather than {@code @Transactional}
 * so that commit-time failures and transaction timeouts are reported as
 * {@link StoreException} like any other write error.
 */
@Repository
public class JpaPriceStore implements PriceStore {

    private static final Logger log = LoggerFactory.getLogger(JpaPriceStore.class);

    static final int TRANSACTION_TIMEOUT_SECONDS = 5;

    private final QuoteSnapshotJpaRepository snapshots;
    private final DailyQuoteJpaRepository dailyQuotes;
    private final ContractRollJpaRepository rolls;
    private final TransactionTemplate writeTransaction;

    private final Timer writeTimer;
    private final Timer readTimer;
    private final Counter writeErrors;
    private final Counter readErrors;

    public JpaPriceStore(
            QuoteSnapshotJpaRepository snapshots,
            DailyQuoteJpaRepository dailyQuotes,
            ContractRollJpaRepository rolls,
            PlatformTransactionManager transactionManager,
            MeterRegistry meterRegistry) {
        this.snapshots = snapshots;
        this.dailyQuotes = dailyQuotes;
        this.rolls = rolls;

        this.writeTransaction = new TransactionTemplate(transactionManager);
        this.writeTransaction.setTimeout(TRANSACTION_TIMEOUT_SECONDS);

        this.writeTimer = meterRegistry.timer("store.write.latency");
        this.readTimer = meterRegistry.timer("store.read.latency");
        this.writeErrors = meterRegistry.counter("store.errors", "operation", "write");
        this.readErrors = meterRegistry.counter("store.errors", "operation", "read");

        log.info("JPA price store initialized");
    }

    @Override
    public List<QuoteSnapshot> persist(PersistBatch batch) {
        if (batch.isEmpty()) {
            return List.of();
        }
        return writeTimer.record(() -> {
            try {
                List<QuoteSnapshot> appended = writeTransaction.execute(status -> {
                    List<QuoteSnapshot> saved = new ArrayList<>(batch.appends().size());
                    for (QuoteSnapshot snapshot : batch.appends()) {
                        saved.add(fromEntity(snapshots.save(toEntity(snapshot))));
                    }
                    for (DailyQuote daily : batch.dailyUpserts()) {
                        upsertDaily(daily);
                    }
                    batch.rollChange().ifPresent(this::saveRoll);
                    return saved;
                });

                if (log.isDebugEnabled()) {
                    log.debug("Persisted batch: appended={}, dailyUpserts={}, rollChanged={}",
                             batch.appends().size(), batch.dailyUpserts().size(), batch.roll() != null);
                }
                return appended;
            } catch (RuntimeException e) {
                writeErrors.increment();
                log.error("Failed to persist batch: appends={}, dailyUpserts={}",
                         batch.appends().size(), batch.dailyUpserts().size(), e);
                throw new StoreException("Price store write failed", e);
            }
        });
    }

    @Override
    public Optional<QuoteSnapshot> findRecentMatch(
            String source,
            String instrument,
            String contractMonth,
            BigDecimal price,
            BigDecimal delta,
            BigDecimal deltaPercent,
            Instant from,
            Instant to) {
        return read("findRecentMatch " + instrument + ":" + contractMonth, () ->
            snapshots.findMatches(source, instrument, contractMonth, price, delta, deltaPercent,
                                  from, to, PageRequest.of(0, 1))
                .stream()
                .findFirst()
                .map(this::fromEntity));
    }

    @Override
    public List<QuoteSnapshot> findRange(String instrument, String contractMonth, Instant from, Instant to) {
        return read("findRange " + instrument + ":" + contractMonth, () -> {
            List<QuoteSnapshotEntity> entities = snapshots.findByRange(instrument, contractMonth, from, to);
            if (log.isDebugEnabled()) {
                log.debug("Range query: series={}:{}, from={}, to={}, results={}",
                         instrument, contractMonth, from, to, entities.size());
            }
            return entities.stream().map(this::fromEntity).toList();
        });
    }

    @Override
    public Optional<QuoteSnapshot> findLatest(String instrument, String contractMonth) {
        return read("findLatest " + instrument + ":" + contractMonth, () ->
            snapshots.findFirstByInstrumentAndContractMonthOrderByObservedAtDescIdDesc(instrument, contractMonth)
                .map(this::fromEntity));
    }

    @Override
    public List<QuoteSnapshot> latest(String instrument) {
        return read("latest " + instrument, () -> {
            // several rows can share the max observation time; the last inserted wins
            Map<String, QuoteSnapshot> byMonth = new LinkedHashMap<>();
            for (QuoteSnapshotEntity entity : snapshots.findLatestPerContractMonth(instrument)) {
                byMonth.put(entity.getContractMonth(), fromEntity(entity));
            }
            return byMonth.values().stream()
                .sorted(Comparator.comparing(s -> ContractMonth.parse(s.contractMonth()), ContractMonth.CHRONOLOGICAL))
                .toList();
        });
    }

    @Override
    public List<QuoteSnapshot> findDaily(String instrument, LocalDate tradeDate) {
        return read("findDaily " + instrument, () ->
            dailyQuotes.findByInstrumentAndTradeDateOrderByContractMonthAsc(instrument, tradeDate).stream()
                .map(this::fromDailyEntity)
                .sorted(Comparator.comparing(s -> ContractMonth.parse(s.contractMonth()), ContractMonth.CHRONOLOGICAL))
                .toList());
    }

    @Override
    public Optional<ContractRoll> findRoll(String instrument) {
        return read("findRoll " + instrument, () -> rolls.findById(instrument).map(this::fromRollEntity));
    }

    @Override
    public long count() {
        return read("count", snapshots::count);
    }

    @Override
    public boolean isHealthy() {
        try {
            snapshots.count();
            return true;
        } catch (RuntimeException e) {
            log.error("Price store health check failed", e);
            return false;
        }
    }

    private <T> T read(String operation, Supplier<T> query) {
        return readTimer.record(() -> {
            try {
                return query.get();
            } catch (RuntimeException e) {
                readErrors.increment();
                log.error("Price store read failed: {}", operation, e);
                throw new StoreException("Price store read failed: " + operation, e);
            }
        });
    }

    private void upsertDaily(DailyQuote daily) {
        QuoteSnapshot snapshot = daily.snapshot();
        DailyQuoteEntity entity = dailyQuotes
            .findByInstrumentAndContractMonthAndTradeDate(snapshot.instrument(), snapshot.contractMonth(), daily.tradeDate())
            .orElseGet(() -> DailyQuoteEntity.builder()
                .instrument(snapshot.instrument())
                .contractMonth(snapshot.contractMonth())
                .tradeDate(daily.tradeDate())
                .build());

        entity.setFamily(snapshot.family().name());
        entity.setObservedAt(snapshot.observedAt());
        entity.setPrice(snapshot.price());
        entity.setDelta(snapshot.delta());
        entity.setDeltaPercent(snapshot.deltaPercent());
        entity.setSource(snapshot.source());
        dailyQuotes.save(entity);
    }

    private void saveRoll(ContractRoll roll) {
        List<String> labels = roll.labels();
        rolls.save(ContractRollEntity.builder()
            .instrument(roll.instrument())
            .month1Label(labels.size() > 0 ? labels.get(0) : null)
            .month2Label(labels.size() > 1 ? labels.get(1) : null)
            .month3Label(labels.size() > 2 ? labels.get(2) : null)
            .updatedAt(roll.updatedAt())
            .build());
        log.info("Contract roll updated: instrument={}, labels={}", roll.instrument(), labels);
    }

    private QuoteSnapshotEntity toEntity(QuoteSnapshot snapshot) {
        return QuoteSnapshotEntity.builder()
            .family(snapshot.family().name())
            .instrument(snapshot.instrument())
            .contractMonth(snapshot.contractMonth())
            .observedAt(snapshot.observedAt())
            .price(snapshot.price())
            .delta(snapshot.delta())
            .deltaPercent(snapshot.deltaPercent())
            .source(snapshot.source())
            .build();
    }

    private QuoteSnapshot fromEntity(QuoteSnapshotEntity entity) {
        return new QuoteSnapshot(
            SeriesFamily.valueOf(entity.getFamily()),
            entity.getInstrument(),
            entity.getContractMonth(),
            entity.getObservedAt(),
            entity.getPrice(),
            entity.getDelta(),
            entity.getDeltaPercent(),
            entity.getSource()
        );
    }

    private QuoteSnapshot fromDailyEntity(DailyQuoteEntity entity) {
        return new QuoteSnapshot(
            SeriesFamily.valueOf(entity.getFamily()),
            entity.getInstrument(),
            entity.getContractMonth(),
            entity.getObservedAt(),
            entity.getPrice(),
            entity.getDelta(),
            entity.getDeltaPercent(),
            entity.getSource()
        );
    }

    private ContractRoll fromRollEntity(ContractRollEntity entity) {
        List<String> labels = new ArrayList<>(3);
        for (String label : new String[] {entity.getMonth1Label(), entity.getMonth2Label(), entity.getMonth3Label()}) {
            if (!ContractMonth.isPlaceholder(label)) {
                labels.add(label);
            }
        }
        return new ContractRoll(entity.getInstrument(), labels, entity.getUpdatedAt());
    }
}
