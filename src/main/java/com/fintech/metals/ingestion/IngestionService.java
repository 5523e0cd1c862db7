package com.fintech.metals.ingestion;

import com.fintech.metals.calendar.TradingCalendar;
import com.fintech.metals.domain.ContractRoll;
import com.fintech.metals.domain.DailyQuote;
import com.fintech.metals.domain.QuoteSnapshot;
import com.fintech.metals.domain.SeriesFamily;
import com.fintech.metals.storage.PersistBatch;
import com.fintech.metals.storage.PriceStore;
import com.fintech.metals.storage.StoreException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Runs one feed through fetch, parse, normalize, dedup and persist.
 *
 * Every failure is turned into a {@link CycleOutcome}; nothing thrown here may stop the
 * polling loop. Calendar gating happens one level up in {@link IngestionScheduler}.
 */
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final FetchClient fetchClient;
    private final QuoteParser parser;
    private final QuoteNormalizer normalizer;
    private final DedupGate dedupGate;
    private final PriceStore priceStore;
    private final TradingCalendar calendar;
    private final String source;

    private final Counter rowsPersisted;
    private final Counter rowsDuplicate;

    public IngestionService(
            FetchClient fetchClient,
            QuoteParser parser,
            QuoteNormalizer normalizer,
            DedupGate dedupGate,
            PriceStore priceStore,
            TradingCalendar calendar,
            String source,
            MeterRegistry meterRegistry) {
        this.fetchClient = fetchClient;
        this.parser = parser;
        this.normalizer = normalizer;
        this.dedupGate = dedupGate;
        this.priceStore = priceStore;
        this.calendar = calendar;
        this.source = Objects.requireNonNull(source, "Source cannot be null");
        this.rowsPersisted = meterRegistry.counter("ingestion.rows.persisted");
        this.rowsDuplicate = meterRegistry.counter("ingestion.rows.duplicate");
    }

    public CycleOutcome ingest(FeedDefinition feed, Instant now, Consumer<CycleState> stateListener) {
        stateListener.accept(CycleState.FETCHING);
        String raw;
        try {
            raw = fetchClient.fetch(feed);
        } catch (FetchException e) {
            CycleOutcome.Status status = e.getKind() == FetchException.Kind.TIMEOUT
                ? CycleOutcome.Status.FETCH_TIMEOUT
                : CycleOutcome.Status.FETCH_ERROR;
            log.warn("Fetch failed for feed {}: {}", feed.name(), e.getMessage());
            return CycleOutcome.failed(feed.name(), status, e.getMessage(), now);
        }

        stateListener.accept(CycleState.PARSING);
        List<QuoteSnapshot> parsed;
        List<QuoteSnapshot> candidates;
        try {
            parsed = parser.parse(raw, feed, source, now);
            candidates = normalizer.normalize(parsed, feed);
        } catch (QuoteParseException e) {
            log.warn("Unparseable payload from feed {}: {}", feed.name(), e.getMessage());
            return CycleOutcome.failed(feed.name(), CycleOutcome.Status.PARSE_ERROR, e.getMessage(), now);
        } catch (StoreException e) {
            return CycleOutcome.failed(feed.name(), CycleOutcome.Status.STORE_ERROR, e.getMessage(), now);
        }
        if (candidates.isEmpty()) {
            log.info("Feed {} produced no usable quotes this cycle", feed.name());
            return new CycleOutcome(feed.name(), CycleOutcome.Status.NO_DATA, 0, 0, 0, "no usable quotes", now);
        }

        try {
            stateListener.accept(CycleState.GATING);
            DedupGate.Admission admission = dedupGate.admit(candidates);
            PersistBatch batch = new PersistBatch(
                admission.fresh(),
                dailyUpserts(candidates),
                rollChange(feed, parsed, now).orElse(null)
            );

            stateListener.accept(CycleState.PERSISTING);
            List<QuoteSnapshot> appended = priceStore.persist(batch);

            rowsPersisted.increment(appended.size());
            rowsDuplicate.increment(admission.duplicates().size());

            CycleOutcome.Status status = appended.isEmpty()
                ? CycleOutcome.Status.DUPLICATE_SKIPPED
                : CycleOutcome.Status.PERSISTED;
            log.info("Feed {}: inserted={}, duplicates={}, dailyUpserts={}",
                    feed.name(), appended.size(), admission.duplicates().size(), batch.dailyUpserts().size());
            return new CycleOutcome(feed.name(), status, appended.size(), admission.duplicates().size(),
                    batch.dailyUpserts().size(), null, now);
        } catch (StoreException e) {
            log.warn("Store unavailable while ingesting feed {}: {}", feed.name(), e.getMessage());
            return CycleOutcome.failed(feed.name(), CycleOutcome.Status.STORE_ERROR, e.getMessage(), now);
        }
    }

    private List<DailyQuote> dailyUpserts(List<QuoteSnapshot> snapshots) {
        return snapshots.stream()
            .filter(s -> s.family().keepsDailyLatest())
            .map(s -> new DailyQuote(calendar.dateOf(s.observedAt()), s))
            .toList();
    }

    /**
     * Labels come from every parsed month, priced or not, so a month without a price this
     * cycle keeps its slot.
     */
    private Optional<ContractRoll> rollChange(FeedDefinition feed, List<QuoteSnapshot> snapshots, Instant now) {
        if (feed.family() != SeriesFamily.CONTRACT_MONTH) {
            return Optional.empty();
        }
        List<String> labels = snapshots.stream()
            .filter(s -> s.family() == SeriesFamily.CONTRACT_MONTH)
            .map(QuoteSnapshot::contractMonth)
            .distinct()
            .limit(ContractRoll.MAX_SLOTS)
            .toList();
        if (labels.isEmpty()) {
            return Optional.empty();
        }
        Optional<ContractRoll> stored = priceStore.findRoll(feed.instrument());
        if (stored.isPresent() && stored.get().labels().equals(labels)) {
            return Optional.empty();
        }
        return Optional.of(new ContractRoll(feed.instrument(), labels, now));
    }
}
