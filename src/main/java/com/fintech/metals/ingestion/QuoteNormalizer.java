package com.fintech.metals.ingestion;

import com.fintech.metals.domain.QuoteSnapshot;
import com.fintech.metals.domain.SeriesFamily;
import com.fintech.metals.storage.PriceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies the write policy to freshly parsed snapshots: drops unknown prices, filters
 * supplier names, and turns supplier change updates into running prices.
 *
 * Everything returned is {@link QuoteSnapshot#normalized() normalized} to two decimals.
 */
@Component
public class QuoteNormalizer {

    private static final Logger log = LoggerFactory.getLogger(QuoteNormalizer.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PriceStore priceStore;

    public QuoteNormalizer(PriceStore priceStore) {
        this.priceStore = priceStore;
    }

    public List<QuoteSnapshot> normalize(List<QuoteSnapshot> parsed, FeedDefinition feed) {
        List<QuoteSnapshot> result = new ArrayList<>(parsed.size());
        // running totals of suppliers already seen in this payload
        Map<String, QuoteSnapshot> supplierState = new HashMap<>();

        for (QuoteSnapshot snapshot : parsed) {
            if (snapshot.family() == SeriesFamily.SUPPLIER) {
                QuoteSnapshot accumulated = accumulate(snapshot, feed, supplierState);
                if (accumulated != null) {
                    supplierState.put(accumulated.instrument(), accumulated);
                    result.add(accumulated);
                }
                continue;
            }
            if (!snapshot.hasPrice()) {
                log.info("Price unknown for {} from feed {}, nothing stored this cycle", snapshot.instrumentKey(), feed.name());
                continue;
            }
            result.add(snapshot.normalized());
        }
        return result;
    }

    private QuoteSnapshot accumulate(QuoteSnapshot update, FeedDefinition feed, Map<String, QuoteSnapshot> supplierState) {
        String name = update.instrument();
        if (!feed.tracks(name)) {
            log.debug("Ignoring untracked supplier {} from feed {}", name, feed.name());
            return null;
        }
        if (update.delta() == null) {
            log.info("Change unknown for supplier {} from feed {}, skipped", name, feed.name());
            return null;
        }

        QuoteSnapshot previous = supplierState.containsKey(name)
            ? supplierState.get(name)
            : priceStore.findLatest(name, QuoteSnapshot.NO_CONTRACT).orElse(null);

        if (previous != null && !update.observedAt().isAfter(previous.observedAt())) {
            log.debug("Supplier {} update at {} is not newer than stored {}, skipped",
                     name, update.observedAt(), previous.observedAt());
            return null;
        }

        BigDecimal base = previous != null ? previous.price() : BigDecimal.ZERO;
        BigDecimal percent = base.signum() == 0
            ? BigDecimal.ZERO
            : update.delta().multiply(HUNDRED).divide(base, MathContext.DECIMAL64);

        return new QuoteSnapshot(
            SeriesFamily.SUPPLIER,
            name,
            null,
            update.observedAt(),
            base.add(update.delta()),
            update.delta(),
            percent,
            update.source()
        ).normalized();
    }
}
