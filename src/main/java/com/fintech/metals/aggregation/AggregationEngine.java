package com.fintech.metals.aggregation;

import com.fintech.metals.calendar.TradingCalendar;
import com.fintech.metals.calendar.TradingSession;
import com.fintech.metals.calendar.TradingStatus;
import com.fintech.metals.domain.AggregateResult;
import com.fintech.metals.domain.ContractRoll;
import com.fintech.metals.domain.MonthSlot;
import com.fintech.metals.domain.PricePoint;
import com.fintech.metals.domain.QuoteSnapshot;
import com.fintech.metals.storage.PriceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Builds session-bounded, minute-collapsed series and their statistics.
 *
 * <p>Steps for one request:
 * <ol>
 *   <li>resolve the slot to a label through the stored contract roll</li>
 *   <li>read the window: the given range, or the effective session (today once it has
 *       opened, otherwise the previous trading session)</li>
 *   <li>drop points outside the trading session of their own date</li>
 *   <li>collapse points sharing a minute, keeping the last observed</li>
 *   <li>compute count, min, max, avg, first, last, delta and percent change</li>
 * </ol>
 *
 * <p>Read-only; repeated calls over unchanged data give identical results.
 */
@Component
public class AggregationEngine {

    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    /** Scale of computed averages and percentages. */
    static final int RESULT_SCALE = 4;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PriceStore priceStore;
    private final TradingCalendar calendar;

    public AggregationEngine(PriceStore priceStore, TradingCalendar calendar) {
        this.priceStore = priceStore;
        this.calendar = calendar;
    }

    public AggregationReport aggregate(AggregationQuery query, Instant now) {
        TradingStatus tradingStatus = calendar.isOpen(now);

        Instant from;
        Instant to;
        if (query.usesSessionDefault()) {
            TradingSession session = calendar.effectiveSession(now);
            from = session.start();
            to = session.end();
        } else {
            from = query.rangeStart();
            to = query.rangeEnd();
        }

        Optional<String> label = resolveLabel(query.instrument(), query.slot());
        if (label.isEmpty()) {
            String message = "No contract month in slot " + query.slot().name().toLowerCase() + " for " + query.instrument();
            return new AggregationReport(query.instrument(), null, List.of(),
                AggregateResult.empty(from, to), tradingStatus, message, false);
        }

        List<QuoteSnapshot> rows = priceStore.findRange(query.instrument(), label.get(), from, to);
        List<PricePoint> series = collapseByMinute(clipToSessions(rows));
        AggregateResult stats = computeStats(series, from, to);

        if (log.isDebugEnabled()) {
            log.debug("Aggregated {}:{} over [{}, {}): rows={}, points={}",
                     query.instrument(), label.get(), from, to, rows.size(), series.size());
        }

        String message = stats.isEmpty() ? "No data for " + query.instrument() + " in the requested window" : null;
        return new AggregationReport(query.instrument(), label.get(), lastN(series, query.limit()),
            stats, tradingStatus, message, false);
    }

    /**
     * Maps a slot to the label currently holding it. Series without a stored roll have a
     * single implicit slot.
     */
    Optional<String> resolveLabel(String instrument, MonthSlot slot) {
        Optional<ContractRoll> roll = priceStore.findRoll(instrument);
        if (roll.isPresent()) {
            return roll.get().labelFor(slot);
        }
        return slot == MonthSlot.CURRENT ? Optional.of(QuoteSnapshot.NO_CONTRACT) : Optional.empty();
    }

    List<QuoteSnapshot> clipToSessions(List<QuoteSnapshot> rows) {
        List<QuoteSnapshot> inside = new ArrayList<>(rows.size());
        for (QuoteSnapshot row : rows) {
            LocalDate date = calendar.dateOf(row.observedAt());
            if (calendar.isTradingDay(date) && calendar.sessionWindow(date).contains(row.observedAt())) {
                inside.add(row);
            }
        }
        return inside;
    }

    /**
     * Keeps one point per minute: the last one in input order, which is observation
     * order with ties broken by insertion order.
     */
    static List<PricePoint> collapseByMinute(List<QuoteSnapshot> rows) {
        Map<Instant, BigDecimal> byMinute = new TreeMap<>();
        for (QuoteSnapshot row : rows) {
            if (row.price() != null) {
                byMinute.put(row.observedAt().truncatedTo(ChronoUnit.MINUTES), row.price());
            }
        }
        List<PricePoint> points = new ArrayList<>(byMinute.size());
        byMinute.forEach((minute, price) -> points.add(new PricePoint(minute, price)));
        return points;
    }

    static AggregateResult computeStats(List<PricePoint> series, Instant from, Instant to) {
        if (series.isEmpty()) {
            return AggregateResult.empty(from, to);
        }
        BigDecimal min = null;
        BigDecimal max = null;
        BigDecimal sum = BigDecimal.ZERO;
        for (PricePoint point : series) {
            BigDecimal value = point.value();
            min = min == null || value.compareTo(min) < 0 ? value : min;
            max = max == null || value.compareTo(max) > 0 ? value : max;
            sum = sum.add(value);
        }
        BigDecimal first = series.get(0).value();
        BigDecimal last = series.get(series.size() - 1).value();
        BigDecimal delta = last.subtract(first);
        BigDecimal avg = sum.divide(BigDecimal.valueOf(series.size()), MathContext.DECIMAL64)
            .setScale(RESULT_SCALE, RoundingMode.HALF_UP);
        BigDecimal deltaPercent = first.signum() == 0
            ? BigDecimal.ZERO
            : delta.multiply(HUNDRED).divide(first, MathContext.DECIMAL64).setScale(RESULT_SCALE, RoundingMode.HALF_UP);

        return new AggregateResult(series.size(), min, max, avg, first, last, delta, deltaPercent, from, to);
    }

    private static List<PricePoint> lastN(List<PricePoint> series, int limit) {
        return series.size() <= limit ? series : series.subList(series.size() - limit, series.size());
    }
}
