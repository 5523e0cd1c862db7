package com.fintech.metals.service;

import com.fintech.metals.aggregation.AggregationEngine;
import com.fintech.metals.aggregation.AggregationQuery;
import com.fintech.metals.aggregation.AggregationReport;
import com.fintech.metals.config.MetalsProperties;
import com.fintech.metals.domain.QuoteSnapshot;
import com.fintech.metals.storage.PriceStore;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Read side of the engine: validation, circuit breaking and the last-good cache.
 *
 * When the price store fails or the breaker is open, an aggregate request is answered
 * from the last good result for the same query, flagged as cached. Without one the
 * request fails with {@link ServiceException}.
 */
@Service
public class QuoteQueryService {

    private static final Logger log = LoggerFactory.getLogger(QuoteQueryService.class);

    static final String CIRCUIT_BREAKER = "priceStore";

    private final AggregationEngine engine;
    private final PriceStore priceStore;
    private final CircuitBreaker circuitBreaker;
    private final MetalsProperties.Query config;
    private final Clock clock;

    private final Map<AggregationQuery, CachedReport> lastGood;
    private final Timer requestTimer;
    private final Counter cacheFallbacks;

    private record CachedReport(AggregationReport report, Instant storedAt) {
    }

    public QuoteQueryService(
            AggregationEngine engine,
            PriceStore priceStore,
            CircuitBreakerRegistry circuitBreakerRegistry,
            MetalsProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.engine = engine;
        this.priceStore = priceStore;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER);
        this.config = properties.getQuery();
        this.clock = clock;

        int cacheSize = config.getCacheSize();
        this.lastGood = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<AggregationQuery, CachedReport> eldest) {
                return size() > cacheSize;
            }
        });

        this.requestTimer = meterRegistry.timer("aggregation.request.latency");
        this.cacheFallbacks = meterRegistry.counter("aggregation.cache.fallbacks");

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Price store circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );
    }

    /**
     * @throws ValidationException if the query is out of bounds
     * @throws ServiceException if the store is unavailable and nothing is cached
     */
    public AggregationReport aggregate(AggregationQuery query) {
        validate(query);
        return requestTimer.record(() -> {
            Instant now = clock.instant();
            CachedReport cached = lastGood.get(query);
            if (cached != null && Duration.between(cached.storedAt(), now).compareTo(config.getCacheTtl()) < 0) {
                return cached.report();
            }

            try {
                AggregationReport report = guarded("aggregate " + query.instrument(), () -> engine.aggregate(query, now));
                lastGood.put(query, new CachedReport(report, now));
                return report;
            } catch (ServiceException e) {
                if (cached == null) {
                    throw e;
                }
                cacheFallbacks.increment();
                log.warn("Serving cached aggregate for {} from {}: {}", query.instrument(), cached.storedAt(), e.getMessage());
                return cached.report().asCached();
            }
        });
    }

    /** Most recent snapshot per contract month of an instrument. */
    public List<QuoteSnapshot> latest(String instrument) {
        requireInstrument(instrument);
        return guarded("latest " + instrument, () -> priceStore.latest(instrument));
    }

    /** Same-day rows of an instrument. */
    public List<QuoteSnapshot> daily(String instrument, LocalDate tradeDate) {
        requireInstrument(instrument);
        if (tradeDate == null) {
            throw new ValidationException("date is required");
        }
        return guarded("daily " + instrument, () -> priceStore.findDaily(instrument, tradeDate));
    }

    /**
     * Applies the configured default and ceiling to a requested point limit.
     */
    public int resolveLimit(Integer requested) {
        if (requested == null) {
            return config.getDefaultLimit();
        }
        if (requested < 1 || requested > config.getMaxLimit()) {
            throw new ValidationException("limit must be between 1 and " + config.getMaxLimit());
        }
        return requested;
    }

    private <T> T guarded(String operation, Supplier<T> call) {
        try {
            return circuitBreaker.executeSupplier(call);
        } catch (CallNotPermittedException e) {
            log.error("Price store circuit breaker OPEN - rejecting {}", operation);
            throw new ServiceException("Price store circuit breaker is open. System is recovering from errors.", e);
        } catch (RuntimeException e) {
            log.error("Price store error during {}", operation, e);
            throw new ServiceException("Failed to read from the price store", e);
        }
    }

    private void validate(AggregationQuery query) {
        requireInstrument(query.instrument());
        if (query.limit() > config.getMaxLimit()) {
            throw new ValidationException("limit must be between 1 and " + config.getMaxLimit());
        }
        if (!query.usesSessionDefault()) {
            Duration span = Duration.between(query.rangeStart(), query.rangeEnd());
            if (span.compareTo(config.getMaxRange()) > 0) {
                throw new ValidationException("Requested range " + span + " exceeds the maximum of " + config.getMaxRange());
            }
        }
    }

    private void requireInstrument(String instrument) {
        if (instrument == null || instrument.isBlank()) {
            throw new ValidationException("instrument cannot be blank");
        }
    }

    /**
     * Thrown for requests the service refuses to run.
     */
    public static class ValidationException extends RuntimeException {
        public ValidationException(String message) {
            super(message);
        }
    }

    /**
     * Thrown when the backing store cannot answer and nothing can stand in for it.
     */
    public static class ServiceException extends RuntimeException {
        public ServiceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
