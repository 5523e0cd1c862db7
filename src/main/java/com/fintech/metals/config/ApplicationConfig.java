package com.fintech.metals.config;

import com.fintech.metals.calendar.TradingCalendar;
import com.fintech.metals.ingestion.DedupGate;
import com.fintech.metals.ingestion.FeedDefinition;
import com.fintech.metals.ingestion.FetchClient;
import com.fintech.metals.ingestion.IngestionScheduler;
import com.fintech.metals.ingestion.IngestionService;
import com.fintech.metals.ingestion.QuoteNormalizer;
import com.fintech.metals.ingestion.QuoteParser;
import com.fintech.metals.storage.PriceStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Spring configuration for core application beans.
 */
@Configuration
public class ApplicationConfig {

    private static final Logger log = LoggerFactory.getLogger(ApplicationConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TradingCalendar tradingCalendar(MetalsProperties properties) {
        MetalsProperties.Calendar calendar = properties.getCalendar();
        TradingCalendar tradingCalendar = new TradingCalendar(
            ZoneId.of(calendar.getTimezone()),
            calendar.getTradingDays(),
            LocalTime.parse(calendar.getSessionStart()),
            LocalTime.parse(calendar.getSessionEnd()),
            calendar.getHolidays().stream().map(String::trim).map(LocalDate::parse).collect(Collectors.toSet())
        );
        if (calendar.getHolidays().isEmpty()) {
            log.warn("No exchange holidays configured (metals.calendar.holidays); weekday holidays are treated as trading days");
        }
        log.info("Trading calendar: days={}, hours={}", calendar.getTradingDays(), tradingCalendar.describeHours());
        return tradingCalendar;
    }

    static List<FeedDefinition> feedDefinitions(MetalsProperties properties) {
        List<FeedDefinition> feeds = properties.getFeeds().stream()
            .map(MetalsProperties.Feed::toDefinition)
            .toList();

        Set<String> names = new HashSet<>();
        for (FeedDefinition feed : feeds) {
            if (!names.add(feed.name())) {
                throw new IllegalArgumentException("Duplicate feed name: " + feed.name());
            }
        }
        log.info("Configured {} upstream feeds: {}", feeds.size(), names);
        return feeds;
    }

    @Bean
    public WebClient feedWebClient(WebClient.Builder builder) {
        return builder
            .defaultHeader(HttpHeaders.CACHE_CONTROL, "no-cache")
            .defaultHeader(HttpHeaders.PRAGMA, "no-cache")
            .build();
    }

    /**
     * Single-threaded scheduler: at most one ingestion cycle runs at any time.
     */
    @Bean
    public ThreadPoolTaskScheduler ingestionTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("ingestion-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public DedupGate dedupGate(PriceStore priceStore, MetalsProperties properties) {
        return new DedupGate(priceStore, properties.getIngestion().getDedupLookback());
    }

    @Bean
    public IngestionService ingestionService(
            FetchClient fetchClient,
            QuoteParser quoteParser,
            QuoteNormalizer quoteNormalizer,
            DedupGate dedupGate,
            PriceStore priceStore,
            TradingCalendar tradingCalendar,
            MetalsProperties properties,
            MeterRegistry meterRegistry) {
        return new IngestionService(fetchClient, quoteParser, quoteNormalizer, dedupGate, priceStore,
                tradingCalendar, properties.getIngestion().getSource(), meterRegistry);
    }

    @Bean
    public IngestionScheduler ingestionScheduler(
            ThreadPoolTaskScheduler ingestionTaskScheduler,
            IngestionService ingestionService,
            TradingCalendar tradingCalendar,
            MetalsProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        MetalsProperties.Ingestion ingestion = properties.getIngestion();
        if (!isPositive(ingestion.getInSessionInterval()) || !isPositive(ingestion.getOffSessionInterval())) {
            throw new IllegalArgumentException("Ingestion intervals must be positive");
        }
        return new IngestionScheduler(ingestionTaskScheduler, ingestionService, tradingCalendar,
                feedDefinitions(properties), ingestion, clock, meterRegistry);
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }
}
