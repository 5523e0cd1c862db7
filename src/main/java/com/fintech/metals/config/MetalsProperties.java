package com.fintech.metals.config;

import com.fintech.metals.domain.SeriesFamily;
import com.fintech.metals.ingestion.FeedDefinition;
import com.fintech.metals.ingestion.FeedMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Externalized configuration for the metal price engine.
 * Maps to 'metals.*' properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "metals")
public class MetalsProperties {

    private Calendar calendar = new Calendar();
    private Ingestion ingestion = new Ingestion();
    private Query query = new Query();
    private List<Feed> feeds = new ArrayList<>();

    @Data
    public static class Calendar {
        private String timezone = "Asia/Kolkata";
        private Set<DayOfWeek> tradingDays = EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);
        private String sessionStart = "09:00";
        private String sessionEnd = "23:30";  // last minute inside the session
        private List<String> holidays = new ArrayList<>();  // ISO dates
    }

    @Data
    public static class Ingestion {
        private boolean enabled = true;
        private String source = "scheduled-poll";
        private Duration initialDelay = Duration.ofSeconds(5);
        private Duration inSessionInterval = Duration.ofMinutes(1);
        private Duration offSessionInterval = Duration.ofMinutes(5);
        private Duration dedupLookback = Duration.ofMinutes(5);
        private Duration shutdownGrace = Duration.ofSeconds(10);
        private Duration triggerWait = Duration.ofSeconds(30);
        private int failureAlertThreshold = 10;
    }

    @Data
    public static class Query {
        private int defaultLimit = 500;
        private int maxLimit = 5000;
        private Duration cacheTtl = Duration.ofSeconds(30);
        private int cacheSize = 256;
        private Duration maxRange = Duration.ofDays(7);
    }

    @Data
    public static class Feed {
        private String name;
        private String url;
        private FeedMode mode = FeedMode.JSON;
        private SeriesFamily family = SeriesFamily.SPOT;
        private String instrument;
        private Duration timeout = Duration.ofSeconds(5);
        private List<String> trackedNames = new ArrayList<>();

        public FeedDefinition toDefinition() {
            return new FeedDefinition(name, url, mode, family, instrument, timeout, trackedNames);
        }
    }
}
