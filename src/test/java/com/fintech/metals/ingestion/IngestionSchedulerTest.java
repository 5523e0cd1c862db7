package com.fintech.metals.ingestion;

import com.fintech.metals.calendar.TradingCalendar;
import com.fintech.metals.config.MetalsProperties;
import com.fintech.metals.domain.SeriesFamily;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static com.fintech.metals.TestFixtures.FRIDAY;
import static com.fintech.metals.TestFixtures.SATURDAY;
import static com.fintech.metals.TestFixtures.calendar;
import static com.fintech.metals.TestFixtures.ist;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("IngestionScheduler Tests")
class IngestionSchedulerTest {

    private final TradingCalendar calendar = calendar();
    private final FeedDefinition feedA = new FeedDefinition("a", "http://localhost/a", FeedMode.JSON,
        SeriesFamily.SPOT, "spot-a", Duration.ofSeconds(3), List.of());
    private final FeedDefinition feedB = new FeedDefinition("b", "http://localhost/b", FeedMode.JSON,
        SeriesFamily.SPOT, "spot-b", Duration.ofSeconds(3), List.of());

    private TaskScheduler taskScheduler;
    private IngestionService ingestionService;
    private MetalsProperties.Ingestion config;
    private SimpleMeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        taskScheduler = mock(TaskScheduler.class);
        ingestionService = mock(IngestionService.class);
        config = new MetalsProperties.Ingestion();
        config.setFailureAlertThreshold(3);
        meterRegistry = new SimpleMeterRegistry();
    }

    private IngestionScheduler scheduler(Instant now) {
        return new IngestionScheduler(taskScheduler, ingestionService, calendar, List.of(feedA, feedB), config,
            Clock.fixed(now, ZoneOffset.UTC), meterRegistry);
    }

    private static CycleOutcome outcome(String feed, CycleOutcome.Status status) {
        return new CycleOutcome(feed, status, 0, 0, 0, null, Instant.EPOCH);
    }

    @Test
    @DisplayName("Closed market skips the cycle without touching any feed")
    void calendarBlocksCycle() {
        IngestionScheduler scheduler = scheduler(ist(SATURDAY, 12, 0));

        List<CycleOutcome> outcomes = scheduler.triggerNow(Optional.empty());

        assertThat(outcomes).singleElement()
            .satisfies(o -> {
                assertThat(o.status()).isEqualTo(CycleOutcome.Status.CALENDAR_BLOCKED);
                assertThat(o.message()).isEqualTo("weekend");
            });
        verify(ingestionService, never()).ingest(any(), any(), any());
        assertThat(scheduler.status().state()).isEqualTo(CycleState.IDLE);
    }

    @Test
    @DisplayName("Open market ingests every feed in order")
    void ingestsAllFeeds() {
        Instant now = ist(FRIDAY, 10, 0);
        when(ingestionService.ingest(eq(feedA), eq(now), any())).thenReturn(outcome("a", CycleOutcome.Status.PERSISTED));
        when(ingestionService.ingest(eq(feedB), eq(now), any())).thenReturn(outcome("b", CycleOutcome.Status.NO_DATA));

        List<CycleOutcome> outcomes = scheduler(now).triggerNow(Optional.empty());

        assertThat(outcomes).extracting(CycleOutcome::feed).containsExactly("a", "b");
        assertThat(meterRegistry.counter("ingestion.cycles", "outcome", "persisted").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Manual trigger can target one feed")
    void triggerSingleFeed() {
        Instant now = ist(FRIDAY, 10, 0);
        when(ingestionService.ingest(eq(feedB), eq(now), any())).thenReturn(outcome("b", CycleOutcome.Status.PERSISTED));

        scheduler(now).triggerNow(Optional.of("b"));

        verify(ingestionService, never()).ingest(eq(feedA), any(), any());
        verify(ingestionService, times(1)).ingest(eq(feedB), eq(now), any());
    }

    @Test
    @DisplayName("Unknown feed name is rejected")
    void unknownFeed() {
        assertThatThrownBy(() -> scheduler(ist(FRIDAY, 10, 0)).triggerNow(Optional.of("nope")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("nope");
    }

    @Test
    @DisplayName("Failures are counted across cycles and reset by a clean cycle")
    void countsConsecutiveFailures() {
        Instant now = ist(FRIDAY, 10, 0);
        when(ingestionService.ingest(any(), eq(now), any()))
            .thenReturn(outcome("a", CycleOutcome.Status.FETCH_TIMEOUT));
        IngestionScheduler scheduler = scheduler(now);

        scheduler.triggerNow(Optional.of("a"));
        scheduler.triggerNow(Optional.of("a"));
        assertThat(scheduler.status().consecutiveFailures()).isEqualTo(2);
        assertThat(meterRegistry.get("ingestion.consecutive.failures").gauge().value()).isEqualTo(2.0);

        when(ingestionService.ingest(any(), eq(now), any()))
            .thenReturn(outcome("a", CycleOutcome.Status.DUPLICATE_SKIPPED));
        scheduler.triggerNow(Optional.of("a"));
        assertThat(scheduler.status().consecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("Cadence is one minute in session and five minutes outside")
    void adaptiveCadence() {
        IngestionScheduler scheduler = scheduler(ist(FRIDAY, 10, 0));

        assertThat(scheduler.nextDelay(ist(FRIDAY, 10, 0))).isEqualTo(Duration.ofMinutes(1));
        assertThat(scheduler.nextDelay(ist(FRIDAY, 23, 45))).isEqualTo(Duration.ofMinutes(5));
        assertThat(scheduler.nextDelay(ist(SATURDAY, 10, 0))).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("A tick reschedules itself even when ingestion throws")
    void tickSurvivesUnexpectedFailure() {
        Instant now = ist(FRIDAY, 10, 0);
        when(ingestionService.ingest(any(), any(), any())).thenThrow(new IllegalStateException("boom"));
        IngestionScheduler scheduler = scheduler(now);
        scheduler.start();

        scheduler.tick();

        ArgumentCaptor<Instant> at = ArgumentCaptor.forClass(Instant.class);
        verify(taskScheduler, times(2)).schedule(any(Runnable.class), at.capture());
        assertThat(at.getAllValues().get(0)).isEqualTo(now.plus(config.getInitialDelay()));
        assertThat(at.getAllValues().get(1)).isEqualTo(now.plus(Duration.ofMinutes(1)));
        assertThat(scheduler.status().consecutiveFailures()).isEqualTo(1);
    }

    @Test
    @DisplayName("Disabled ingestion schedules nothing on start")
    void disabledDoesNotSchedule() {
        config.setEnabled(false);
        IngestionScheduler scheduler = scheduler(ist(FRIDAY, 10, 0));

        scheduler.start();

        verify(taskScheduler, never()).schedule(any(Runnable.class), any(Instant.class));
        assertThat(scheduler.isRunning()).isTrue();
        scheduler.stop();
        assertThat(scheduler.isRunning()).isFalse();
    }
}
