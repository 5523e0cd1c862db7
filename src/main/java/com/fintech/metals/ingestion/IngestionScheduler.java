package com.fintech.metals.ingestion;

import com.fintech.metals.calendar.TradingCalendar;
import com.fintech.metals.calendar.TradingStatus;
import com.fintech.metals.config.MetalsProperties;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Calendar-gated polling loop.
 *
 * <p>Each cycle checks the trading calendar and then ingests every configured feed in
 * turn. The next cycle is scheduled after the current one finishes: every
 * {@code in-session-interval} while the market is open, every {@code off-session-interval}
 * otherwise. A failed cycle only delays until the next tick.
 *
 * <p>Background ticks and manual triggers share one lock, so at most one cycle is
 * ever in flight.
 */
public class IngestionScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(IngestionScheduler.class);

    private final TaskScheduler taskScheduler;
    private final IngestionService ingestionService;
    private final TradingCalendar calendar;
    private final List<FeedDefinition> feeds;
    private final MetalsProperties.Ingestion config;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Timer cycleTimer;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();

    private volatile CycleState state = CycleState.IDLE;
    private volatile Instant lastAttemptAt;
    private volatile Instant nextRunAt;
    private volatile List<CycleOutcome> lastOutcomes = List.of();
    private volatile ScheduledFuture<?> nextRun;
    private volatile boolean running;

    public IngestionScheduler(
            TaskScheduler taskScheduler,
            IngestionService ingestionService,
            TradingCalendar calendar,
            List<FeedDefinition> feeds,
            MetalsProperties.Ingestion config,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.taskScheduler = taskScheduler;
        this.ingestionService = ingestionService;
        this.calendar = calendar;
        this.feeds = List.copyOf(feeds);
        this.config = config;
        if (config.getFailureAlertThreshold() < 1) {
            throw new IllegalArgumentException("metals.ingestion.failure-alert-threshold must be at least 1");
        }
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.cycleTimer = meterRegistry.timer("ingestion.cycle.latency");
        meterRegistry.gauge("ingestion.consecutive.failures", consecutiveFailures);
    }

    @Override
    public void start() {
        running = true;
        if (!config.isEnabled()) {
            log.info("Background ingestion disabled (metals.ingestion.enabled=false); manual triggers still work");
            return;
        }
        if (feeds.isEmpty()) {
            log.warn("Background ingestion enabled but no feeds are configured");
        }
        log.info("Starting ingestion loop: feeds={}, in-session every {}, off-session every {}",
                feeds.size(), config.getInSessionInterval(), config.getOffSessionInterval());
        scheduleNext(config.getInitialDelay());
    }

    @Override
    public void stop() {
        running = false;
        ScheduledFuture<?> pending = nextRun;
        if (pending != null) {
            pending.cancel(false);
        }
        nextRunAt = null;

        // let an in-flight cycle finish within the grace period
        try {
            if (cycleLock.tryLock(config.getShutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                cycleLock.unlock();
                log.info("Ingestion loop stopped");
            } else {
                log.warn("Ingestion cycle still running after {}, shutting down anyway", config.getShutdownGrace());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the ingestion cycle to finish");
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Runs one cycle now, waiting up to {@code trigger-wait} for a running cycle to end.
     * Safe to call repeatedly: re-ingesting unchanged quotes is suppressed as duplicates.
     *
     * @param feedName Restricts the cycle to one feed; empty runs all feeds
     * @throws IllegalArgumentException if the named feed is not configured
     */
    public List<CycleOutcome> triggerNow(Optional<String> feedName) {
        List<FeedDefinition> selected = feedName
            .map(name -> List.of(findFeed(name)))
            .orElse(feeds);
        log.info("Manual ingestion trigger: feeds={}", selected.stream().map(FeedDefinition::name).toList());
        return runCycle(selected, config.getTriggerWait());
    }

    public SchedulerStatus status() {
        return new SchedulerStatus(
            config.isEnabled(),
            state,
            lastAttemptAt,
            nextRunAt,
            consecutiveFailures.get(),
            lastOutcomes
        );
    }

    public List<FeedDefinition> feeds() {
        return feeds;
    }

    /** Delay until the next background cycle, chosen by whether the market is open at {@code now}. */
    Duration nextDelay(Instant now) {
        return calendar.isOpen(now).allowed() ? config.getInSessionInterval() : config.getOffSessionInterval();
    }

    void tick() {
        try {
            runCycle(feeds, config.getTriggerWait());
        } catch (RuntimeException e) {
            // never let the loop die
            log.error("Unexpected failure in ingestion cycle", e);
            recordFailure();
        } finally {
            if (running) {
                scheduleNext(nextDelay(clock.instant()));
            }
        }
    }

    private List<CycleOutcome> runCycle(List<FeedDefinition> selected, Duration lockWait) {
        Instant now = clock.instant();
        try {
            if (!cycleLock.tryLock(lockWait.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Ingestion cycle already in progress, request not run");
                return List.of(CycleOutcome.skipped(CycleOutcome.Status.BUSY, "cycle already in progress", now));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of(CycleOutcome.skipped(CycleOutcome.Status.BUSY, "interrupted", now));
        }

        try {
            return cycleTimer.record(() -> runLocked(selected));
        } finally {
            state = CycleState.IDLE;
            cycleLock.unlock();
        }
    }

    private List<CycleOutcome> runLocked(List<FeedDefinition> selected) {
        Instant now = clock.instant();
        lastAttemptAt = now;

        state = CycleState.CHECKING_CALENDAR;
        TradingStatus tradingStatus = calendar.isOpen(now);
        if (!tradingStatus.allowed()) {
            state = CycleState.SKIPPED;
            log.info("Market closed ({}), ingestion skipped", tradingStatus.reason());
            List<CycleOutcome> skipped =
                List.of(CycleOutcome.skipped(CycleOutcome.Status.CALENDAR_BLOCKED, tradingStatus.reason(), now));
            complete(skipped);
            return skipped;
        }

        List<CycleOutcome> outcomes = new ArrayList<>(selected.size());
        for (FeedDefinition feed : selected) {
            outcomes.add(ingestionService.ingest(feed, now, next -> state = next));
        }
        complete(outcomes);
        return outcomes;
    }

    private void complete(List<CycleOutcome> outcomes) {
        lastOutcomes = List.copyOf(outcomes);
        for (CycleOutcome outcome : outcomes) {
            meterRegistry.counter("ingestion.cycles", "outcome", outcome.status().name().toLowerCase()).increment();
        }

        boolean anyFailure = outcomes.stream().anyMatch(CycleOutcome::isFailure);
        boolean skipped = outcomes.stream().allMatch(o -> o.status() == CycleOutcome.Status.CALENDAR_BLOCKED);
        if (anyFailure) {
            recordFailure();
        } else if (!skipped) {
            int previous = consecutiveFailures.getAndSet(0);
            if (previous >= config.getFailureAlertThreshold()) {
                log.info("Ingestion recovered after {} failed cycles", previous);
            }
        }
    }

    private void recordFailure() {
        int failures = consecutiveFailures.incrementAndGet();
        if (failures % config.getFailureAlertThreshold() == 0) {
            log.error("Ingestion has failed {} cycles in a row; check upstream feeds and the price store", failures);
        }
    }

    private void scheduleNext(Duration delay) {
        Instant at = clock.instant().plus(delay);
        nextRunAt = at;
        nextRun = taskScheduler.schedule(this::tick, at);
        if (log.isDebugEnabled()) {
            log.debug("Next ingestion cycle at {}", at);
        }
    }

    private FeedDefinition findFeed(String name) {
        return feeds.stream()
            .filter(feed -> feed.name().equals(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown feed '" + name + "'"));
    }
}
