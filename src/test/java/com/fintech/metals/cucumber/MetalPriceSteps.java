package com.fintech.metals.cucumber;

import com.fintech.metals.aggregation.AggregationEngine;
import com.fintech.metals.aggregation.AggregationQuery;
import com.fintech.metals.aggregation.AggregationReport;
import com.fintech.metals.calendar.TradingCalendar;
import com.fintech.metals.config.MetalsProperties;
import com.fintech.metals.domain.MonthSlot;
import com.fintech.metals.domain.QuoteSnapshot;
import com.fintech.metals.domain.SeriesFamily;
import com.fintech.metals.ingestion.CycleOutcome;
import com.fintech.metals.ingestion.DedupGate;
import com.fintech.metals.ingestion.FeedDefinition;
import com.fintech.metals.ingestion.FeedMode;
import com.fintech.metals.ingestion.IngestionScheduler;
import com.fintech.metals.ingestion.IngestionService;
import com.fintech.metals.ingestion.QuoteNormalizer;
import com.fintech.metals.ingestion.QuoteParser;
import com.fintech.metals.storage.PersistBatch;
import com.fintech.metals.storage.PriceStore;
import com.fintech.metals.storage.jpa.ContractRollJpaRepository;
import com.fintech.metals.storage.jpa.DailyQuoteJpaRepository;
import com.fintech.metals.storage.jpa.QuoteSnapshotJpaRepository;
import io.cucumber.datatable.DataTable;
import io.cucumber.java.Before;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import io.cucumber.spring.CucumberContextConfiguration;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Step definitions for the ingestion and aggregation scenarios.
 *
 * Runs against the full Spring context on H2. Upstream feeds are replaced by a stub
 * returning the payload given in the scenario; everything downstream is the real wiring.
 */
@CucumberContextConfiguration
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
public class MetalPriceSteps {

    private static final DateTimeFormatter LOCAL_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");
    private static final String SOURCE = "scheduled-poll";

    @Autowired
    private PriceStore priceStore;

    @Autowired
    private QuoteParser parser;

    @Autowired
    private QuoteNormalizer normalizer;

    @Autowired
    private DedupGate dedupGate;

    @Autowired
    private TradingCalendar calendar;

    @Autowired
    private AggregationEngine aggregationEngine;

    @Autowired
    private MetalsProperties properties;

    @Autowired
    private QuoteSnapshotJpaRepository snapshotRepository;

    @Autowired
    private DailyQuoteJpaRepository dailyRepository;

    @Autowired
    private ContractRollJpaRepository rollRepository;

    private FeedDefinition feed;
    private String payload;
    private final List<CycleOutcome> outcomes = new ArrayList<>();
    private AggregationReport report;

    @Before
    public void setUp() {
        snapshotRepository.deleteAll();
        dailyRepository.deleteAll();
        rollRepository.deleteAll();
        outcomes.clear();
        feed = null;
        payload = null;
        report = null;
    }

    // ================ Given Steps ================

    @Given("a {word} feed {string} for instrument {string} returning:")
    public void aFeedReturning(String family, String name, String instrument, String body) {
        feed = new FeedDefinition(name, "http://localhost/" + name, FeedMode.JSON,
            SeriesFamily.valueOf(family), instrument, Duration.ofSeconds(5), List.of());
        payload = body;
    }

    @Given("the feed now returns:")
    public void theFeedNowReturns(String body) {
        payload = body;
    }

    @Given("these {string} prices were stored:")
    public void thesePricesWereStored(String instrument, DataTable table) {
        List<QuoteSnapshot> rows = new ArrayList<>();
        for (Map<String, String> row : table.asMaps()) {
            rows.add(new QuoteSnapshot(SeriesFamily.SPOT, instrument, null, localTime(row.get("time")),
                new BigDecimal(row.get("price")), BigDecimal.ZERO, BigDecimal.ZERO, SOURCE).normalized());
        }
        priceStore.persist(new PersistBatch(rows, List.of(), null));
    }

    // ================ When Steps ================

    @When("the feed is ingested at {string}")
    public void theFeedIsIngestedAt(String time) {
        outcomes.add(ingestionService().ingest(feed, localTime(time), state -> { }));
    }

    @When("an ingestion cycle is triggered at {string}")
    public void anIngestionCycleIsTriggeredAt(String time) {
        ThreadPoolTaskScheduler taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.initialize();
        try {
            IngestionScheduler scheduler = new IngestionScheduler(taskScheduler, ingestionService(), calendar,
                List.of(feed), properties.getIngestion(), Clock.fixed(localTime(time), ZoneOffset.UTC),
                new SimpleMeterRegistry());
            outcomes.addAll(scheduler.triggerNow(Optional.empty()));
        } finally {
            taskScheduler.shutdown();
        }
    }

    @When("{string} is aggregated at {string}")
    public void isAggregatedAt(String instrument, String time) {
        report = aggregationEngine.aggregate(
            new AggregationQuery(instrument, MonthSlot.CURRENT, null, null, 500), localTime(time));
    }

    @When("{string} month {word} is aggregated at {string}")
    public void monthIsAggregatedAt(String instrument, String month, String time) {
        report = aggregationEngine.aggregate(
            new AggregationQuery(instrument, MonthSlot.fromParam(month), null, null, 500), localTime(time));
    }

    // ================ Then Steps ================

    @Then("the last outcome is {word}")
    public void theLastOutcomeIs(String status) {
        assertThat(outcomes).isNotEmpty();
        assertThat(outcomes.get(outcomes.size() - 1).status()).isEqualTo(CycleOutcome.Status.valueOf(status));
    }

    @Then("the skip reason is {string}")
    public void theSkipReasonIs(String reason) {
        assertThat(outcomes.get(outcomes.size() - 1).message()).isEqualTo(reason);
    }

    @Then("history holds {int} row(s) for {string} month {string}")
    public void historyHoldsRows(int count, String instrument, String month) {
        List<QuoteSnapshot> rows = priceStore.findRange(instrument, month, Instant.EPOCH, Instant.parse("2100-01-01T00:00:00Z"));
        assertThat(rows).hasSize(count);
    }

    @Then("the store holds {int} history row(s)")
    public void theStoreHoldsHistoryRows(int count) {
        assertThat(priceStore.count()).isEqualTo(count);
    }

    @Then("the daily row for {string} month {string} on {string} has price {string}")
    public void theDailyRowHasPrice(String instrument, String month, String date, String price) {
        List<QuoteSnapshot> daily = priceStore.findDaily(instrument, LocalDate.parse(date));
        assertThat(daily).filteredOn(s -> s.contractMonth().equals(month))
            .singleElement()
            .satisfies(s -> assertThat(s.price()).isEqualByComparingTo(price));
    }

    @Then("there are {int} daily rows for {string} on {string}")
    public void thereAreDailyRows(int count, String instrument, String date) {
        assertThat(priceStore.findDaily(instrument, LocalDate.parse(date))).hasSize(count);
    }

    @Then("the slot {word} of {string} resolves to {string}")
    public void theSlotResolvesTo(String slot, String instrument, String label) {
        assertThat(priceStore.findRoll(instrument))
            .flatMap(roll -> roll.labelFor(MonthSlot.fromParam(slot)))
            .contains(label);
    }

    @Then("the series has {int} point(s)")
    public void theSeriesHasPoints(int count) {
        assertThat(report.points()).hasSize(count);
    }

    @Then("the stats show first {string}, last {string} and change {string} percent")
    public void theStatsShow(String first, String last, String percent) {
        assertThat(report.stats().first()).isEqualByComparingTo(first);
        assertThat(report.stats().last()).isEqualByComparingTo(last);
        assertThat(report.stats().deltaPercent()).isEqualByComparingTo(percent);
    }

    @Then("the window starts at {string}")
    public void theWindowStartsAt(String time) {
        assertThat(report.stats().rangeStart()).isEqualTo(localTime(time));
    }

    @Then("the report resolves contract month {string}")
    public void theReportResolvesContractMonth(String label) {
        assertThat(report.contractMonth()).isEqualTo(label);
    }

    private IngestionService ingestionService() {
        return new IngestionService(definition -> payload, parser, normalizer, dedupGate, priceStore, calendar,
            SOURCE, new SimpleMeterRegistry());
    }

    private Instant localTime(String text) {
        return LocalDateTime.parse(text, LOCAL_TIME).atZone(calendar.zone()).toInstant();
    }
}
