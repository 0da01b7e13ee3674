package com.contractlink.harvester.harvest.service;

import com.contractlink.harvester.config.HarvesterProperties;
import com.contractlink.harvester.harvest.model.ContractRecord;
import com.contractlink.harvester.harvest.model.FetchResult;
import com.contractlink.harvester.harvest.model.HarvestEngineResult;
import com.contractlink.harvester.harvest.model.HarvestError;
import com.contractlink.harvester.harvest.model.HarvestErrorKind;
import com.contractlink.harvester.harvest.model.NormalizeResult;
import com.contractlink.harvester.harvest.model.ParseResult;
import com.contractlink.harvester.harvest.model.RawListing;
import com.contractlink.harvester.harvest.model.ScrapeFilters;
import com.contractlink.harvester.harvest.model.ScraperResult;
import com.contractlink.harvester.harvest.model.SourceId;
import com.contractlink.harvester.harvest.source.Scraper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class HarvestEngineServiceTest {
    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private ExecutorService executor;
    private HarvesterProperties properties;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(SourceId.values().length);
        properties = new HarvesterProperties();
        properties.setScraperTimeoutSeconds(5);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void keepsHigherPriorityCopyOfDuplicateContract() {
        StubScraper aggregator = StubScraper.returning(
            SourceId.DEMANDSTAR,
            record("MA", "BD-1", SourceId.DEMANDSTAR, "Janitorial (aggregated)"),
            record("FL", "DS-9", SourceId.DEMANDSTAR, "Custodial")
        );
        StubScraper portal = StubScraper.returning(
            SourceId.COMMBUYS,
            record("MA", "BD-1", SourceId.COMMBUYS, "Janitorial (official)")
        );
        HarvestEngineService engine = new HarvestEngineService(List.of(aggregator, portal), properties, executor);

        HarvestEngineResult result = engine.runAll(true, ScrapeFilters.unrestricted());

        assertEquals(2, result.records().size());
        assertEquals(1, result.summary().duplicatesRemoved());
        ContractRecord kept = result.records().get(0);
        assertEquals(SourceId.COMMBUYS, kept.source());
        assertEquals("Janitorial (official)", kept.title());
        assertThat(result.summary().bySource())
            .containsEntry("commbuys", 1)
            .containsEntry("demandstar", 1);
        assertThat(result.summary().byState()).containsEntry("MA", 1).containsEntry("FL", 1);
        assertThat(result.scraperResults()).extracting(ScraperResult::source)
            .containsExactly(SourceId.COMMBUYS, SourceId.DEMANDSTAR);
    }

    @Test
    void failingSourceDoesNotStopTheOthers() {
        StubScraper broken = new StubScraper(SourceId.EMARYLAND, () -> {
            throw new IllegalStateException("selector blew up");
        });
        StubScraper healthy = StubScraper.returning(SourceId.NEW_HAMPSHIRE, record("NH", "RFB 1", SourceId.NEW_HAMPSHIRE, "Janitorial"));
        HarvestEngineService engine = new HarvestEngineService(List.of(broken, healthy), properties, executor);

        HarvestEngineResult result = engine.runAll(true, ScrapeFilters.unrestricted());

        assertEquals(1, result.records().size());
        assertThat(result.summary().degradedSources()).containsExactly("emaryland");
        ScraperResult failed = result.scraperResults().get(0);
        assertThat(failed.degraded()).isTrue();
        assertThat(failed.errors()).singleElement()
            .satisfies(error -> {
                assertEquals(HarvestErrorKind.PARSE, error.kind());
                assertThat(error.detail()).contains("selector blew up");
            });
        assertThat(result.summary().bySource()).containsEntry("emaryland", 0).containsEntry("newhampshire", 1);
    }

    @Test
    void unreachableAggregatorLeavesOtherSixSourcesMerged() {
        List<Scraper> scrapers = List.of(
            StubScraper.returning(SourceId.COMMBUYS, record("MA", "BD-1", SourceId.COMMBUYS, "Janitorial")),
            StubScraper.returning(SourceId.EMARYLAND, record("MD", "BPM-1", SourceId.EMARYLAND, "Custodial")),
            StubScraper.returning(SourceId.NEW_HAMPSHIRE, record("NH", "RFB-1", SourceId.NEW_HAMPSHIRE, "Floor Care")),
            StubScraper.returning(SourceId.RHODE_ISLAND, record("RI", "RFP-1", SourceId.RHODE_ISLAND, "Custodial")),
            StubScraper.returning(SourceId.SYMPHONY, record("OH", "S-1", SourceId.SYMPHONY, "Janitorial")),
            StubScraper.returning(SourceId.BIDEXPRESS, record("GA", "E5Z41", SourceId.BIDEXPRESS, "Custodial")),
            StubScraper.unreachable(SourceId.DEMANDSTAR, "io_error: Connection refused")
        );
        HarvestEngineService engine = new HarvestEngineService(scrapers, properties, executor);

        HarvestEngineResult result = engine.runAll(true, ScrapeFilters.unrestricted());

        assertEquals(6, result.records().size());
        assertEquals(0, result.summary().duplicatesRemoved());
        assertThat(result.summary().degradedSources()).containsExactly("demandstar");
        assertThat(result.summary().byState()).containsOnlyKeys("MA", "MD", "NH", "RI", "OH", "GA");
        ScraperResult aggregator = result.scraperResults().get(result.scraperResults().size() - 1);
        assertEquals(SourceId.DEMANDSTAR, aggregator.source());
        assertThat(aggregator.errors()).singleElement()
            .satisfies(error -> assertEquals(HarvestErrorKind.NETWORK, error.kind()));
    }

    @Test
    void slowSourceIsCancelledAtItsBudget() throws Exception {
        properties.setScraperTimeoutSeconds(1);
        CountDownLatch never = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        StubScraper hanging = new StubScraper(SourceId.SYMPHONY, () -> {
            try {
                never.await();
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return List.of();
        });
        StubScraper fast = StubScraper.returning(SourceId.RHODE_ISLAND, record("RI", "RFP 1", SourceId.RHODE_ISLAND, "Custodial"));
        HarvestEngineService engine = new HarvestEngineService(List.of(hanging, fast), properties, executor);

        long started = System.nanoTime();
        HarvestEngineResult result = engine.runAll(true, ScrapeFilters.unrestricted());
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertThat(elapsed).isLessThan(Duration.ofSeconds(4));
        assertEquals(1, result.records().size());
        assertThat(result.summary().degradedSources()).containsExactly("symphony");
        ScraperResult timedOut = result.scraperResults().stream()
            .filter(r -> r.source() == SourceId.SYMPHONY)
            .findFirst()
            .orElseThrow();
        assertEquals(HarvestErrorKind.TIMEOUT_BUDGET, timedOut.errors().get(0).kind());
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void sequentialAndParallelRunsAgree() {
        List<Scraper> scrapers = List.of(
            StubScraper.returning(SourceId.BIDEXPRESS, record("FL", "E5Z41", SourceId.BIDEXPRESS, "Custodial")),
            StubScraper.returning(SourceId.SYMPHONY, record("OR", "S-1", SourceId.SYMPHONY, "Janitorial")),
            StubScraper.returning(SourceId.DEMANDSTAR, record("FL", "E5Z41", SourceId.DEMANDSTAR, "Custodial copy"))
        );
        HarvestEngineService engine = new HarvestEngineService(scrapers, properties, executor);

        HarvestEngineResult sequential = engine.runAll(false, ScrapeFilters.unrestricted());
        HarvestEngineResult parallel = engine.runAll(true, ScrapeFilters.unrestricted());

        assertEquals(sequential.records(), parallel.records());
        assertEquals(sequential.summary(), parallel.summary());
        assertThat(sequential.records()).extracting(ContractRecord::source)
            .containsExactly(SourceId.SYMPHONY, SourceId.BIDEXPRESS);
    }

    @Test
    void disabledSourcesAreNotRun() {
        HarvesterProperties.Source off = new HarvesterProperties.Source();
        off.setEnabled(false);
        properties.getSources().put("demandstar", off);
        StubScraper demandStar = StubScraper.returning(SourceId.DEMANDSTAR, record("FL", "X", SourceId.DEMANDSTAR, "Custodial"));
        HarvestEngineService engine = new HarvestEngineService(List.of(demandStar), properties, executor);

        HarvestEngineResult result = engine.runAll(true, ScrapeFilters.unrestricted());

        assertThat(result.records()).isEmpty();
        assertThat(demandStar.calls).isEmpty();
    }

    @Test
    void zeroResultSourcesAreReportedSeparately() {
        ScraperResult empty = new ScraperResult(SourceId.COMMBUYS, 0, 0, 0, List.of(), Duration.ZERO, false, true, List.of());
        HarvestEngineService engine = new HarvestEngineService(List.of(), properties, executor);

        HarvestEngineResult result = engine.combine(List.of(empty, ScraperResult.skipped(SourceId.EMARYLAND)));

        assertThat(result.summary().zeroResultSources()).containsExactly("commbuys");
        assertThat(result.summary().degradedSources()).isEmpty();
    }

    @Test
    void defaultFiltersComeFromConfiguration() {
        properties.getFilters().setStates(List.of("ma", "RI"));
        properties.getFilters().setLimit(50);
        HarvestEngineService engine = new HarvestEngineService(List.of(), properties, executor);

        ScrapeFilters filters = engine.defaultFilters();

        assertThat(filters.states()).containsExactlyInAnyOrder("MA", "RI");
        assertEquals(50, filters.limit());
    }

    private static ContractRecord record(String state, String number, SourceId source, String title) {
        return new ContractRecord(
            state,
            title,
            number,
            LocalDate.of(2025, 4, 1),
            "https://example.org/" + source.key() + "/" + number,
            "Agency",
            source,
            NOW,
            null,
            null,
            "561720"
        );
    }

    private static final class StubScraper implements Scraper {
        private final SourceId source;
        private final Supplier<List<ContractRecord>> records;
        private final List<ScrapeFilters> calls = Collections.synchronizedList(new ArrayList<>());
        private HarvestError failure;

        StubScraper(SourceId source, Supplier<List<ContractRecord>> records) {
            this.source = source;
            this.records = records;
        }

        static StubScraper returning(SourceId source, ContractRecord... records) {
            return new StubScraper(source, () -> List.of(records));
        }

        static StubScraper unreachable(SourceId source, String detail) {
            StubScraper scraper = new StubScraper(source, List::of);
            scraper.failure = HarvestError.of(HarvestErrorKind.NETWORK, source, detail);
            return scraper;
        }

        @Override
        public SourceId source() {
            return source;
        }

        @Override
        public FetchResult fetchRaw(ScrapeFilters filters) {
            return new FetchResult(source, List.of(), List.of(), 0);
        }

        @Override
        public ParseResult parse(FetchResult raw) {
            return new ParseResult(List.of(), List.of());
        }

        @Override
        public NormalizeResult normalize(RawListing listing) {
            return NormalizeResult.dropped(null, "stub");
        }

        @Override
        public ScraperResult run(ScrapeFilters filters) {
            calls.add(filters);
            if (failure != null) {
                return ScraperResult.failed(source, failure, Duration.ofMillis(1));
            }
            List<ContractRecord> produced = records.get();
            return new ScraperResult(
                source,
                produced.size(),
                produced.size(),
                produced.size(),
                List.of(),
                Duration.ofMillis(1),
                false,
                false,
                produced
            );
        }
    }
}
