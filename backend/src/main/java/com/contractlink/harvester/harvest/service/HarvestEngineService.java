package com.contractlink.harvester.harvest.service;

import com.contractlink.harvester.config.HarvesterProperties;
import com.contractlink.harvester.harvest.model.ContractKey;
import com.contractlink.harvester.harvest.model.ContractRecord;
import com.contractlink.harvester.harvest.model.HarvestEngineResult;
import com.contractlink.harvester.harvest.model.HarvestError;
import com.contractlink.harvester.harvest.model.HarvestErrorKind;
import com.contractlink.harvester.harvest.model.HarvestSummary;
import com.contractlink.harvester.harvest.model.ScrapeFilters;
import com.contractlink.harvester.harvest.model.ScraperResult;
import com.contractlink.harvester.harvest.model.SourceId;
import com.contractlink.harvester.harvest.source.Scraper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
public class HarvestEngineService {
    private static final Logger log = LoggerFactory.getLogger(HarvestEngineService.class);

    private final List<Scraper> scrapers;
    private final HarvesterProperties properties;
    private final ExecutorService harvestExecutor;

    public HarvestEngineService(
        List<Scraper> scrapers,
        HarvesterProperties properties,
        @Qualifier("harvestExecutor") ExecutorService harvestExecutor
    ) {
        List<Scraper> ordered = new ArrayList<>(scrapers);
        ordered.sort(Comparator.comparing(Scraper::source));
        this.scrapers = List.copyOf(ordered);
        this.properties = properties;
        this.harvestExecutor = harvestExecutor;
    }

    public HarvestEngineResult runAll(boolean parallel) {
        return runAll(parallel, defaultFilters());
    }

    public HarvestEngineResult runAll(boolean parallel, ScrapeFilters filters) {
        List<Scraper> enabled = enabledScrapers();
        Duration budget = Duration.ofSeconds(properties.getScraperTimeoutSeconds());
        log.info(
            "Harvest starting mode={} scrapers={} budget={}s",
            parallel ? "parallel" : "sequential",
            enabled.size(),
            budget.toSeconds()
        );
        List<ScraperResult> results = parallel
            ? runParallel(enabled, filters, budget)
            : runSequential(enabled, filters, budget);
        return combine(results);
    }

    public ScrapeFilters defaultFilters() {
        HarvesterProperties.Filters filters = properties.getFilters();
        return new ScrapeFilters(new LinkedHashSet<>(filters.getStates()), filters.getKeywords(), filters.getLimit());
    }

    List<Scraper> enabledScrapers() {
        List<Scraper> enabled = new ArrayList<>();
        for (Scraper scraper : scrapers) {
            if (properties.source(scraper.source().key()).isEnabled()) {
                enabled.add(scraper);
            } else {
                log.info("{} disabled by configuration", scraper.source().key());
            }
        }
        return enabled;
    }

    private List<ScraperResult> runParallel(List<Scraper> enabled, ScrapeFilters filters, Duration budget) {
        Map<Scraper, Future<ScraperResult>> futures = new LinkedHashMap<>();
        Map<Scraper, Long> deadlines = new LinkedHashMap<>();
        for (Scraper scraper : enabled) {
            deadlines.put(scraper, System.nanoTime() + budget.toNanos());
            futures.put(scraper, harvestExecutor.submit(() -> scraper.run(filters)));
        }
        List<ScraperResult> results = new ArrayList<>();
        for (Map.Entry<Scraper, Future<ScraperResult>> entry : futures.entrySet()) {
            long remaining = Math.max(0L, deadlines.get(entry.getKey()) - System.nanoTime());
            results.add(await(entry.getKey(), entry.getValue(), remaining, budget));
        }
        return results;
    }

    private List<ScraperResult> runSequential(List<Scraper> enabled, ScrapeFilters filters, Duration budget) {
        List<ScraperResult> results = new ArrayList<>();
        for (Scraper scraper : enabled) {
            Future<ScraperResult> future = harvestExecutor.submit(() -> scraper.run(filters));
            results.add(await(scraper, future, budget.toNanos(), budget));
        }
        return results;
    }

    private ScraperResult await(Scraper scraper, Future<ScraperResult> future, long remainingNanos, Duration budget) {
        SourceId source = scraper.source();
        long startedNanos = System.nanoTime();
        try {
            ScraperResult result = future.get(remainingNanos, TimeUnit.NANOSECONDS);
            return result == null
                ? ScraperResult.failed(source, HarvestError.of(HarvestErrorKind.PARSE, source, "scraper returned no result"), Duration.ZERO)
                : result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} exceeded its {}s budget and was cancelled", source.key(), budget.toSeconds());
            return ScraperResult.failed(
                source,
                HarvestError.of(HarvestErrorKind.TIMEOUT_BUDGET, source, "exceeded " + budget.toSeconds() + "s budget"),
                budget
            );
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("{} failed with an unexpected error", source.key(), cause);
            return ScraperResult.failed(
                source,
                HarvestError.of(HarvestErrorKind.PARSE, source, "scraper_exception: " + cause),
                Duration.ofNanos(System.nanoTime() - startedNanos)
            );
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ScraperResult.failed(
                source,
                HarvestError.of(HarvestErrorKind.TIMEOUT_BUDGET, source, "interrupted while waiting"),
                Duration.ofNanos(System.nanoTime() - startedNanos)
            );
        }
    }

    HarvestEngineResult combine(List<ScraperResult> results) {
        List<ScraperResult> ordered = new ArrayList<>(results);
        ordered.sort(Comparator.comparing(ScraperResult::source));

        Map<ContractKey, ContractRecord> kept = new LinkedHashMap<>();
        int duplicates = 0;
        for (ScraperResult result : ordered) {
            for (ContractRecord record : result.records()) {
                ContractRecord winner = kept.putIfAbsent(record.key(), record);
                if (winner != null) {
                    duplicates++;
                    log.info(
                        "Duplicate {} from {} dropped; kept {}",
                        record.key(),
                        record.source().key(),
                        winner.source().key()
                    );
                }
            }
        }

        List<ContractRecord> records = List.copyOf(kept.values());
        Map<String, Integer> bySource = new LinkedHashMap<>();
        List<String> degraded = new ArrayList<>();
        List<String> zeroResults = new ArrayList<>();
        for (ScraperResult result : ordered) {
            bySource.put(result.source().key(), 0);
            if (result.degraded()) {
                degraded.add(result.source().key());
            }
            if (result.zeroResults()) {
                zeroResults.add(result.source().key());
            }
        }
        Map<String, Integer> byState = new TreeMap<>();
        for (ContractRecord record : records) {
            bySource.merge(record.source().key(), 1, Integer::sum);
            byState.merge(record.state(), 1, Integer::sum);
        }

        HarvestSummary summary = new HarvestSummary(records.size(), duplicates, bySource, byState, degraded, zeroResults);
        log.info(
            "Harvest finished records={} duplicates_removed={} degraded={} zero_results={}",
            records.size(),
            duplicates,
            degraded,
            zeroResults
        );
        return new HarvestEngineResult(records, ordered, summary);
    }
}
