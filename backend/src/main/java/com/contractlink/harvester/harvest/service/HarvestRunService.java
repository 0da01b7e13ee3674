package com.contractlink.harvester.harvest.service;

import com.contractlink.harvester.config.HarvesterProperties;
import com.contractlink.harvester.harvest.model.HarvestEngineResult;
import com.contractlink.harvester.harvest.model.HarvestError;
import com.contractlink.harvester.harvest.model.HarvestRunReport;
import com.contractlink.harvester.harvest.model.HarvestSummary;
import com.contractlink.harvester.harvest.model.SaveResult;
import com.contractlink.harvester.harvest.model.ScraperResult;
import com.contractlink.harvester.harvest.persistence.ContractJdbcRepository;
import com.contractlink.harvester.harvest.persistence.HarvestLock;
import com.contractlink.harvester.harvest.persistence.HarvestRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * One harvest pass: engine, persistence, audit row. Callers hold the harvest lock around
 * {@link #runLocked}; {@link #runExclusive} takes it itself.
 */
@Service
public class HarvestRunService {
    private static final Logger log = LoggerFactory.getLogger(HarvestRunService.class);
    private static final int NOTE_ERROR_LIMIT = 10;

    private final HarvestEngineService engine;
    private final ContractJdbcRepository contractRepository;
    private final HarvestRunRepository runRepository;
    private final HarvestLock harvestLock;
    private final HarvesterProperties properties;
    private final Clock clock;
    private final String instanceId;

    public HarvestRunService(
        HarvestEngineService engine,
        ContractJdbcRepository contractRepository,
        HarvestRunRepository runRepository,
        HarvestLock harvestLock,
        HarvesterProperties properties,
        Clock clock
    ) {
        this.engine = engine;
        this.contractRepository = contractRepository;
        this.runRepository = runRepository;
        this.harvestLock = harvestLock;
        this.properties = properties;
        this.clock = clock;
        this.instanceId = ManagementFactory.getRuntimeMXBean().getName();
    }

    public HarvestRunReport runExclusive(String trigger, boolean parallel) {
        String owner = newOwner(trigger);
        if (!harvestLock.tryAcquire(owner, lockTtl())) {
            throw new ActiveHarvestRunException("A harvest pass is already running");
        }
        try {
            return runLocked(trigger, parallel);
        } finally {
            releaseQuietly(owner);
        }
    }

    public HarvestRunReport runLocked(String trigger, boolean parallel) {
        Instant startedAt = clock.instant();
        long runId = runRepository.insertRun(startedAt, trigger);
        log.info("Harvest run {} started trigger={} parallel={}", runId, trigger, parallel);
        try {
            HarvestEngineResult result = engine.runAll(parallel);
            SaveResult saved = contractRepository.saveAll(result.records());
            HarvestSummary summary = result.summary();
            String status = summary.degradedSources().isEmpty() && saved.failed() == 0
                ? HarvestRunReport.STATUS_COMPLETED
                : HarvestRunReport.STATUS_COMPLETED_WITH_ERRORS;
            HarvestRunReport report = new HarvestRunReport(
                runId,
                trigger,
                status,
                summary.totalRecords(),
                saved.inserted(),
                saved.updated(),
                saved.failed(),
                summary.duplicatesRemoved(),
                summary.degradedSources(),
                summary.zeroResultSources(),
                summary.bySource(),
                summary.byState(),
                startedAt,
                clock.instant(),
                notes(result, saved)
            );
            runRepository.completeRun(report);
            log.info(
                "Harvest run {} {} records={} inserted={} updated={} failed={} degraded={}",
                runId,
                status,
                report.recordsFound(),
                report.inserted(),
                report.updated(),
                report.failed(),
                report.degradedSources()
            );
            return report;
        } catch (RuntimeException e) {
            log.warn("Harvest run {} failed", runId, e);
            try {
                runRepository.failRun(runId, clock.instant(), e.getMessage());
            } catch (DataAccessException auditFailure) {
                log.warn("Failed to mark harvest run {} as failed", runId, auditFailure);
            }
            throw e;
        }
    }

    public Optional<HarvestRunReport> latestRun() {
        return runRepository.findLatest();
    }

    public String newOwner(String trigger) {
        return trigger + "@" + instanceId + "#" + UUID.randomUUID().toString().substring(0, 8);
    }

    public Duration lockTtl() {
        return Duration.ofMinutes(properties.getSchedule().getLockTtlMinutes());
    }

    void releaseQuietly(String owner) {
        try {
            harvestLock.release(owner);
        } catch (DataAccessException e) {
            log.warn("Failed to release harvest lock held by {}", owner, e);
        }
    }

    private String notes(HarvestEngineResult result, SaveResult saved) {
        List<String> lines = new ArrayList<>();
        for (ScraperResult scraper : result.scraperResults()) {
            for (HarvestError error : scraper.errors()) {
                if (lines.size() >= NOTE_ERROR_LIMIT) {
                    break;
                }
                if (error.degradesSource()) {
                    lines.add(error.toString());
                }
            }
        }
        for (HarvestError error : saved.errors()) {
            if (lines.size() >= NOTE_ERROR_LIMIT) {
                break;
            }
            lines.add(error.toString());
        }
        return lines.isEmpty() ? null : String.join("; ", lines);
    }
}
