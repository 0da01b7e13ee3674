package com.contractlink.harvester.harvest.service;

import com.contractlink.harvester.config.HarvesterProperties;
import com.contractlink.harvester.harvest.model.ContractRecord;
import com.contractlink.harvester.harvest.model.HarvestRunReport;
import com.contractlink.harvester.harvest.persistence.ContractJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

@Component
public class HarvestCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(HarvestCliRunner.class);

    private final HarvesterProperties properties;
    private final HarvestRunService runService;
    private final ContractJdbcRepository contractRepository;
    private final ConfigurableApplicationContext applicationContext;

    public HarvestCliRunner(
        HarvesterProperties properties,
        HarvestRunService runService,
        ContractJdbcRepository contractRepository,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.runService = runService;
        this.contractRepository = contractRepository;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        boolean parallel = properties.isParallel();
        if (args.containsOption("sequential")) {
            parallel = false;
        }
        HarvestRunReport report = runService.runExclusive("cli", parallel);
        log.info(
            "Harvest run {} completed with status {}: records={} inserted={} updated={} failed={} duplicates={}",
            report.runId(),
            report.status(),
            report.recordsFound(),
            report.inserted(),
            report.updated(),
            report.failed(),
            report.duplicatesRemoved()
        );
        report.bySource().forEach((source, count) -> log.info("  {}: {}", source, count));
        if (!report.degradedSources().isEmpty()) {
            log.warn("Degraded sources: {}", report.degradedSources());
        }
        if (!report.zeroResultSources().isEmpty()) {
            log.warn("Sources with zero listings (check selectors): {}", report.zeroResultSources());
        }
        for (ContractRecord record : contractRepository.findRecentlySeen(properties.getCli().getSampleSize())) {
            log.info(
                "Sample [{}] {} | {} | due {} | {} | {}",
                record.state(),
                record.solicitationNumber(),
                record.title(),
                record.dueDateIso(),
                record.source() == null ? "?" : record.source().key(),
                record.link()
            );
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
