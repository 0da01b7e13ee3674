package com.contractlink.harvester.harvest.model;

import java.util.List;

public record HarvestEngineResult(
    List<ContractRecord> records,
    List<ScraperResult> scraperResults,
    HarvestSummary summary
) {
}
