package com.contractlink.harvester.harvest.model;

import java.time.Duration;
import java.util.List;

public record ScraperResult(
    SourceId source,
    int rawCount,
    int keywordMatchedCount,
    int normalizedCount,
    List<HarvestError> errors,
    Duration duration,
    boolean degraded,
    boolean zeroResults,
    List<ContractRecord> records
) {
    public ScraperResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        records = records == null ? List.of() : List.copyOf(records);
        duration = duration == null ? Duration.ZERO : duration;
    }

    public static ScraperResult failed(SourceId source, HarvestError error, Duration duration) {
        return new ScraperResult(source, 0, 0, 0, List.of(error), duration, true, false, List.of());
    }

    public static ScraperResult skipped(SourceId source) {
        return new ScraperResult(source, 0, 0, 0, List.of(), Duration.ZERO, false, false, List.of());
    }
}
