package com.contractlink.harvester.harvest.model;

import java.util.List;
import java.util.Map;

public record HarvestSummary(
    int totalRecords,
    int duplicatesRemoved,
    Map<String, Integer> bySource,
    Map<String, Integer> byState,
    List<String> degradedSources,
    List<String> zeroResultSources
) {
}
