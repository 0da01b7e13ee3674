package com.contractlink.harvester.harvest.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record HarvestRunReport(
    @JsonProperty("run_id") long runId,
    @JsonProperty("trigger") String trigger,
    @JsonProperty("status") String status,
    @JsonProperty("records_found") int recordsFound,
    @JsonProperty("inserted") int inserted,
    @JsonProperty("updated") int updated,
    @JsonProperty("failed") int failed,
    @JsonProperty("duplicates_removed") int duplicatesRemoved,
    @JsonProperty("degraded_sources") List<String> degradedSources,
    @JsonProperty("zero_result_sources") List<String> zeroResultSources,
    @JsonProperty("by_source") Map<String, Integer> bySource,
    @JsonProperty("by_state") Map<String, Integer> byState,
    @JsonProperty("started_at") Instant startedAt,
    @JsonProperty("finished_at") Instant finishedAt,
    @JsonProperty("notes") String notes
) {
    public static final String STATUS_RUNNING = "RUNNING";
    public static final String STATUS_COMPLETED = "COMPLETED";
    public static final String STATUS_COMPLETED_WITH_ERRORS = "COMPLETED_WITH_ERRORS";
    public static final String STATUS_FAILED = "FAILED";
}
