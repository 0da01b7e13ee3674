package com.contractlink.harvester.harvest.persistence;

import com.contractlink.harvester.harvest.model.HarvestRunReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Audit rows for harvest passes. One row per pass, inserted as RUNNING and completed at the end.
 */
@Repository
public class HarvestRunRepository {
    private static final Logger log = LoggerFactory.getLogger(HarvestRunRepository.class);
    private static final TypeReference<LinkedHashMap<String, Integer>> MAP_INT = new TypeReference<>() {};
    private static final int MAX_NOTES_LENGTH = 2000;

    private final NamedParameterJdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public HarvestRunRepository(NamedParameterJdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    public long insertRun(Instant startedAt, String trigger) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("trigger", trigger)
            .addValue("status", HarvestRunReport.STATUS_RUNNING);

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO harvest_runs (trigger_type, status, started_at)
                VALUES (:trigger, :status, :startedAt)
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert harvest run");
        }
        return key.longValue();
    }

    public void completeRun(HarvestRunReport report) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("runId", report.runId())
            .addValue("status", report.status())
            .addValue("finishedAt", toTimestamp(report.finishedAt()))
            .addValue("recordsFound", report.recordsFound())
            .addValue("inserted", report.inserted())
            .addValue("updated", report.updated())
            .addValue("failed", report.failed())
            .addValue("duplicatesRemoved", report.duplicatesRemoved())
            .addValue("degradedSources", joinList(report.degradedSources()))
            .addValue("zeroResultSources", joinList(report.zeroResultSources()))
            .addValue("bySource", toJson(report.bySource()))
            .addValue("byState", toJson(report.byState()))
            .addValue("notes", truncate(report.notes()));
        jdbc.update(
            """
                UPDATE harvest_runs
                SET status = :status,
                    finished_at = :finishedAt,
                    records_found = :recordsFound,
                    inserted_count = :inserted,
                    updated_count = :updated,
                    failed_count = :failed,
                    duplicates_removed = :duplicatesRemoved,
                    degraded_sources = :degradedSources,
                    zero_result_sources = :zeroResultSources,
                    by_source_json = :bySource,
                    by_state_json = :byState,
                    notes = :notes
                WHERE id = :runId
                """,
            params
        );
    }

    public void failRun(long runId, Instant finishedAt, String notes) {
        jdbc.update(
            """
                UPDATE harvest_runs
                SET status = :status,
                    finished_at = :finishedAt,
                    notes = :notes
                WHERE id = :runId
                """,
            new MapSqlParameterSource()
                .addValue("runId", runId)
                .addValue("status", HarvestRunReport.STATUS_FAILED)
                .addValue("finishedAt", toTimestamp(finishedAt))
                .addValue("notes", truncate(notes))
        );
    }

    public Optional<HarvestRunReport> findLatest() {
        List<HarvestRunReport> rows = jdbc.query(
            """
                SELECT *
                FROM harvest_runs
                ORDER BY started_at DESC, id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource(),
            runRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private RowMapper<HarvestRunReport> runRowMapper() {
        return (rs, rowNum) -> new HarvestRunReport(
            rs.getLong("id"),
            rs.getString("trigger_type"),
            rs.getString("status"),
            rs.getInt("records_found"),
            rs.getInt("inserted_count"),
            rs.getInt("updated_count"),
            rs.getInt("failed_count"),
            rs.getInt("duplicates_removed"),
            splitList(rs.getString("degraded_sources")),
            splitList(rs.getString("zero_result_sources")),
            fromJson(rs.getString("by_source_json")),
            fromJson(rs.getString("by_state_json")),
            toInstant(rs.getTimestamp("started_at")),
            toInstant(rs.getTimestamp("finished_at")),
            rs.getString("notes")
        );
    }

    private String toJson(Map<String, Integer> value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize run counts", e);
            return null;
        }
    }

    private Map<String, Integer> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_INT);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse run counts {}", json, e);
            return Map.of();
        }
    }

    private static String joinList(List<String> values) {
        return values == null || values.isEmpty() ? null : String.join(",", values);
    }

    private static List<String> splitList(String joined) {
        if (joined == null || joined.isBlank()) {
            return List.of();
        }
        return Arrays.stream(joined.split(",")).map(String::trim).filter(value -> !value.isEmpty()).toList();
    }

    private static String truncate(String notes) {
        return notes == null || notes.length() <= MAX_NOTES_LENGTH ? notes : notes.substring(0, MAX_NOTES_LENGTH);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
