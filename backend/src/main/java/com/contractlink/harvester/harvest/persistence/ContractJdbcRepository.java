package com.contractlink.harvester.harvest.persistence;

import com.contractlink.harvester.harvest.model.ContractRecord;
import com.contractlink.harvester.harvest.model.HarvestError;
import com.contractlink.harvester.harvest.model.HarvestErrorKind;
import com.contractlink.harvester.harvest.model.SaveResult;
import com.contractlink.harvester.harvest.model.SourceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

@Repository
public class ContractJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(ContractJdbcRepository.class);
    private static final Pattern STATE_CODE = Pattern.compile("[A-Z]{2}");
    private static final int MAX_TITLE_LENGTH = 1000;
    private static final int MAX_AGENCY_LENGTH = 500;
    private static final int MAX_LINK_LENGTH = 2048;

    private static final String UPDATE_SQL = """
        UPDATE contracts
        SET title = :title,
            due_date = COALESCE(:dueDate, due_date),
            link = :link,
            agency = COALESCE(NULLIF(:agency, ''), agency),
            description = COALESCE(:description, description),
            organization_type = COALESCE(:organizationType, organization_type),
            naics_code = COALESCE(:naicsCode, naics_code),
            last_seen_at = :now
        WHERE state = :state
          AND solicitation_number = :solicitationNumber
        """;

    private static final String INSERT_SQL = """
        INSERT INTO contracts (
            state,
            solicitation_number,
            title,
            due_date,
            link,
            agency,
            source,
            description,
            organization_type,
            naics_code,
            scraped_at,
            first_seen_at,
            last_seen_at
        )
        VALUES (
            :state,
            :solicitationNumber,
            :title,
            :dueDate,
            :link,
            :agency,
            :source,
            :description,
            :organizationType,
            :naicsCode,
            :scrapedAt,
            :now,
            :now
        )
        """;

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public ContractJdbcRepository(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    /**
     * Upserts each record on its own; a bad record is counted and skipped, never aborting the batch.
     */
    public SaveResult saveAll(List<ContractRecord> records) {
        int inserted = 0;
        int updated = 0;
        int failed = 0;
        List<HarvestError> errors = new ArrayList<>();
        for (ContractRecord record : records) {
            String invalid = validate(record);
            if (invalid != null) {
                failed++;
                log.warn("Skipping invalid contract {}: {}", record == null ? null : record.key(), invalid);
                errors.add(HarvestError.of(HarvestErrorKind.VALIDATION, record == null ? null : record.source(), invalid));
                continue;
            }
            try {
                if (upsert(record)) {
                    inserted++;
                } else {
                    updated++;
                }
            } catch (DataAccessException e) {
                failed++;
                log.warn("Failed to save contract {} from {}", record.key(), record.source().key(), e);
                errors.add(HarvestError.of(
                    HarvestErrorKind.PERSISTENCE,
                    record.source(),
                    record.key() + ": " + e.getMostSpecificCause().getMessage()
                ));
            }
        }
        log.info("Saved contracts inserted={} updated={} failed={}", inserted, updated, failed);
        return new SaveResult(inserted, updated, failed, errors);
    }

    /**
     * Returns true when a new row was inserted, false when an existing row was updated.
     */
    boolean upsert(ContractRecord record) {
        MapSqlParameterSource params = params(record, clock.instant());
        int updated = jdbc.update(UPDATE_SQL, params);
        if (updated > 0) {
            return false;
        }
        try {
            jdbc.update(INSERT_SQL, params);
            return true;
        } catch (DataIntegrityViolationException raced) {
            jdbc.update(UPDATE_SQL, params);
            return false;
        }
    }

    public Optional<ContractRecord> findByKey(String state, String solicitationNumber) {
        List<ContractRecord> rows = jdbc.query(
            """
                SELECT state, title, solicitation_number, due_date, link, agency, source,
                       scraped_at, description, organization_type, naics_code
                FROM contracts
                WHERE state = :state
                  AND solicitation_number = :solicitationNumber
                """,
            new MapSqlParameterSource()
                .addValue("state", state)
                .addValue("solicitationNumber", solicitationNumber),
            contractRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<ContractRecord> findRecentlySeen(int limit) {
        return jdbc.query(
            """
                SELECT state, title, solicitation_number, due_date, link, agency, source,
                       scraped_at, description, organization_type, naics_code
                FROM contracts
                ORDER BY last_seen_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource("limit", Math.max(0, limit)),
            contractRowMapper()
        );
    }

    public long countContracts() {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM contracts", Long.class);
        return count == null ? 0L : count;
    }

    private String validate(ContractRecord record) {
        if (record == null) {
            return "record is null";
        }
        if (record.state() == null || !STATE_CODE.matcher(record.state()).matches()) {
            return "state must be a two-letter code: " + record.state();
        }
        if (record.title() == null || record.title().isBlank()) {
            return "title is required";
        }
        if (record.solicitationNumber() == null || record.solicitationNumber().isBlank()) {
            return "solicitation number is required";
        }
        if (record.link() == null || record.link().isBlank()) {
            return "link is required";
        }
        if (record.link().length() > MAX_LINK_LENGTH) {
            return "link exceeds " + MAX_LINK_LENGTH + " characters";
        }
        if (record.source() == null) {
            return "source is required";
        }
        return null;
    }

    private MapSqlParameterSource params(ContractRecord record, Instant now) {
        return new MapSqlParameterSource()
            .addValue("state", record.state())
            .addValue("solicitationNumber", record.solicitationNumber())
            .addValue("title", truncate(record.title(), MAX_TITLE_LENGTH))
            .addValue("dueDate", toDate(record.dueDate()), Types.DATE)
            .addValue("link", record.link())
            .addValue("agency", truncate(record.agency() == null ? "" : record.agency(), MAX_AGENCY_LENGTH))
            .addValue("source", record.source().key())
            .addValue("description", record.description(), Types.VARCHAR)
            .addValue("organizationType", record.organizationType(), Types.VARCHAR)
            .addValue("naicsCode", record.naicsCode(), Types.VARCHAR)
            .addValue("scrapedAt", toTimestamp(record.scrapedAt() == null ? now : record.scrapedAt()))
            .addValue("now", toTimestamp(now));
    }

    private RowMapper<ContractRecord> contractRowMapper() {
        return (rs, rowNum) -> new ContractRecord(
            rs.getString("state"),
            rs.getString("title"),
            rs.getString("solicitation_number"),
            toLocalDate(rs.getDate("due_date")),
            rs.getString("link"),
            rs.getString("agency"),
            SourceId.fromKey(rs.getString("source")),
            toInstant(rs.getTimestamp("scraped_at")),
            rs.getString("description"),
            rs.getString("organization_type"),
            rs.getString("naics_code")
        );
    }

    private static String truncate(String value, int max) {
        return value == null || value.length() <= max ? value : value.substring(0, max);
    }

    private Date toDate(LocalDate value) {
        return value == null ? null : Date.valueOf(value);
    }

    private LocalDate toLocalDate(Date value) {
        return value == null ? null : value.toLocalDate();
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
