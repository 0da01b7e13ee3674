package com.contractlink.harvester.harvest.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Repository
public class JdbcHarvestLock implements HarvestLock {
    static final String LOCK_NAME = "harvest";

    private static final Logger log = LoggerFactory.getLogger(JdbcHarvestLock.class);

    private final NamedParameterJdbcTemplate jdbc;
    private final Clock clock;

    public JdbcHarvestLock(NamedParameterJdbcTemplate jdbc, Clock clock) {
        this.jdbc = jdbc;
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(String owner, Duration ttl) {
        Instant now = clock.instant();
        String safeOwner = (owner == null || owner.isBlank()) ? "unknown" : owner.trim();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("lockName", LOCK_NAME)
            .addValue("lockOwner", safeOwner)
            .addValue("now", Timestamp.from(now))
            .addValue("lockedUntil", Timestamp.from(now.plus(ttl)));

        int claimed = jdbc.update(
            """
                UPDATE harvest_locks
                SET lock_owner = :lockOwner,
                    locked_until = :lockedUntil,
                    updated_at = :now
                WHERE lock_name = :lockName
                  AND (locked_until IS NULL OR locked_until < :now OR lock_owner = :lockOwner)
                """,
            params
        );
        if (claimed > 0) {
            log.debug("Harvest lock acquired by {}", safeOwner);
            return true;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO harvest_locks (lock_name, lock_owner, locked_until, updated_at)
                    VALUES (:lockName, :lockOwner, :lockedUntil, :now)
                    """,
                params
            );
            log.debug("Harvest lock created and acquired by {}", safeOwner);
            return true;
        } catch (DataIntegrityViolationException held) {
            log.debug("Harvest lock is held by another owner; {} not admitted", safeOwner);
            return false;
        }
    }

    @Override
    public void release(String owner) {
        jdbc.update(
            """
                UPDATE harvest_locks
                SET lock_owner = NULL,
                    locked_until = NULL,
                    updated_at = :now
                WHERE lock_name = :lockName
                  AND lock_owner = :lockOwner
                """,
            new MapSqlParameterSource()
                .addValue("lockName", LOCK_NAME)
                .addValue("lockOwner", owner)
                .addValue("now", Timestamp.from(clock.instant()))
        );
    }
}
