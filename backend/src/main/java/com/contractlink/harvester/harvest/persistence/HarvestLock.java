package com.contractlink.harvester.harvest.persistence;

import java.time.Duration;

/**
 * Cluster-wide mutual exclusion for harvest passes. A lease expires after its TTL so a crashed
 * holder cannot block later passes forever.
 */
public interface HarvestLock {
    boolean tryAcquire(String owner, Duration ttl);

    void release(String owner);
}
