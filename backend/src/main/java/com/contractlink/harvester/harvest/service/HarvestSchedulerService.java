package com.contractlink.harvester.harvest.service;

import com.contractlink.harvester.config.HarvesterProperties;
import com.contractlink.harvester.harvest.persistence.HarvestLock;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class HarvestSchedulerService {
    private static final Logger log = LoggerFactory.getLogger(HarvestSchedulerService.class);
    static final String TRIGGER = "scheduler";

    private final HarvestRunService runService;
    private final HarvestLock harvestLock;
    private final HarvesterProperties properties;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private volatile ScheduledExecutorService scheduler;

    public HarvestSchedulerService(
        HarvestRunService runService,
        HarvestLock harvestLock,
        HarvesterProperties properties,
        Clock clock
    ) {
        this.runService = runService;
        this.harvestLock = harvestLock;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getSchedule().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public boolean isRunning() {
        return running.get();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            HarvesterProperties.Schedule schedule = properties.getSchedule();
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("harvest-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            Duration firstDelay = scheduleNextSlot();
            log.info(
                "Harvest scheduler started; first pass in {} min, then every {} h from {}:00 {}",
                firstDelay.toMinutes(),
                schedule.getIntervalHours(),
                schedule.getStartHour(),
                schedule.getZone()
            );
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            if (scheduler != null) {
                scheduler.shutdownNow();
                try {
                    scheduler.awaitTermination(5, TimeUnit.SECONDS);
                } catch (InterruptedException ignored) {
                    Thread.currentThread().interrupt();
                }
                scheduler = null;
            }
        }
    }

    /**
     * Runs one scheduled pass if this process wins the lock. Returns false when the tick was skipped.
     */
    public boolean tick() {
        String owner = runService.newOwner(TRIGGER);
        boolean acquired;
        try {
            acquired = harvestLock.tryAcquire(owner, runService.lockTtl());
        } catch (RuntimeException e) {
            log.warn("Scheduled harvest skipped; lock unavailable", e);
            return false;
        }
        if (!acquired) {
            log.info("Scheduled harvest skipped; another instance holds the lock");
            return false;
        }
        try {
            runService.runLocked(TRIGGER, properties.isParallel());
        } catch (RuntimeException e) {
            log.warn("Scheduled harvest failed", e);
        } finally {
            runService.releaseQuietly(owner);
        }
        return true;
    }

    private void runSlot() {
        try {
            tick();
        } finally {
            scheduleNextSlot();
        }
    }

    private Duration scheduleNextSlot() {
        Duration delay = delayToNextSlot(clock.instant());
        ScheduledExecutorService current = scheduler;
        if (!running.get() || current == null) {
            return delay;
        }
        try {
            current.schedule(this::runSlot, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Harvest scheduler stopped; next slot not scheduled");
        }
        return delay;
    }

    /**
     * Time from {@code now} to the next slot: start-hour on the local clock of the configured zone,
     * repeating every interval-hours of local time.
     */
    Duration delayToNextSlot(Instant now) {
        HarvesterProperties.Schedule schedule = properties.getSchedule();
        ZoneId zone = ZoneId.of(schedule.getZone());
        LocalDateTime slot = now.atZone(zone).toLocalDate().minusDays(1).atTime(schedule.getStartHour(), 0);
        while (!slot.atZone(zone).toInstant().isAfter(now)) {
            slot = slot.plusHours(schedule.getIntervalHours());
        }
        return Duration.between(now, slot.atZone(zone).toInstant());
    }
}
