package com.contractlink.harvester.harvest.http;

import com.contractlink.harvester.config.HarvesterProperties;
import com.contractlink.harvester.harvest.model.HttpFetchResult;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

public class RetryPolicy {
    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Duration rateLimitDelay;
    private final Duration rateLimitMaxDelay;
    private final boolean jitter;
    private final Sleeper sleeper;

    public RetryPolicy(
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        Duration rateLimitDelay,
        Duration rateLimitMaxDelay,
        boolean jitter,
        Sleeper sleeper
    ) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.rateLimitDelay = rateLimitDelay;
        this.rateLimitMaxDelay = rateLimitMaxDelay;
        this.jitter = jitter;
        this.sleeper = sleeper == null ? Sleeper.THREAD : sleeper;
    }

    public static RetryPolicy from(HarvesterProperties.Retry retry, Sleeper sleeper) {
        return new RetryPolicy(
            retry.getMaxAttempts(),
            Duration.ofMillis(retry.getBaseDelayMs()),
            Duration.ofMillis(retry.getMaxDelayMs()),
            Duration.ofMillis(retry.getRateLimitDelayMs()),
            Duration.ofMillis(retry.getRateLimitMaxDelayMs()),
            retry.isJitter(),
            sleeper
        );
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public boolean shouldRetry(HttpFetchResult result) {
        if (result == null) {
            return false;
        }
        String errorCode = result.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            return !errorCode.equals("invalid_url") && !errorCode.equals("interrupted");
        }
        int status = result.statusCode();
        return status == 408 || status == 429 || status == 403 || status >= 500;
    }

    /**
     * Delay before attempt {@code attempt + 1}. Rate-limited responses use the longer base and honour
     * Retry-After up to the rate-limit cap.
     */
    public Duration delayAfter(int attempt, HttpFetchResult result) {
        if (result != null && result.isRateLimited()) {
            if (result.retryAfter() != null && !result.retryAfter().isNegative()) {
                return min(result.retryAfter(), rateLimitMaxDelay);
            }
            return min(exponential(rateLimitDelay, attempt), rateLimitMaxDelay);
        }
        return min(exponential(baseDelay, attempt), maxDelay);
    }

    /**
     * Sleeps before the next attempt. Returns false if the thread was interrupted.
     */
    public boolean pause(int attempt, HttpFetchResult result) {
        Duration delay = withJitter(delayAfter(attempt, result));
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            sleeper.sleep(delay);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private Duration withJitter(Duration delay) {
        long delayMs = delay.toMillis();
        if (!jitter || delayMs <= 1) {
            return delay;
        }
        long half = delayMs / 2;
        return Duration.ofMillis(half + ThreadLocalRandom.current().nextLong(Math.max(1L, delayMs - half)));
    }

    private static Duration exponential(Duration base, int attempt) {
        int shift = Math.min(20, Math.max(0, attempt - 1));
        return base.multipliedBy(1L << shift);
    }

    private static Duration min(Duration left, Duration right) {
        if (right == null || right.isZero()) {
            return left;
        }
        return left.compareTo(right) <= 0 ? left : right;
    }
}
