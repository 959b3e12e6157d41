package com.concierge.core.model;

import java.time.Duration;

/**
 * Configuration for retry behavior of transiently failing tasks.
 * Immutable and shared by all workers.
 *
 * Invariants:
 * - maxRetries >= 0
 * - initialBackoff > 0
 * - maxBackoff >= initialBackoff
 * - backoffMultiplier >= 1.0
 */
public record RetryPolicy(
    int maxRetries,
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier
) {
    /**
     * Retries allowed after the first attempt.
     */
    public static final int MAX_RETRIES = 3;

    /**
     * Base of the exponential backoff: retry n waits BACKOFF_BASE_SECONDS^n seconds.
     */
    public static final int BACKOFF_BASE_SECONDS = 2;

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new IllegalArgumentException("initialBackoff must be > 0");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
    }

    /**
     * Default policy: 3 retries, waiting 2s, 4s, 8s.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(
            MAX_RETRIES,
            Duration.ofSeconds(BACKOFF_BASE_SECONDS),
            Duration.ofMinutes(5),
            BACKOFF_BASE_SECONDS
        );
    }

    /**
     * No retry policy: single attempt only.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, Duration.ofSeconds(1), Duration.ofSeconds(1), 1.0);
    }

    /**
     * Compute the delay before a retry.
     *
     * @param retryCount 1-indexed retry number (the value retryCount takes after the failure)
     * @return Duration to wait before re-delivering the task
     */
    public Duration computeBackoff(int retryCount) {
        if (retryCount < 1) {
            throw new IllegalArgumentException("Retry count must be >= 1");
        }

        // initialBackoff * (multiplier ^ (retry - 1)), so the default gives 2^retry seconds
        double backoffMs = initialBackoff.toMillis() * Math.pow(backoffMultiplier, retryCount - 1);
        double cappedMs = Math.min(backoffMs, maxBackoff.toMillis());
        return Duration.ofMillis((long) cappedMs);
    }

    /**
     * Check if a task that has now failed {@code retryCount} times may be re-queued.
     *
     * @param retryCount retry count after incrementing for the latest failure
     */
    public boolean allowsRetry(int retryCount) {
        return retryCount <= maxRetries;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxRetries = MAX_RETRIES;
        private Duration initialBackoff = Duration.ofSeconds(BACKOFF_BASE_SECONDS);
        private Duration maxBackoff = Duration.ofMinutes(5);
        private double backoffMultiplier = BACKOFF_BASE_SECONDS;

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(maxRetries, initialBackoff, maxBackoff, backoffMultiplier);
        }
    }
}
