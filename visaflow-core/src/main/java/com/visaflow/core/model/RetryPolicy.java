package com.visaflow.core.model;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry behavior for collaborator calls made while committing a transition.
 * Immutable and reusable.
 * 
 * Invariants:
 * - maxAttempts >= 1
 * - maxBackoff >= initialBackoff
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    double jitterFactor
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0.0, 1.0]");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
    }

    /**
     * Default policy for store writes: 3 attempts, 200ms exponential backoff.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(
            3,
            Duration.ofMillis(200),
            Duration.ofSeconds(5),
            2.0,
            0.1
        );
    }

    /**
     * No retry policy: single attempt only.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(
            1,
            Duration.ZERO,
            Duration.ZERO,
            1.0,
            0.0
        );
    }

    /**
     * Compute the backoff duration after a given failed attempt.
     * 
     * @param attemptNumber 1-indexed attempt number
     * @return Duration to wait before next attempt
     */
    public Duration computeBackoff(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }
        
        // initialBackoff * (multiplier ^ (attempt - 1))
        double baseBackoffMs = initialBackoff.toMillis() * 
            Math.pow(backoffMultiplier, attemptNumber - 1);
        
        double cappedBackoffMs = Math.min(baseBackoffMs, maxBackoff.toMillis());
        
        // backoff * (1 - jitter + random(0, 2*jitter))
        double jitterRange = cappedBackoffMs * jitterFactor;
        double jitteredBackoffMs = cappedBackoffMs - jitterRange + 
            ThreadLocalRandom.current().nextDouble() * 2 * jitterRange;
        
        return Duration.ofMillis((long) jitteredBackoffMs);
    }

    /**
     * Check if more attempts are available.
     * 
     * @param currentAttempt Current attempt number (1-indexed)
     * @return true if more attempts can be made
     */
    public boolean hasMoreAttempts(int currentAttempt) {
        return currentAttempt < maxAttempts;
    }

    /**
     * Builder for RetryPolicy.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private Duration maxBackoff = Duration.ofSeconds(5);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.1;

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
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

        public Builder jitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(
                maxAttempts, initialBackoff, maxBackoff,
                backoffMultiplier, jitterFactor
            );
        }
    }
}
