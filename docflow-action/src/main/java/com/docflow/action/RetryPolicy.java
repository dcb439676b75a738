package com.docflow.action;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded exponential backoff for transient action failures.
 * Fixed at executor construction.
 *
 * Invariants:
 * - maxAttempts >= 1
 * - maxBackoff >= initialBackoff >= 0
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    double jitterFactor,
    Set<String> retryableErrors,
    Set<String> nonRetryableErrors
) {
    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialBackoff == null || initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be >= 0");
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0, 1]");
        }
        retryableErrors = retryableErrors == null ? Set.of() : Set.copyOf(retryableErrors);
        nonRetryableErrors = nonRetryableErrors == null ? Set.of() : Set.copyOf(nonRetryableErrors);
    }

    /**
     * 5 attempts, 200ms doubling up to 30s, 10% jitter.
     */
    public static RetryPolicy defaultPolicy() {
        return builder().build();
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0, 0.0, Set.of(), Set.of());
    }

    /**
     * Delay before the attempt following {@code failedAttempt}.
     *
     * @param failedAttempt 1-indexed number of the attempt that just failed
     */
    public Duration computeBackoff(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }

        double baseMs = initialBackoff.toMillis() * Math.pow(backoffMultiplier, failedAttempt - 1);
        double cappedMs = Math.min(baseMs, maxBackoff.toMillis());

        // spread within +/- jitterFactor of the capped value
        double jitterRange = cappedMs * jitterFactor;
        double jitteredMs = cappedMs - jitterRange + ThreadLocalRandom.current().nextDouble() * 2 * jitterRange;

        return Duration.ofMillis((long) jitteredMs);
    }

    /**
     * Whether a failure may be retried at all, regardless of attempts left.
     * Permanent failures are never retried; transient ones are filtered by error code.
     */
    public boolean shouldRetry(ActionException failure) {
        if (!failure.isTransient()) {
            return false;
        }
        String errorCode = failure.getErrorCode();
        if (nonRetryableErrors.contains(errorCode)) {
            return false;
        }
        return retryableErrors.isEmpty() || retryableErrors.contains(errorCode);
    }

    public boolean hasMoreAttempts(int currentAttempt) {
        return currentAttempt < maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofMillis(200);
        private Duration maxBackoff = Duration.ofSeconds(30);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.1;
        private Set<String> retryableErrors = Set.of();
        private Set<String> nonRetryableErrors = Set.of();

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

        public Builder retryableErrors(Set<String> retryableErrors) {
            this.retryableErrors = retryableErrors;
            return this;
        }

        public Builder nonRetryableErrors(Set<String> nonRetryableErrors) {
            this.nonRetryableErrors = nonRetryableErrors;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff,
                backoffMultiplier, jitterFactor, retryableErrors, nonRetryableErrors);
        }
    }
}
