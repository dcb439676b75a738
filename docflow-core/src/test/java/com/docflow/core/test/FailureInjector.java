package com.docflow.core.test;

import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Failure injection for collaborator stubs.
 * Deterministic: failures come either from a fixed count of leading calls or from a seeded
 * random rate, so a given test always sees the same sequence.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * FailureInjector injector = FailureInjector.failFirst(2);
 *
 * IntegrationGateway flaky = (target, operation, params, key) -> {
 *     injector.maybeThrow(() -> ActionException.transientFailure("UNAVAILABLE", "down"));
 *     return params;
 * };
 * }</pre>
 */
public class FailureInjector {

    private final int failFirst;
    private final double failureRate;
    private final Random random;
    private final AtomicBoolean enabled;
    private final AtomicInteger calls;
    private final AtomicInteger failureCount;

    private FailureInjector(Builder builder) {
        this.failFirst = builder.failFirst;
        this.failureRate = builder.failureRate;
        this.random = new Random(builder.seed);
        this.enabled = new AtomicBoolean(true);
        this.calls = new AtomicInteger(0);
        this.failureCount = new AtomicInteger(0);
    }

    /**
     * Create a new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fail the first {@code count} calls, then succeed.
     */
    public static FailureInjector failFirst(int count) {
        return builder().failFirst(count).build();
    }

    /**
     * Create an injector that always fails.
     */
    public static FailureInjector alwaysFail() {
        return builder().withFailureRate(1.0).build();
    }

    /**
     * Create an injector that never fails.
     */
    public static FailureInjector neverFail() {
        return builder().build();
    }

    public void enable() {
        enabled.set(true);
    }

    public void disable() {
        enabled.set(false);
    }

    /**
     * Record a call and decide whether it fails.
     */
    public synchronized boolean shouldFail() {
        int call = calls.incrementAndGet();
        if (!enabled.get()) {
            return false;
        }
        boolean fail = call <= failFirst || (failureRate > 0 && random.nextDouble() < failureRate);
        if (fail) {
            failureCount.incrementAndGet();
        }
        return fail;
    }

    /**
     * Throw the supplied exception if this call should fail.
     */
    public <E extends Exception> void maybeThrow(ExceptionSupplier<E> failure) throws E {
        if (shouldFail()) {
            throw failure.get();
        }
    }

    public int getCallCount() {
        return calls.get();
    }

    public int getFailureCount() {
        return failureCount.get();
    }

    public void reset() {
        calls.set(0);
        failureCount.set(0);
    }

    @FunctionalInterface
    public interface ExceptionSupplier<E extends Exception> {
        E get();
    }

    public static class Builder {
        private int failFirst = 0;
        private double failureRate = 0.0;
        private long seed = 42L;

        public Builder failFirst(int failFirst) {
            this.failFirst = failFirst;
            return this;
        }

        public Builder withFailureRate(double failureRate) {
            if (failureRate < 0.0 || failureRate > 1.0) {
                throw new IllegalArgumentException("Failure rate must be between 0 and 1");
            }
            this.failureRate = failureRate;
            return this;
        }

        public Builder withSeed(long seed) {
            this.seed = seed;
            return this;
        }

        public FailureInjector build() {
            return new FailureInjector(this);
        }
    }
}
