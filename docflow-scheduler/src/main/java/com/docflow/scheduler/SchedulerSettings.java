package com.docflow.scheduler;

import java.time.Duration;

/**
 * @param pollInterval delay between background polls
 * @param batchSize max timers handled per poll
 * @param missThreshold lateness above which a firing is logged as missed
 * @param maxFireAttempts callback errors tolerated before a timer is dropped
 */
public record SchedulerSettings(
    Duration pollInterval,
    int batchSize,
    Duration missThreshold,
    int maxFireAttempts
) {
    public SchedulerSettings {
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be >= 1");
        }
        missThreshold = missThreshold == null ? Duration.ofMinutes(1) : missThreshold;
        maxFireAttempts = Math.max(1, maxFireAttempts);
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(Duration.ofSeconds(5), 100, Duration.ofMinutes(1), 3);
    }
}
