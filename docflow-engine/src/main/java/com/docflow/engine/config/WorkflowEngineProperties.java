package com.docflow.engine.config;

import com.docflow.action.RetryPolicy;
import com.docflow.scheduler.SchedulerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;

/**
 * Configuration properties for the workflow engine.
 *
 * <p>
 * Example configuration:
 * <pre>
 * docflow.engine.default-actor=system
 * docflow.engine.history-snapshot-variables=16
 * docflow.engine.max-conflict-retries=3
 * docflow.engine.retry.max-attempts=5
 * docflow.engine.retry.initial-backoff=200ms
 * docflow.engine.scheduler.poll-interval=5s
 * docflow.engine.scheduler.miss-threshold=1m
 * </pre>
 */
@ConfigurationProperties(prefix = "docflow.engine")
public class WorkflowEngineProperties {

    /**
     * Actor id recorded on timeouts and escalations.
     */
    private String defaultActor = "system";

    /**
     * Max variables captured in the snapshot of a history entry.
     */
    private int historySnapshotVariables = 16;

    /**
     * Attempts for a stimulus that loses a version race before the conflict is surfaced.
     */
    private int maxConflictRetries = 3;

    @NestedConfigurationProperty
    private Retry retry = new Retry();

    @NestedConfigurationProperty
    private Scheduler scheduler = new Scheduler();

    public String getDefaultActor() {
        return defaultActor;
    }

    public void setDefaultActor(String defaultActor) {
        this.defaultActor = defaultActor;
    }

    public int getHistorySnapshotVariables() {
        return historySnapshotVariables;
    }

    public void setHistorySnapshotVariables(int historySnapshotVariables) {
        this.historySnapshotVariables = historySnapshotVariables;
    }

    public int getMaxConflictRetries() {
        return maxConflictRetries;
    }

    public void setMaxConflictRetries(int maxConflictRetries) {
        this.maxConflictRetries = maxConflictRetries;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Retry of transient action failures.
     */
    public static class Retry {
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofMillis(200);
        private Duration maxBackoff = Duration.ofSeconds(30);
        private double multiplier = 2.0;
        private double jitter = 0.1;

        public RetryPolicy toPolicy() {
            return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .initialBackoff(initialBackoff)
                .maxBackoff(maxBackoff)
                .backoffMultiplier(multiplier)
                .jitterFactor(jitter)
                .build();
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }

    /**
     * Timer and escalation polling.
     */
    public static class Scheduler {
        private boolean autoStart = true;
        private Duration pollInterval = Duration.ofSeconds(5);
        private int batchSize = 100;
        private Duration missThreshold = Duration.ofMinutes(1);
        private int maxFireAttempts = 3;

        public SchedulerSettings toSettings() {
            return new SchedulerSettings(pollInterval, batchSize, missThreshold, maxFireAttempts);
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getMissThreshold() {
            return missThreshold;
        }

        public void setMissThreshold(Duration missThreshold) {
            this.missThreshold = missThreshold;
        }

        public int getMaxFireAttempts() {
            return maxFireAttempts;
        }

        public void setMaxFireAttempts(int maxFireAttempts) {
            this.maxFireAttempts = maxFireAttempts;
        }
    }
}
