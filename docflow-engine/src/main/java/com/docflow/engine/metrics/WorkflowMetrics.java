package com.docflow.engine.metrics;

import com.docflow.action.ActionException;
import com.docflow.action.ActionListener;
import com.docflow.action.ActionRequest;
import com.docflow.core.exception.ActionFailedException;
import com.docflow.core.model.WorkflowStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Operational metrics for the workflow engine.
 *
 * Metrics exposed:
 * - Instance counts by status
 * - Started / completed / failed / cancelled counters per definition
 * - Transition counts by kind, guard denials, version conflicts
 * - Escalation and timer firings, missed timers
 * - Action retries and final failures
 *
 * Until bound to a registry, meters are recorded in a private SimpleMeterRegistry.
 */
public class WorkflowMetrics implements MeterBinder, ActionListener {

    // Metric names
    public static final String INSTANCE_COUNT = "docflow.instances";
    public static final String INSTANCES_STARTED = "docflow.instances.started";
    public static final String INSTANCES_COMPLETED = "docflow.instances.completed";
    public static final String INSTANCES_FAILED = "docflow.instances.failed";
    public static final String INSTANCES_CANCELLED = "docflow.instances.cancelled";
    public static final String INSTANCE_DURATION = "docflow.instance.duration";

    public static final String TRANSITIONS = "docflow.transitions";
    public static final String GUARD_DENIALS = "docflow.guard.denials";
    public static final String VERSION_CONFLICTS = "docflow.version.conflicts";

    public static final String ESCALATIONS = "docflow.escalations";
    public static final String TIMERS_FIRED = "docflow.timers.fired";
    public static final String TIMERS_MISSED = "docflow.timers.missed";

    public static final String ACTION_RETRIES = "docflow.action.retries";
    public static final String ACTION_FAILURES = "docflow.action.failures";

    private volatile MeterRegistry registry = new SimpleMeterRegistry();

    private final Map<WorkflowStatus, AtomicInteger> statusGauges = new ConcurrentHashMap<>();

    public WorkflowMetrics() {
        for (WorkflowStatus status : WorkflowStatus.values()) {
            statusGauges.put(status, new AtomicInteger(0));
        }
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;

        for (WorkflowStatus status : WorkflowStatus.values()) {
            Gauge.builder(INSTANCE_COUNT, statusGauges.get(status), AtomicInteger::get)
                .tag("status", status.name())
                .description("Number of instances in " + status + " status")
                .register(registry);
        }
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    // ========== Instance Metrics ==========

    public void instanceStarted(String definition) {
        Counter.builder(INSTANCES_STARTED)
            .tag("definition", definition)
            .description("Total instances started")
            .register(registry)
            .increment();
        statusGauges.get(WorkflowStatus.RUNNING).incrementAndGet();
    }

    public void instanceCompleted(String definition, Duration duration) {
        Counter.builder(INSTANCES_COMPLETED)
            .tag("definition", definition)
            .description("Total instances completed")
            .register(registry)
            .increment();

        Timer.builder(INSTANCE_DURATION)
            .tag("definition", definition)
            .tag("outcome", "completed")
            .description("Time from start to completion")
            .register(registry)
            .record(duration);

        statusChanged(WorkflowStatus.RUNNING, WorkflowStatus.COMPLETED);
    }

    public void instanceFailed(String definition, String errorCode) {
        Counter.builder(INSTANCES_FAILED)
            .tag("definition", definition)
            .tag("error_code", errorCode)
            .description("Total instances failed")
            .register(registry)
            .increment();
        statusChanged(WorkflowStatus.RUNNING, WorkflowStatus.FAILED);
    }

    public void instanceCancelled(String definition, WorkflowStatus from) {
        Counter.builder(INSTANCES_CANCELLED)
            .tag("definition", definition)
            .description("Total instances cancelled")
            .register(registry)
            .increment();
        statusChanged(from, WorkflowStatus.CANCELLED);
    }

    public void statusChanged(WorkflowStatus from, WorkflowStatus to) {
        statusGauges.get(from).decrementAndGet();
        statusGauges.get(to).incrementAndGet();
    }

    public int instancesIn(WorkflowStatus status) {
        return statusGauges.get(status).get();
    }

    // ========== Transition Metrics ==========

    public void transitionApplied(String definition, String kind) {
        Counter.builder(TRANSITIONS)
            .tag("definition", definition)
            .tag("kind", kind)
            .description("Accepted transitions")
            .register(registry)
            .increment();
    }

    public void guardDenied(String definition, String nodeId) {
        Counter.builder(GUARD_DENIALS)
            .tag("definition", definition)
            .tag("node", nodeId)
            .description("Transitions rejected by guards or conditions")
            .register(registry)
            .increment();
    }

    public void versionConflict(String definition) {
        Counter.builder(VERSION_CONFLICTS)
            .tag("definition", definition)
            .description("Saves rejected by optimistic versioning")
            .register(registry)
            .increment();
    }

    // ========== Timer Metrics ==========

    public void escalationFired(String definition, String nodeId) {
        Counter.builder(ESCALATIONS)
            .tag("definition", definition)
            .tag("node", nodeId)
            .description("Escalation rule firings")
            .register(registry)
            .increment();
    }

    public void timerFired(String definition) {
        Counter.builder(TIMERS_FIRED)
            .tag("definition", definition)
            .description("Timer node timeouts")
            .register(registry)
            .increment();
    }

    public void timerMissed(String kind) {
        Counter.builder(TIMERS_MISSED)
            .tag("kind", kind)
            .description("Timers delivered later than the miss threshold")
            .register(registry)
            .increment();
    }

    // ========== Action Metrics ==========

    @Override
    public void onRetry(ActionRequest request, int failedAttempt, ActionException failure) {
        Counter.builder(ACTION_RETRIES)
            .tag("action_kind", request.action().kind().name())
            .tag("error_code", failure.getErrorCode())
            .description("Action dispatch retries")
            .register(registry)
            .increment();
    }

    @Override
    public void onFailure(ActionRequest request, ActionFailedException failure) {
        Counter.builder(ACTION_FAILURES)
            .tag("action_kind", request.action().kind().name())
            .tag("error_code", failure.getCauseCode())
            .tag("transient", String.valueOf(failure.isTransient()))
            .description("Actions that failed after all attempts")
            .register(registry)
            .increment();
    }
}
