package com.docflow.engine.history;

import com.docflow.core.event.ChainVerification;
import com.docflow.core.event.EventChain;
import com.docflow.core.event.WorkflowEvent;
import com.docflow.core.event.WorkflowEventType;
import com.docflow.core.exception.NotFoundException;
import com.docflow.core.model.SemanticVersion;
import com.docflow.core.model.TransitionKind;
import com.docflow.core.model.WorkflowInstance;
import com.docflow.core.model.WorkflowStatus;
import com.docflow.core.model.WorkflowTransition;
import com.docflow.core.repository.EventRepository;
import com.docflow.core.repository.WorkflowInstanceStore;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Service for workflow execution history and analytics.
 *
 * Provides:
 * - Per-instance history: transitions, event timeline and statistics
 * - Status reconstruction from the event log
 * - Tamper checks over the event hash chain
 * - Per-definition analytics: completion times, node dwell times, escalation frequency
 */
@Service
public class ExecutionHistoryService {

    private static final Logger log = LoggerFactory.getLogger(ExecutionHistoryService.class);

    private final EventRepository eventRepository;
    private final WorkflowInstanceStore instanceStore;
    private final Clock clock;

    public ExecutionHistoryService(EventRepository eventRepository, WorkflowInstanceStore instanceStore) {
        this(eventRepository, instanceStore, Clock.systemUTC());
    }

    public ExecutionHistoryService(EventRepository eventRepository, WorkflowInstanceStore instanceStore,
                                   Clock clock) {
        this.eventRepository = eventRepository;
        this.instanceStore = instanceStore;
        this.clock = clock;
    }

    /**
     * Get full execution history for a workflow instance.
     */
    public ExecutionHistory getHistory(UUID instanceId) {
        WorkflowInstance instance = instanceStore.findById(instanceId)
            .orElseThrow(() -> new NotFoundException("WorkflowInstance", instanceId.toString()));

        List<WorkflowEvent> events = eventRepository.findByInstance(instanceId);

        return new ExecutionHistory(
            instanceId,
            instance.definitionName(),
            instance.definitionVersion(),
            instance.status(),
            instance.history(),
            events,
            buildTimeline(events),
            calculateStatistics(instance, events)
        );
    }

    /**
     * Reconstruct the status of an instance at a point in time from its event log.
     */
    public ReplayResult replayToTimestamp(UUID instanceId, Instant targetTime) {
        log.info("Replaying instance {} to {}", instanceId, targetTime);

        List<WorkflowEvent> events = eventRepository.findByInstance(instanceId).stream()
            .filter(e -> !e.timestamp().isAfter(targetTime))
            .collect(Collectors.toList());

        WorkflowStatus status = null;
        Set<String> touchedNodes = new LinkedHashSet<>();
        Instant startedAt = null;
        Instant completedAt = null;

        for (WorkflowEvent event : events) {
            touchedNodes.addAll(event.nodeIds());
            switch (event.type()) {
                case WORKFLOW_STARTED -> {
                    status = WorkflowStatus.RUNNING;
                    startedAt = event.timestamp();
                }
                case WORKFLOW_SUSPENDED -> status = WorkflowStatus.SUSPENDED;
                case WORKFLOW_RESUMED -> status = WorkflowStatus.RUNNING;
                case WORKFLOW_COMPLETED -> {
                    status = WorkflowStatus.COMPLETED;
                    completedAt = event.timestamp();
                }
                case WORKFLOW_FAILED -> {
                    status = WorkflowStatus.FAILED;
                    completedAt = event.timestamp();
                }
                case WORKFLOW_CANCELLED -> {
                    status = WorkflowStatus.CANCELLED;
                    completedAt = event.timestamp();
                }
                default -> { /* transitions, escalations and signals do not change status */ }
            }
        }

        long lastSequence = events.isEmpty() ? 0 : events.get(events.size() - 1).sequence();
        return new ReplayResult(instanceId, lastSequence, status, List.copyOf(touchedNodes),
            startedAt, completedAt, events.size());
    }

    /**
     * Check that an instance's event log is still the chain it was written as.
     */
    public ChainVerification verify(UUID instanceId) {
        ChainVerification result = EventChain.verify(instanceId, eventRepository.findByInstance(instanceId));
        if (result.intact()) {
            log.debug("Event chain of instance {} intact ({} events)", instanceId, result.eventsChecked());
        } else {
            log.warn("Event chain of instance {} broken at sequence {}: {} issue(s)", instanceId,
                result.firstBrokenSequence().orElse(null), result.issues().size());
        }
        return result;
    }

    // ========== Analytics ==========

    /**
     * Aggregate figures over every instance of a definition name, across versions.
     */
    public WorkflowAnalytics analyze(String definitionName) {
        List<WorkflowInstance> instances = instanceStore.findAll().stream()
            .filter(i -> definitionName.equals(i.definitionName()))
            .collect(Collectors.toList());

        Map<WorkflowStatus, Long> byStatus = instances.stream()
            .collect(Collectors.groupingBy(WorkflowInstance::status, () -> new EnumMap<>(WorkflowStatus.class),
                Collectors.counting()));

        List<Duration> completionTimes = instances.stream()
            .filter(i -> i.status() == WorkflowStatus.COMPLETED && i.completedAt() != null)
            .map(i -> Duration.between(i.createdAt(), i.completedAt()))
            .collect(Collectors.toList());

        Set<UUID> ids = instances.stream().map(WorkflowInstance::instanceId).collect(Collectors.toSet());
        Map<String, Long> escalations = eventRepository.findByTypes(List.of(WorkflowEventType.WORKFLOW_ESCALATED))
            .stream()
            .filter(e -> ids.contains(e.instanceId()) && !e.nodeIds().isEmpty())
            .collect(Collectors.groupingBy(e -> e.nodeIds().get(0), TreeMap::new, Collectors.counting()));

        return new WorkflowAnalytics(
            definitionName,
            instances.size(),
            byStatus.getOrDefault(WorkflowStatus.COMPLETED, 0L),
            byStatus.getOrDefault(WorkflowStatus.FAILED, 0L),
            byStatus.getOrDefault(WorkflowStatus.CANCELLED, 0L),
            byStatus.getOrDefault(WorkflowStatus.RUNNING, 0L) + byStatus.getOrDefault(WorkflowStatus.SUSPENDED, 0L),
            average(completionTimes),
            bottlenecks(instances),
            escalations
        );
    }

    /**
     * Average time spent in each node a branch has left, slowest first.
     */
    List<NodeDwell> bottlenecks(List<WorkflowInstance> instances) {
        Map<String, List<Duration>> dwellTimes = new HashMap<>();
        for (WorkflowInstance instance : instances) {
            Map<String, Instant> enteredAt = new HashMap<>();
            for (WorkflowTransition transition : instance.history()) {
                Instant entered = enteredAt.remove(transition.fromNode());
                if (entered != null) {
                    dwellTimes.computeIfAbsent(transition.fromNode(), k -> new ArrayList<>())
                        .add(Duration.between(entered, transition.timestamp()));
                }
                transition.activated().forEach(nodeId -> enteredAt.put(nodeId, transition.timestamp()));
            }
        }

        return dwellTimes.entrySet().stream()
            .map(e -> new NodeDwell(e.getKey(), e.getValue().size(), average(e.getValue())))
            .sorted(Comparator.comparing(NodeDwell::averageDwell).reversed().thenComparing(NodeDwell::nodeId))
            .collect(Collectors.toList());
    }

    private List<TimelineEntry> buildTimeline(List<WorkflowEvent> events) {
        return events.stream()
            .map(e -> new TimelineEntry(
                e.timestamp(),
                e.sequence(),
                e.type().name(),
                e.nodeIds(),
                e.actor(),
                summarizePayload(e.payload())
            ))
            .collect(Collectors.toList());
    }

    private ExecutionStatistics calculateStatistics(WorkflowInstance instance, List<WorkflowEvent> events) {
        long escalations = events.stream()
            .filter(e -> e.type() == WorkflowEventType.WORKFLOW_ESCALATED)
            .count();

        long escalationFailures = events.stream()
            .filter(e -> e.type() == WorkflowEventType.ESCALATION_FAILED)
            .count();

        long taskCompletions = instance.history().stream()
            .filter(t -> t.kind() == TransitionKind.TASK_COMPLETION)
            .count();

        Instant end = instance.completedAt() != null ? instance.completedAt() : clock.instant();

        return new ExecutionStatistics(
            events.size(),
            instance.history().size(),
            taskCompletions,
            escalations,
            escalationFailures,
            Duration.between(instance.createdAt(), end)
        );
    }

    private static Duration average(List<Duration> durations) {
        if (durations.isEmpty()) {
            return Duration.ZERO;
        }
        long totalMillis = durations.stream().mapToLong(Duration::toMillis).sum();
        return Duration.ofMillis(totalMillis / durations.size());
    }

    private String summarizePayload(JsonNode payload) {
        if (payload == null) return null;
        String str = payload.toString();
        return str.length() > 200 ? str.substring(0, 200) + "..." : str;
    }

    // ========== DTOs ==========

    public record ExecutionHistory(
        UUID instanceId,
        String definitionName,
        SemanticVersion definitionVersion,
        WorkflowStatus currentStatus,
        List<WorkflowTransition> transitions,
        List<WorkflowEvent> events,
        List<TimelineEntry> timeline,
        ExecutionStatistics statistics
    ) {}

    public record ReplayResult(
        UUID instanceId,
        long replayedToSequence,
        WorkflowStatus reconstructedStatus,
        List<String> touchedNodes,
        Instant startedAt,
        Instant completedAt,
        int eventCount
    ) {}

    public record TimelineEntry(
        Instant timestamp,
        long sequence,
        String eventType,
        List<String> nodeIds,
        String actor,
        String summary
    ) {}

    public record ExecutionStatistics(
        long totalEvents,
        long transitions,
        long taskCompletions,
        long escalations,
        long escalationFailures,
        Duration elapsed
    ) {}

    public record NodeDwell(
        String nodeId,
        long visits,
        Duration averageDwell
    ) {}

    public record WorkflowAnalytics(
        String definitionName,
        long totalInstances,
        long completed,
        long failed,
        long cancelled,
        long inProgress,
        Duration averageCompletionTime,
        List<NodeDwell> bottlenecks,
        Map<String, Long> escalationsByNode
    ) {}
}
