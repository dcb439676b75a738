package com.docflow.engine.persistence;

import com.docflow.core.event.EventChain;
import com.docflow.core.event.WorkflowEvent;
import com.docflow.core.event.WorkflowEventType;
import com.docflow.core.repository.EventRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of EventRepository.
 * For demonstration and testing purposes.
 */
@Repository
public class InMemoryEventRepository implements EventRepository {

    private final Map<UUID, WorkflowEvent> events = new ConcurrentHashMap<>();
    private final Map<String, WorkflowEvent> byIdempotencyKey = new ConcurrentHashMap<>();
    private final Map<UUID, WorkflowEvent> heads = new ConcurrentHashMap<>();

    @Override
    public synchronized Optional<WorkflowEvent> append(WorkflowEvent event) {
        if (event.idempotencyKey() != null && byIdempotencyKey.containsKey(event.idempotencyKey())) {
            return Optional.empty();
        }
        WorkflowEvent head = heads.get(event.instanceId());
        WorkflowEvent stored = head == null
            ? EventChain.link(event, 1, EventChain.GENESIS)
            : EventChain.link(event, head.sequence() + 1, head.hash());
        events.put(stored.eventId(), stored);
        heads.put(stored.instanceId(), stored);
        if (stored.idempotencyKey() != null) {
            byIdempotencyKey.put(stored.idempotencyKey(), stored);
        }
        return Optional.of(stored);
    }

    @Override
    public Optional<WorkflowEvent> findByIdempotencyKey(String idempotencyKey) {
        return Optional.ofNullable(byIdempotencyKey.get(idempotencyKey));
    }

    @Override
    public List<WorkflowEvent> findByInstance(UUID instanceId) {
        return events.values().stream()
            .filter(e -> e.instanceId().equals(instanceId))
            .sorted(Comparator.comparing(WorkflowEvent::sequence))
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowEvent> findByInstanceAndTypes(UUID instanceId, List<WorkflowEventType> types) {
        Set<WorkflowEventType> typeSet = new HashSet<>(types);
        return events.values().stream()
            .filter(e -> e.instanceId().equals(instanceId))
            .filter(e -> typeSet.contains(e.type()))
            .sorted(Comparator.comparing(WorkflowEvent::sequence))
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowEvent> findByTypes(List<WorkflowEventType> types) {
        Set<WorkflowEventType> typeSet = new HashSet<>(types);
        return events.values().stream()
            .filter(e -> typeSet.isEmpty() || typeSet.contains(e.type()))
            .sorted(Comparator.comparing(WorkflowEvent::timestamp).thenComparing(WorkflowEvent::sequence))
            .collect(Collectors.toList());
    }

    @Override
    public List<WorkflowEvent> findByTimeRange(Instant from, Instant to, int limit) {
        return events.values().stream()
            .filter(e -> !e.timestamp().isBefore(from) && !e.timestamp().isAfter(to))
            .sorted(Comparator.comparing(WorkflowEvent::timestamp).thenComparing(WorkflowEvent::sequence))
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public Map<WorkflowEventType, Long> countByType(UUID instanceId) {
        return events.values().stream()
            .filter(e -> e.instanceId().equals(instanceId))
            .collect(Collectors.groupingBy(WorkflowEvent::type, Collectors.counting()));
    }
}
