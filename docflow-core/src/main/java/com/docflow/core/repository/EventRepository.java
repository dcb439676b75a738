package com.docflow.core.repository;

import com.docflow.core.event.WorkflowEvent;
import com.docflow.core.event.WorkflowEventType;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for the workflow event log.
 * Events are append-only and immutable.
 */
public interface EventRepository {

    /**
     * Append an event, assigning the next sequence number for its instance and linking it to
     * the hash of the instance's previous event.
     *
     * @return the stored event, or empty if an event with the same idempotency key exists
     */
    Optional<WorkflowEvent> append(WorkflowEvent event);

    Optional<WorkflowEvent> findByIdempotencyKey(String idempotencyKey);

    /**
     * Get all events for an instance ordered by sequence.
     */
    List<WorkflowEvent> findByInstance(UUID instanceId);

    List<WorkflowEvent> findByInstanceAndTypes(UUID instanceId, List<WorkflowEventType> types);

    /**
     * Events of the given types across all instances, oldest first. Empty types means all.
     */
    List<WorkflowEvent> findByTypes(List<WorkflowEventType> types);

    List<WorkflowEvent> findByTimeRange(Instant from, Instant to, int limit);

    Map<WorkflowEventType, Long> countByType(UUID instanceId);
}
