package com.docflow.core.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Immutable record of something that happened to an instance.
 * Carries identifiers and a small payload only, never entity content.
 *
 * Invariants:
 * - sequence is contiguous within an instance once appended to a log
 * - idempotencyKey is derived from (instance, version, type) so re-publishing is harmless
 * - once stored, previousHash is the hash of the preceding event (see {@link EventChain})
 */
public record WorkflowEvent(
    UUID eventId,
    UUID instanceId,
    long sequence,
    WorkflowEventType type,
    Instant timestamp,
    List<String> nodeIds,
    String actor,
    JsonNode payload,
    String idempotencyKey,
    String previousHash,
    String hash
) {
    public static final long UNSEQUENCED = -1L;

    public WorkflowEvent {
        nodeIds = nodeIds == null ? List.of() : List.copyOf(nodeIds);
    }

    /**
     * Create an event that a log will sequence and chain on append.
     */
    public static WorkflowEvent create(
            UUID instanceId,
            WorkflowEventType type,
            Instant timestamp,
            List<String> nodeIds,
            String actor,
            JsonNode payload,
            String idempotencyKey) {
        return new WorkflowEvent(
            UUID.randomUUID(),
            instanceId,
            UNSEQUENCED,
            type,
            timestamp,
            nodeIds,
            actor,
            payload,
            idempotencyKey,
            null,
            null
        );
    }
}
