package com.docflow.action.ledger;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Dispatch record for one idempotency key.
 *
 * Lifecycle: DISPATCHED -> ACKNOWLEDGED | FAILED. A FAILED key may be claimed again;
 * DISPATCHED and ACKNOWLEDGED keys may not.
 */
public record LedgerEntry(
    String idempotencyKey,
    UUID instanceId,
    String nodeId,
    String actionId,
    Status status,
    Map<String, JsonNode> variableUpdates,
    int attempts,
    String errorCode,
    Instant recordedAt,
    Instant updatedAt
) {
    public enum Status {
        DISPATCHED,
        ACKNOWLEDGED,
        FAILED
    }

    public LedgerEntry {
        variableUpdates = variableUpdates == null ? Map.of() : Map.copyOf(variableUpdates);
    }

    public static LedgerEntry dispatched(String idempotencyKey, UUID instanceId, String nodeId,
                                         String actionId, Instant now) {
        return new LedgerEntry(idempotencyKey, instanceId, nodeId, actionId,
            Status.DISPATCHED, Map.of(), 0, null, now, now);
    }

    public LedgerEntry acknowledged(Map<String, JsonNode> updates, int attempts, Instant now) {
        return new LedgerEntry(idempotencyKey, instanceId, nodeId, actionId,
            Status.ACKNOWLEDGED, updates, attempts, null, recordedAt, now);
    }

    public LedgerEntry failed(String errorCode, int attempts, Instant now) {
        return new LedgerEntry(idempotencyKey, instanceId, nodeId, actionId,
            Status.FAILED, Map.of(), attempts, errorCode, recordedAt, now);
    }

    public boolean blocksDispatch() {
        return status != Status.FAILED;
    }
}
