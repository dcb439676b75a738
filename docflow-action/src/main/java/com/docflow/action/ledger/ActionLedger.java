package com.docflow.action.ledger;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Records execution keys before dispatch so that re-running a pipeline step never repeats
 * a side effect that was already started.
 */
public interface ActionLedger {

    /**
     * Atomically record a dispatch for the entry's key.
     *
     * @return empty if the claim succeeded, otherwise the entry that blocks it
     */
    Optional<LedgerEntry> claim(LedgerEntry dispatched);

    void acknowledge(String idempotencyKey, Map<String, JsonNode> variableUpdates, int attempts, Instant now);

    void fail(String idempotencyKey, String errorCode, int attempts, Instant now);

    Optional<LedgerEntry> find(String idempotencyKey);

    List<LedgerEntry> findByInstance(UUID instanceId);
}
