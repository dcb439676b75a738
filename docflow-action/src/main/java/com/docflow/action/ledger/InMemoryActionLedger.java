package com.docflow.action.ledger;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ActionLedger.
 * For demonstration and testing purposes.
 */
public class InMemoryActionLedger implements ActionLedger {

    private final Map<String, LedgerEntry> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<LedgerEntry> claim(LedgerEntry dispatched) {
        AtomicReference<LedgerEntry> blocking = new AtomicReference<>();
        entries.compute(dispatched.idempotencyKey(), (key, existing) -> {
            if (existing != null && existing.blocksDispatch()) {
                blocking.set(existing);
                return existing;
            }
            return dispatched;
        });
        return Optional.ofNullable(blocking.get());
    }

    @Override
    public void acknowledge(String idempotencyKey, Map<String, JsonNode> variableUpdates, int attempts, Instant now) {
        entries.computeIfPresent(idempotencyKey, (key, entry) -> entry.acknowledged(variableUpdates, attempts, now));
    }

    @Override
    public void fail(String idempotencyKey, String errorCode, int attempts, Instant now) {
        entries.computeIfPresent(idempotencyKey, (key, entry) -> entry.failed(errorCode, attempts, now));
    }

    @Override
    public Optional<LedgerEntry> find(String idempotencyKey) {
        return Optional.ofNullable(entries.get(idempotencyKey));
    }

    @Override
    public List<LedgerEntry> findByInstance(UUID instanceId) {
        return entries.values().stream()
            .filter(e -> e.instanceId().equals(instanceId))
            .sorted(Comparator.comparing(LedgerEntry::recordedAt))
            .collect(Collectors.toList());
    }
}
