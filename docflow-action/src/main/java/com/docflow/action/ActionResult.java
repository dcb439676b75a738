package com.docflow.action;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Outcome of a successful dispatch.
 *
 * @param variableUpdates variables to write back into the instance context
 * @param attempts number of dispatch attempts, 0 when skipped as a duplicate or applied locally
 */
public record ActionResult(
    String actionId,
    String idempotencyKey,
    Status status,
    Map<String, JsonNode> variableUpdates,
    int attempts
) {
    public enum Status {
        /** Dispatched and acknowledged by the collaborator */
        SUCCEEDED,
        /** Applied to the variable context without dispatch */
        APPLIED,
        /** Key already acknowledged; nothing dispatched, recorded updates replayed */
        SKIPPED_DUPLICATE
    }

    public ActionResult {
        variableUpdates = variableUpdates == null ? Map.of() : Map.copyOf(variableUpdates);
    }

    public boolean dispatched() {
        return status == Status.SUCCEEDED;
    }
}
