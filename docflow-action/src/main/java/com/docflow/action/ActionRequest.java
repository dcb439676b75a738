package com.docflow.action;

import com.docflow.core.model.action.Action;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.UUID;

/**
 * One action to run on behalf of an instance.
 *
 * @param idempotencyKey stable key for this dispatch; a second request with the same key is a duplicate
 * @param variables instance variables visible to the action (placeholder resolution, parameters)
 * @param actor who caused the stimulus
 * @param initiator who started the instance, resolvable as {@code ${initiator}}
 */
public record ActionRequest(
    UUID instanceId,
    String nodeId,
    Action action,
    String idempotencyKey,
    Map<String, JsonNode> variables,
    String actor,
    String initiator
) {
    public ActionRequest {
        if (instanceId == null || nodeId == null || action == null) {
            throw new IllegalArgumentException("Action request needs an instance, a node and an action");
        }
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Action request needs an idempotency key: " + action.id());
        }
        variables = variables == null ? Map.of() : Map.copyOf(variables);
    }

    public String actionId() {
        return action.id();
    }
}
