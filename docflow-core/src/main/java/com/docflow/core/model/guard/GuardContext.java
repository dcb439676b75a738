package com.docflow.core.model.guard;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Owned snapshot handed to guard evaluation. Nothing in it is shared with the live instance.
 */
public record GuardContext(
    Actor actor,
    Map<String, JsonNode> variables,
    Instant now,
    UUID instanceId,
    String nodeId
) {
    public GuardContext {
        variables = variables == null ? Map.of() : Map.copyOf(variables);
    }

    public JsonNode variable(String name) {
        return variables.get(name);
    }
}
