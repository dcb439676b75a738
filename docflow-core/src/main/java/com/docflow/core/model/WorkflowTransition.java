package com.docflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One accepted transition in an instance's history. Append-only.
 *
 * {@code via} lists pass-through nodes (decisions, completed joins) crossed on the way from
 * {@code fromNode} to {@code toNode}. {@code activated} lists the nodes that became active;
 * it is empty for a partial join arrival and holds every branch target for a fan-out.
 */
public record WorkflowTransition(
    String fromNode,
    String toNode,
    List<String> via,
    List<String> activated,
    Instant timestamp,
    String actor,
    String reason,
    TransitionKind kind,
    Map<String, JsonNode> snapshot
) {
    public WorkflowTransition {
        via = via == null ? List.of() : List.copyOf(via);
        activated = activated == null ? List.of() : List.copyOf(activated);
        snapshot = snapshot == null ? Map.of() : Map.copyOf(snapshot);
    }
}
