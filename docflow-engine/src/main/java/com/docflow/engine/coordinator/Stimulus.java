package com.docflow.engine.coordinator;

import com.docflow.core.model.TransitionKind;
import com.docflow.core.model.WorkflowDefinition;
import com.docflow.core.model.WorkflowInstance;
import com.docflow.core.model.guard.Actor;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Map;

/**
 * Something that moves an instance: a start, a task completion, an explicit transition,
 * a timer timeout or a signal.
 *
 * @param fromNode node the branch departs from, the start node for a start
 * @param targetNode requested destination, or null for the first eligible edge
 * @param data values written into the variables before edges are evaluated
 */
record Stimulus(
    WorkflowDefinition definition,
    WorkflowInstance instance,
    TransitionKind kind,
    String fromNode,
    String targetNode,
    Map<String, JsonNode> data,
    Actor actor,
    String reason,
    Instant now
) {
    Stimulus {
        data = data == null ? Map.of() : data;
    }
}
