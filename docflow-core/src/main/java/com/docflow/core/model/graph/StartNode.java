package com.docflow.core.model.graph;

import com.docflow.core.model.action.Action;

import java.util.List;

/**
 * Entry point of a workflow. Has no incoming edges.
 */
public record StartNode(
    String id,
    String name,
    List<Action> entryActions
) implements Node {

    public StartNode {
        entryActions = entryActions == null ? List.of() : List.copyOf(entryActions);
    }

    public static StartNode of(String id) {
        return new StartNode(id, id, List.of());
    }

    @Override
    public NodeType nodeType() {
        return NodeType.START;
    }
}
