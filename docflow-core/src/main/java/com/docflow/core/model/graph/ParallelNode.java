package com.docflow.core.model.graph;

import com.docflow.core.model.action.Action;

import java.util.List;

/**
 * Fans a branch out along every outgoing edge.
 */
public record ParallelNode(
    String id,
    String name,
    List<Action> entryActions
) implements Node {

    public ParallelNode {
        entryActions = entryActions == null ? List.of() : List.copyOf(entryActions);
    }

    public static ParallelNode of(String id) {
        return new ParallelNode(id, id, List.of());
    }

    @Override
    public NodeType nodeType() {
        return NodeType.PARALLEL;
    }
}
