package com.docflow.core.model.graph;

import com.docflow.core.model.action.Action;

import java.util.List;

/**
 * Synchronizes parallel branches. Releases once {@code expectedBranches} arrivals have been
 * recorded for the current visit. A join expecting fewer arrivals than it has incoming edges
 * retires the branches still open when it releases.
 */
public record JoinNode(
    String id,
    String name,
    int expectedBranches,
    List<Action> entryActions
) implements Node {

    public JoinNode {
        entryActions = entryActions == null ? List.of() : List.copyOf(entryActions);
    }

    public static JoinNode of(String id, int expectedBranches) {
        return new JoinNode(id, id, expectedBranches, List.of());
    }

    @Override
    public NodeType nodeType() {
        return NodeType.JOIN;
    }
}
