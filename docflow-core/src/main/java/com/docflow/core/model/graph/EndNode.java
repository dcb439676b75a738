package com.docflow.core.model.graph;

import com.docflow.core.model.action.Action;

import java.util.List;

/**
 * Terminal node. A branch reaching it is retired.
 */
public record EndNode(
    String id,
    String name,
    CompletionStatus status,
    List<Action> entryActions
) implements Node {

    public EndNode {
        status = status == null ? CompletionStatus.SUCCESS : status;
        entryActions = entryActions == null ? List.of() : List.copyOf(entryActions);
    }

    public static EndNode of(String id) {
        return new EndNode(id, id, CompletionStatus.SUCCESS, List.of());
    }

    public static EndNode of(String id, CompletionStatus status) {
        return new EndNode(id, id, status, List.of());
    }

    @Override
    public NodeType nodeType() {
        return NodeType.END;
    }
}
