package com.docflow.core.model.graph;

import com.docflow.core.model.action.Action;
import com.docflow.core.model.guard.Guard;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * A vertex of a workflow graph.
 * Closed set of variants; the engine dispatches on {@link #nodeType()}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = StartNode.class, name = "start"),
    @JsonSubTypes.Type(value = TaskNode.class, name = "task"),
    @JsonSubTypes.Type(value = DecisionNode.class, name = "decision"),
    @JsonSubTypes.Type(value = ParallelNode.class, name = "parallel"),
    @JsonSubTypes.Type(value = JoinNode.class, name = "join"),
    @JsonSubTypes.Type(value = TimerNode.class, name = "timer"),
    @JsonSubTypes.Type(value = EndNode.class, name = "end")
})
public sealed interface Node
    permits StartNode, TaskNode, DecisionNode, ParallelNode, JoinNode, TimerNode, EndNode {

    String id();

    String name();

    NodeType nodeType();

    /**
     * Guards checked before a branch may enter this node. ANDed in declared order.
     */
    default List<Guard> entryGuards() {
        return List.of();
    }

    /**
     * Actions run when a branch enters this node.
     */
    default List<Action> entryActions() {
        return List.of();
    }

    /**
     * Actions run when a branch leaves this node.
     */
    default List<Action> exitActions() {
        return List.of();
    }

    /**
     * Outgoing edge taken when one of this node's actions fails fatally, or null.
     */
    default String errorEdgeId() {
        return null;
    }

    default String displayName() {
        return name() != null && !name().isBlank() ? name() : id();
    }
}
