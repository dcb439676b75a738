package com.docflow.core.model.graph;

/**
 * Kinds of nodes a workflow graph can contain.
 */
public enum NodeType {
    START,
    TASK,
    DECISION,
    PARALLEL,
    JOIN,
    TIMER,
    END;

    /**
     * Nodes the engine passes through within a single stimulus instead of waiting on.
     */
    public boolean isPassThrough() {
        return this == START || this == DECISION || this == PARALLEL;
    }

    /**
     * Nodes that hold a branch until an external stimulus arrives.
     */
    public boolean isWaitState() {
        return this == TASK || this == TIMER || this == JOIN;
    }
}
