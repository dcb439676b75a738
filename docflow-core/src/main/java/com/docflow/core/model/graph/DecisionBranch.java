package com.docflow.core.model.graph;

/**
 * One named, ordered alternative of a decision node.
 */
public record DecisionBranch(
    String name,
    Condition condition,
    String edgeId
) {
    public DecisionBranch {
        if (condition == null) {
            throw new IllegalArgumentException("Decision branch '" + name + "' has no condition");
        }
    }
}
