package com.docflow.core.model.graph;

/**
 * Directed connection between two nodes.
 * Lower priority values are evaluated first; ties break on edge id.
 */
public record Edge(
    String id,
    String source,
    String target,
    Condition condition,
    int priority
) {
    public static Edge of(String id, String source, String target) {
        return new Edge(id, source, target, null, 0);
    }

    public static Edge when(String id, String source, String target, Condition condition, int priority) {
        return new Edge(id, source, target, condition, priority);
    }

    public boolean hasCondition() {
        return condition != null;
    }
}
