package com.docflow.core.model.graph;

import com.docflow.core.model.action.Action;

import java.util.ArrayList;
import java.util.List;

/**
 * Routes to the first branch whose condition holds, in declared order, otherwise to the
 * default edge.
 */
public record DecisionNode(
    String id,
    String name,
    List<DecisionBranch> branches,
    String defaultEdgeId,
    List<Action> entryActions
) implements Node {

    public DecisionNode {
        branches = branches == null ? List.of() : List.copyOf(branches);
        entryActions = entryActions == null ? List.of() : List.copyOf(entryActions);
    }

    @Override
    public NodeType nodeType() {
        return NodeType.DECISION;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String id;
        private String name;
        private final List<DecisionBranch> branches = new ArrayList<>();
        private String defaultEdgeId;
        private final List<Action> entryActions = new ArrayList<>();

        private Builder(String id) {
            this.id = id;
            this.name = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder branch(String branchName, Condition condition, String edgeId) {
            this.branches.add(new DecisionBranch(branchName, condition, edgeId));
            return this;
        }

        public Builder otherwise(String edgeId) {
            this.defaultEdgeId = edgeId;
            return this;
        }

        public Builder onEntry(Action action) {
            this.entryActions.add(action);
            return this;
        }

        public DecisionNode build() {
            return new DecisionNode(id, name, branches, defaultEdgeId, entryActions);
        }
    }
}
