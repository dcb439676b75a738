package com.docflow.core.model.graph;

import com.docflow.core.model.action.Action;
import com.docflow.core.model.action.EscalationRule;
import com.docflow.core.model.guard.Guard;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * A unit of work awaiting completion by an assignee or an automated worker.
 *
 * Invariants:
 * - sla, if set, is positive
 * - errorEdgeId, if set, names one of this node's outgoing edges (checked at publish)
 */
public record TaskNode(
    String id,
    String name,
    TaskKind kind,
    AssigneeRule assignees,
    Duration sla,
    List<EscalationRule> escalations,
    List<Guard> entryGuards,
    List<Action> entryActions,
    List<Action> exitActions,
    String errorEdgeId
) implements Node {

    public TaskNode {
        kind = kind == null ? TaskKind.MANUAL : kind;
        escalations = escalations == null ? List.of() : List.copyOf(escalations);
        entryGuards = entryGuards == null ? List.of() : List.copyOf(entryGuards);
        entryActions = entryActions == null ? List.of() : List.copyOf(entryActions);
        exitActions = exitActions == null ? List.of() : List.copyOf(exitActions);
        if (sla != null && (sla.isZero() || sla.isNegative())) {
            throw new IllegalArgumentException("Task SLA must be positive: " + id);
        }
    }

    @Override
    public NodeType nodeType() {
        return NodeType.TASK;
    }

    /**
     * Escalation rules in force for this task. An SLA without explicit rules escalates
     * once to the task's assignees when the SLA elapses.
     */
    public List<EscalationRule> effectiveEscalations() {
        if (!escalations.isEmpty() || sla == null) {
            return escalations;
        }
        return List.of(EscalationRule.onSla(id, sla));
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static class Builder {
        private final String id;
        private String name;
        private TaskKind kind = TaskKind.MANUAL;
        private AssigneeRule assignees;
        private Duration sla;
        private final List<EscalationRule> escalations = new ArrayList<>();
        private final List<Guard> entryGuards = new ArrayList<>();
        private final List<Action> entryActions = new ArrayList<>();
        private final List<Action> exitActions = new ArrayList<>();
        private String errorEdgeId;

        private Builder(String id) {
            this.id = id;
            this.name = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder kind(TaskKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder assignees(AssigneeRule assignees) {
            this.assignees = assignees;
            return this;
        }

        public Builder sla(Duration sla) {
            this.sla = sla;
            return this;
        }

        public Builder escalation(EscalationRule rule) {
            this.escalations.add(rule);
            return this;
        }

        public Builder guard(Guard guard) {
            this.entryGuards.add(guard);
            return this;
        }

        public Builder onEntry(Action action) {
            this.entryActions.add(action);
            return this;
        }

        public Builder onExit(Action action) {
            this.exitActions.add(action);
            return this;
        }

        public Builder errorEdge(String edgeId) {
            this.errorEdgeId = edgeId;
            return this;
        }

        public TaskNode build() {
            return new TaskNode(id, name, kind, assignees, sla, escalations,
                entryGuards, entryActions, exitActions, errorEdgeId);
        }
    }
}
