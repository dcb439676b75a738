package com.docflow.engine.coordinator;

import com.docflow.core.model.JoinProgress;
import com.docflow.core.model.WorkflowInstance;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Working copy of an instance while one stimulus is processed. Owned by a single walk and
 * discarded if the walk is rejected, so the stored instance is never partially updated.
 */
final class ExecutionState {

    private final WorkflowInstance base;
    private final Set<String> active;
    private final Map<String, JsonNode> variables;
    private final Map<String, Instant> enteredAt;
    private final Map<String, Instant> slaDeadlines;
    private final Map<String, JoinProgress> joins;
    private final Map<String, List<String>> assignments;

    private final Set<String> touched = new LinkedHashSet<>();
    private final List<String> entered = new ArrayList<>();
    private final List<String> left = new ArrayList<>();

    ExecutionState(WorkflowInstance base) {
        this.base = base;
        this.active = new LinkedHashSet<>(base.activeNodes());
        this.variables = new LinkedHashMap<>(base.variables());
        this.enteredAt = new LinkedHashMap<>(base.nodeEnteredAt());
        this.slaDeadlines = new LinkedHashMap<>(base.slaDeadlines());
        this.joins = new LinkedHashMap<>(base.joins());
        this.assignments = new LinkedHashMap<>(base.assignments());
    }

    WorkflowInstance base() {
        return base;
    }

    Map<String, JsonNode> variables() {
        return variables;
    }

    boolean isActive(String nodeId) {
        return active.contains(nodeId);
    }

    List<String> activeNodes() {
        return List.copyOf(active);
    }

    void setVariables(Map<String, JsonNode> updates) {
        updates.forEach((name, value) -> {
            variables.put(name, value == null ? NullNode.getInstance() : value);
            touched.add(name);
        });
    }

    void enter(String nodeId, Instant now) {
        active.add(nodeId);
        enteredAt.put(nodeId, now);
        entered.add(nodeId);
    }

    /**
     * Mark a join as pending without resetting when it was first reached.
     */
    void holdAtJoin(String joinId, Instant now) {
        if (active.add(joinId)) {
            enteredAt.put(joinId, now);
        }
    }

    void leave(String nodeId) {
        if (active.remove(nodeId)) {
            left.add(nodeId);
        }
        enteredAt.remove(nodeId);
        slaDeadlines.remove(nodeId);
        assignments.remove(nodeId);
    }

    void assign(String nodeId, List<String> assignees) {
        assignments.put(nodeId, assignees);
    }

    void slaDeadline(String nodeId, Instant deadline) {
        slaDeadlines.put(nodeId, deadline);
    }

    JoinProgress joinProgress(String joinId) {
        return joins.getOrDefault(joinId, JoinProgress.firstVisit());
    }

    void joinProgress(String joinId, JoinProgress progress) {
        joins.put(joinId, progress);
    }

    Set<String> touchedVariables() {
        return touched;
    }

    /**
     * Nodes entered during this walk, in order. May include nodes also in {@link #left()}.
     */
    List<String> entered() {
        return entered;
    }

    List<String> left() {
        return left;
    }

    WorkflowInstance.Builder applyTo(WorkflowInstance.Builder builder) {
        return builder
            .activeNodes(List.copyOf(active))
            .variables(variables)
            .nodeEnteredAt(enteredAt)
            .slaDeadlines(slaDeadlines)
            .joins(joins)
            .assignments(assignments);
    }
}
