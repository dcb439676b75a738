package com.docflow.core.model;

import com.docflow.core.model.graph.CompletionStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A single execution of a WorkflowDefinition against one entity.
 * Primary source of truth for workflow state.
 *
 * Primary Key: instanceId
 *
 * Invariants:
 * - status transitions follow {@link WorkflowStatus#canTransitionTo}
 * - history only grows; its length equals the number of accepted transitions
 * - version increases by exactly one per persisted change
 * - activeNodes holds no duplicates; a pending join appears once
 */
public record WorkflowInstance(
    // Primary key
    UUID instanceId,

    // Definition reference
    String definitionId,
    String definitionName,
    SemanticVersion definitionVersion,

    // Subject
    EntityReference entity,
    String initiator,

    // State
    WorkflowStatus status,
    List<String> activeNodes,
    Map<String, JsonNode> variables,
    List<WorkflowTransition> history,

    // Per active node bookkeeping
    Map<String, Instant> nodeEnteredAt,
    Map<String, Instant> slaDeadlines,
    Map<String, JoinProgress> joins,
    Map<String, List<String>> assignments,

    // Outcome
    CompletionStatus completionStatus,
    FailureInfo failure,

    // Timing
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt,

    // Versioning (optimistic locking)
    long version
) {
    public WorkflowInstance {
        activeNodes = activeNodes == null ? List.of() : List.copyOf(activeNodes);
        variables = variables == null ? Map.of() : unmodifiableCopy(variables);
        history = history == null ? List.of() : List.copyOf(history);
        nodeEnteredAt = nodeEnteredAt == null ? Map.of() : Map.copyOf(nodeEnteredAt);
        slaDeadlines = slaDeadlines == null ? Map.of() : Map.copyOf(slaDeadlines);
        joins = joins == null ? Map.of() : Map.copyOf(joins);
        assignments = assignments == null ? Map.of() : Map.copyOf(assignments);
    }

    /**
     * Create a new instance positioned before its first transition.
     * The engine moves it onto the start node's successors.
     */
    public static WorkflowInstance create(
            WorkflowDefinition definition,
            EntityReference entity,
            String initiator,
            Map<String, JsonNode> variables,
            Instant now) {
        return new WorkflowInstance(
            UUID.randomUUID(),
            definition.id(),
            definition.name(),
            definition.version(),
            entity,
            initiator,
            WorkflowStatus.RUNNING,
            List.of(),
            variables,
            List.of(),
            Map.of(),
            Map.of(),
            Map.of(),
            Map.of(),
            null,
            null,
            now,
            now,
            null,
            0L
        );
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isActive(String nodeId) {
        return activeNodes.contains(nodeId);
    }

    public JsonNode variable(String name) {
        return variables.get(name);
    }

    /**
     * Create a copy with a new status, bumping the version.
     */
    public WorkflowInstance withStatus(WorkflowStatus newStatus, Instant now) {
        return toBuilder()
            .status(newStatus)
            .updatedAt(now)
            .completedAt(newStatus.isTerminal() ? now : completedAt)
            .incrementVersion()
            .build();
    }

    // Map.copyOf rejects null values; JSON null is the only null a variable may hold.
    private static Map<String, JsonNode> unmodifiableCopy(Map<String, JsonNode> source) {
        Map<String, JsonNode> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, v == null ? NullNode.getInstance() : v));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Builder for creating modified copies.
     */
    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private UUID instanceId;
        private String definitionId;
        private String definitionName;
        private SemanticVersion definitionVersion;
        private EntityReference entity;
        private String initiator;
        private WorkflowStatus status;
        private List<String> activeNodes;
        private Map<String, JsonNode> variables;
        private List<WorkflowTransition> history;
        private Map<String, Instant> nodeEnteredAt;
        private Map<String, Instant> slaDeadlines;
        private Map<String, JoinProgress> joins;
        private Map<String, List<String>> assignments;
        private CompletionStatus completionStatus;
        private FailureInfo failure;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant completedAt;
        private long version;

        public Builder(WorkflowInstance instance) {
            this.instanceId = instance.instanceId();
            this.definitionId = instance.definitionId();
            this.definitionName = instance.definitionName();
            this.definitionVersion = instance.definitionVersion();
            this.entity = instance.entity();
            this.initiator = instance.initiator();
            this.status = instance.status();
            this.activeNodes = instance.activeNodes();
            this.variables = instance.variables();
            this.history = instance.history();
            this.nodeEnteredAt = instance.nodeEnteredAt();
            this.slaDeadlines = instance.slaDeadlines();
            this.joins = instance.joins();
            this.assignments = instance.assignments();
            this.completionStatus = instance.completionStatus();
            this.failure = instance.failure();
            this.createdAt = instance.createdAt();
            this.updatedAt = instance.updatedAt();
            this.completedAt = instance.completedAt();
            this.version = instance.version();
        }

        public Builder status(WorkflowStatus status) {
            this.status = status;
            return this;
        }

        public Builder activeNodes(List<String> activeNodes) {
            this.activeNodes = activeNodes;
            return this;
        }

        public Builder variables(Map<String, JsonNode> variables) {
            this.variables = variables;
            return this;
        }

        public Builder appendTransition(WorkflowTransition transition) {
            List<WorkflowTransition> extended = new ArrayList<>(history);
            extended.add(transition);
            this.history = extended;
            return this;
        }

        public Builder nodeEnteredAt(Map<String, Instant> nodeEnteredAt) {
            this.nodeEnteredAt = nodeEnteredAt;
            return this;
        }

        public Builder slaDeadlines(Map<String, Instant> slaDeadlines) {
            this.slaDeadlines = slaDeadlines;
            return this;
        }

        public Builder joins(Map<String, JoinProgress> joins) {
            this.joins = joins;
            return this;
        }

        public Builder assignments(Map<String, List<String>> assignments) {
            this.assignments = assignments;
            return this;
        }

        public Builder completionStatus(CompletionStatus completionStatus) {
            this.completionStatus = completionStatus;
            return this;
        }

        public Builder failure(FailureInfo failure) {
            this.failure = failure;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Builder incrementVersion() {
            this.version++;
            return this;
        }

        public WorkflowInstance build() {
            return new WorkflowInstance(
                instanceId, definitionId, definitionName, definitionVersion,
                entity, initiator, status, activeNodes, variables, history,
                nodeEnteredAt, slaDeadlines, joins, assignments,
                completionStatus, failure, createdAt, updatedAt, completedAt, version
            );
        }
    }
}
