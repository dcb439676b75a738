package com.docflow.core.model;

import com.docflow.core.model.action.Action;
import com.docflow.core.model.graph.WorkflowGraph;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable definition of a workflow type.
 * Versioned to support safe updates without affecting running instances.
 *
 * Primary Key: id
 * Unique Constraint: (name, version)
 *
 * Invariants:
 * - never mutated once published; a revision is a new definition with a new id
 * - graph passes {@link com.docflow.core.validation.DefinitionValidator} before publish
 * - only the active flag may change after publish, via {@link #deactivated()}
 */
public record WorkflowDefinition(
    // Identity
    String id,
    String name,
    SemanticVersion version,

    // Structure
    WorkflowGraph graph,
    List<VariableDefinition> variables,

    // Run on every active node when an instance is cancelled
    List<Action> cancellationActions,

    // Entity events that start an instance
    List<DefinitionTrigger> triggers,

    // Lifecycle
    boolean active,

    // Metadata
    String description,
    Instant createdAt,
    String createdBy,
    Map<String, String> labels
) {
    public WorkflowDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Definition id cannot be empty");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Definition name cannot be empty");
        }
        if (graph == null) {
            throw new IllegalArgumentException("Definition graph is required: " + name);
        }
        version = version == null ? SemanticVersion.INITIAL : version;
        variables = variables == null ? List.of() : List.copyOf(variables);
        cancellationActions = cancellationActions == null ? List.of() : List.copyOf(cancellationActions);
        triggers = triggers == null ? List.of() : List.copyOf(triggers);
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    /**
     * Human readable key, e.g. {@code document-approval@1.2.0}.
     */
    public String key() {
        return name + "@" + version;
    }

    public boolean isTriggeredBy(EntityReference entity, String eventName) {
        return triggers.stream().anyMatch(t -> t.matches(entity, eventName));
    }

    public Optional<VariableDefinition> findVariable(String variableName) {
        return variables.stream()
            .filter(v -> v.name().equals(variableName))
            .findFirst();
    }

    /**
     * Copy that blocks new starts. Running instances keep referencing this id.
     */
    public WorkflowDefinition deactivated() {
        return new WorkflowDefinition(id, name, version, graph, variables, cancellationActions, triggers,
            false, description, createdAt, createdBy, labels);
    }

    /**
     * Start a revision: a builder pre-filled from this definition with a fresh id and the
     * next minor version.
     */
    public Builder revise() {
        return new Builder(this)
            .id(UUID.randomUUID().toString())
            .version(version.nextMinor())
            .active(true)
            .createdAt(Instant.now());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String name;
        private SemanticVersion version = SemanticVersion.INITIAL;
        private WorkflowGraph graph;
        private List<VariableDefinition> variables = new ArrayList<>();
        private List<Action> cancellationActions = new ArrayList<>();
        private List<DefinitionTrigger> triggers = new ArrayList<>();
        private boolean active = true;
        private String description;
        private Instant createdAt = Instant.now();
        private String createdBy;
        private Map<String, String> labels = Map.of();

        public Builder() {
        }

        public Builder(WorkflowDefinition definition) {
            this.id = definition.id();
            this.name = definition.name();
            this.version = definition.version();
            this.graph = definition.graph();
            this.variables = new ArrayList<>(definition.variables());
            this.cancellationActions = new ArrayList<>(definition.cancellationActions());
            this.triggers = new ArrayList<>(definition.triggers());
            this.active = definition.active();
            this.description = definition.description();
            this.createdAt = definition.createdAt();
            this.createdBy = definition.createdBy();
            this.labels = definition.labels();
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder version(SemanticVersion version) {
            this.version = version;
            return this;
        }

        public Builder version(String version) {
            this.version = SemanticVersion.parse(version);
            return this;
        }

        public Builder graph(WorkflowGraph graph) {
            this.graph = graph;
            return this;
        }

        public Builder variable(VariableDefinition variable) {
            this.variables.add(variable);
            return this;
        }

        public Builder variables(List<VariableDefinition> variables) {
            this.variables = new ArrayList<>(variables);
            return this;
        }

        public Builder cancellationAction(Action action) {
            this.cancellationActions.add(action);
            return this;
        }

        public Builder trigger(String entityType, String event) {
            this.triggers.add(DefinitionTrigger.on(entityType, event));
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Builder labels(Map<String, String> labels) {
            this.labels = labels;
            return this;
        }

        public WorkflowDefinition build() {
            return new WorkflowDefinition(id, name, version, graph, variables, cancellationActions, triggers,
                active, description, createdAt, createdBy, labels);
        }
    }
}
