package com.docflow.engine.coordinator;

import com.docflow.core.exception.InvalidVariablesException;
import com.docflow.core.model.VariableDefinition;
import com.docflow.core.model.WorkflowDefinition;
import com.docflow.core.model.graph.AssigneeRule;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Applies declared variable defaults and types, and resolves assignee rules.
 */
final class VariableBinder {

    private VariableBinder() {
    }

    /**
     * Initial variables of a new instance: supplied values, then defaults for declared
     * variables left unset.
     *
     * @throws InvalidVariablesException if a required variable is missing or a value has the wrong type
     */
    static Map<String, JsonNode> bindInitial(WorkflowDefinition definition, Map<String, JsonNode> supplied) {
        Map<String, JsonNode> bound = new LinkedHashMap<>();
        supplied.forEach((name, value) -> bound.put(name, value == null ? NullNode.getInstance() : value));

        List<String> violations = new ArrayList<>();
        for (VariableDefinition variable : definition.variables()) {
            JsonNode value = bound.get(variable.name());
            if ((value == null || value.isNull()) && variable.defaultValue() != null) {
                value = variable.defaultValue();
                bound.put(variable.name(), value);
            }
            if (variable.required() && (value == null || value.isNull())) {
                violations.add("missing required variable " + variable.name());
            }
        }
        violations.addAll(typeViolations(definition, bound));

        if (!violations.isEmpty()) {
            throw new InvalidVariablesException(definition.key(), violations);
        }
        return bound;
    }

    /**
     * Check the declared types of values a stimulus writes.
     */
    static void checkTypes(WorkflowDefinition definition, Map<String, JsonNode> values) {
        List<String> violations = typeViolations(definition, values);
        if (!violations.isEmpty()) {
            throw new InvalidVariablesException(definition.key(), violations);
        }
    }

    private static List<String> typeViolations(WorkflowDefinition definition, Map<String, JsonNode> values) {
        List<String> violations = new ArrayList<>();
        values.forEach((name, value) -> {
            Optional<VariableDefinition> declared = definition.findVariable(name);
            if (declared.isPresent() && !declared.get().type().accepts(value)) {
                violations.add(name + " must be " + declared.get().type() + " but was " + value.getNodeType());
            }
        });
        return violations;
    }

    /**
     * Responsible parties for a task, in rule order without duplicates.
     */
    static List<String> resolveAssignees(AssigneeRule rule, Map<String, JsonNode> variables, String initiator) {
        if (rule == null) {
            return List.of();
        }
        Set<String> assignees = new LinkedHashSet<>();
        switch (rule.type()) {
            case FIXED -> assignees.addAll(rule.values());
            case ROLE -> rule.values().forEach(role -> assignees.add("role:" + role));
            case VARIABLE -> rule.values().forEach(name -> {
                JsonNode value = variables.get(name);
                if (value != null && value.isTextual()) {
                    assignees.add(value.asText());
                } else if (value != null && value.isArray()) {
                    value.forEach(v -> {
                        if (v.isTextual()) {
                            assignees.add(v.asText());
                        }
                    });
                }
            });
            case INITIATOR -> {
                if (initiator != null) {
                    assignees.add(initiator);
                }
            }
        }
        return List.copyOf(assignees);
    }
}
