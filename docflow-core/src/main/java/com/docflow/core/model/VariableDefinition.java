package com.docflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Declared workflow variable: name, type, optional default and whether a value must be
 * present when an instance starts.
 */
public record VariableDefinition(
    String name,
    VariableType type,
    JsonNode defaultValue,
    boolean required,
    String description
) {
    public VariableDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variable name cannot be empty");
        }
        type = type == null ? VariableType.ANY : type;
    }

    public static VariableDefinition optional(String name, VariableType type, JsonNode defaultValue) {
        return new VariableDefinition(name, type, defaultValue, false, null);
    }

    public static VariableDefinition required(String name, VariableType type) {
        return new VariableDefinition(name, type, null, true, null);
    }
}
