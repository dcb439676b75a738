package com.docflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Declared type of a workflow variable.
 */
public enum VariableType {
    STRING,
    NUMBER,
    BOOLEAN,
    OBJECT,
    ARRAY,
    ANY;

    /**
     * Null values are accepted by every type; requiredness is checked separately.
     */
    public boolean accepts(JsonNode value) {
        if (value == null || value.isNull() || this == ANY) {
            return true;
        }
        return switch (this) {
            case STRING -> value.isTextual();
            case NUMBER -> value.isNumber();
            case BOOLEAN -> value.isBoolean();
            case OBJECT -> value.isObject();
            case ARRAY -> value.isArray();
            case ANY -> true;
        };
    }
}
