package com.docflow.core.model.graph;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Boolean predicate over instance variables attached to an edge or a decision branch.
 * A condition that references an unset variable is false.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Condition.Expression.class, name = "expression"),
    @JsonSubTypes.Type(value = Condition.VariableEquals.class, name = "equals"),
    @JsonSubTypes.Type(value = Condition.GuardRef.class, name = "guard")
})
public sealed interface Condition {

    /**
     * SpEL boolean expression evaluated against the variable map, e.g. {@code decision == 'approve'}.
     */
    record Expression(String expression) implements Condition {
        public Expression {
            if (expression == null || expression.isBlank()) {
                throw new IllegalArgumentException("Condition expression cannot be empty");
            }
        }
    }

    /**
     * True when the variable is set and equal to the given JSON value.
     */
    record VariableEquals(String variable, JsonNode value) implements Condition {}

    /**
     * True when the named guard from the engine's guard table allows.
     */
    record GuardRef(String guardName) implements Condition {}

    static Condition expression(String expression) {
        return new Expression(expression);
    }

    static Condition guard(String guardName) {
        return new GuardRef(guardName);
    }
}
