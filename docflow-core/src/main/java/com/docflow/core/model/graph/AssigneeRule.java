package com.docflow.core.model.graph;

import java.util.List;

/**
 * Rule resolving who is responsible for a task node.
 *
 * <ul>
 *   <li>FIXED - the listed user ids</li>
 *   <li>ROLE - everyone holding one of the listed roles (resolved as "role:NAME" entries)</li>
 *   <li>VARIABLE - user ids read from the named instance variable (string or array)</li>
 *   <li>INITIATOR - whoever started the instance</li>
 * </ul>
 */
public record AssigneeRule(
    AssigneeType type,
    List<String> values
) {
    public enum AssigneeType {
        FIXED,
        ROLE,
        VARIABLE,
        INITIATOR
    }

    public AssigneeRule {
        if (type == null) {
            throw new IllegalArgumentException("Assignee rule type is required");
        }
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static AssigneeRule users(String... userIds) {
        return new AssigneeRule(AssigneeType.FIXED, List.of(userIds));
    }

    public static AssigneeRule role(String... roles) {
        return new AssigneeRule(AssigneeType.ROLE, List.of(roles));
    }

    public static AssigneeRule variable(String variableName) {
        return new AssigneeRule(AssigneeType.VARIABLE, List.of(variableName));
    }

    public static AssigneeRule initiator() {
        return new AssigneeRule(AssigneeType.INITIATOR, List.of());
    }
}
