package com.docflow.core.model.guard;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Declarative precondition for entering a node. Serializable, no embedded code:
 * custom logic is referenced by name and resolved from the evaluator's guard table.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Guard.RequireRole.class, name = "role"),
    @JsonSubTypes.Type(value = Guard.RequirePermission.class, name = "permission"),
    @JsonSubTypes.Type(value = Guard.WithinTimeWindow.class, name = "timeWindow"),
    @JsonSubTypes.Type(value = Guard.ApprovalCount.class, name = "approvals"),
    @JsonSubTypes.Type(value = Guard.Named.class, name = "named"),
    @JsonSubTypes.Type(value = Guard.AllOf.class, name = "allOf"),
    @JsonSubTypes.Type(value = Guard.AnyOf.class, name = "anyOf"),
    @JsonSubTypes.Type(value = Guard.Not.class, name = "not")
})
public sealed interface Guard {

    /**
     * Short label used in denial reasons and logs.
     */
    String describe();

    record RequireRole(String role) implements Guard {
        @Override
        public String describe() {
            return "role:" + role;
        }
    }

    record RequirePermission(String permission) implements Guard {
        @Override
        public String describe() {
            return "permission:" + permission;
        }
    }

    record WithinTimeWindow(TimeWindow window) implements Guard {
        @Override
        public String describe() {
            return "window:" + window.start() + "-" + window.end();
        }
    }

    /**
     * Requires {@code required} distinct approvers listed in the array variable {@code variable}.
     */
    record ApprovalCount(int required, String variable) implements Guard {
        @Override
        public String describe() {
            return "approvals:" + required + "@" + variable;
        }
    }

    record Named(String name) implements Guard {
        @Override
        public String describe() {
            return "named:" + name;
        }
    }

    record AllOf(List<Guard> guards) implements Guard {
        public AllOf {
            guards = guards == null ? List.of() : List.copyOf(guards);
        }

        @Override
        public String describe() {
            return "allOf" + guards.stream().map(Guard::describe).toList();
        }
    }

    record AnyOf(List<Guard> guards) implements Guard {
        public AnyOf {
            guards = guards == null ? List.of() : List.copyOf(guards);
        }

        @Override
        public String describe() {
            return "anyOf" + guards.stream().map(Guard::describe).toList();
        }
    }

    record Not(Guard guard, String reason) implements Guard {
        @Override
        public String describe() {
            return "not(" + guard.describe() + ")";
        }
    }

    static Guard role(String role) {
        return new RequireRole(role);
    }

    static Guard permission(Permission permission) {
        return new RequirePermission(permission.name());
    }

    static Guard named(String name) {
        return new Named(name);
    }

    static Guard allOf(Guard... guards) {
        return new AllOf(List.of(guards));
    }

    static Guard anyOf(Guard... guards) {
        return new AnyOf(List.of(guards));
    }
}
