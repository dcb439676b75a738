package com.docflow.core.model.guard;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of evaluating a guard. RequireAdditional counts as a denial for entering a node.
 */
public sealed interface GuardResult {

    Allow ALLOW = new Allow();

    boolean allowed();

    /**
     * Displayable explanation for a non-allow outcome.
     */
    String reason();

    record Allow() implements GuardResult {
        @Override
        public boolean allowed() {
            return true;
        }

        @Override
        public String reason() {
            return "allowed";
        }
    }

    record Deny(String reason, String guard) implements GuardResult {
        @Override
        public boolean allowed() {
            return false;
        }
    }

    record RequireAdditional(List<Requirement> requirements) implements GuardResult {
        public RequireAdditional {
            requirements = List.copyOf(requirements);
        }

        @Override
        public boolean allowed() {
            return false;
        }

        @Override
        public String reason() {
            return "additional requirements: " + requirements.stream().map(Requirement::description).toList();
        }
    }

    /**
     * Something that must happen before the guard allows, e.g. two more approvals.
     */
    record Requirement(String type, String description, int outstanding) {}

    static GuardResult allow() {
        return ALLOW;
    }

    static GuardResult deny(String reason, String guard) {
        return new Deny(reason, guard);
    }

    static GuardResult requireAdditional(Requirement... requirements) {
        return new RequireAdditional(List.of(requirements));
    }

    /**
     * Combine two results with AND semantics. Denials win over requirements; denial reasons
     * are joined and requirements concatenated.
     */
    static GuardResult combine(GuardResult first, GuardResult second) {
        if (first.allowed()) {
            return second;
        }
        if (second.allowed()) {
            return first;
        }
        if (first instanceof Deny || second instanceof Deny) {
            if (first instanceof Deny && second instanceof Deny) {
                Deny a = (Deny) first;
                Deny b = (Deny) second;
                return new Deny(a.reason() + "; " + b.reason(), a.guard() + "," + b.guard());
            }
            return first instanceof Deny ? first : second;
        }
        List<Requirement> merged = new ArrayList<>(((RequireAdditional) first).requirements());
        merged.addAll(((RequireAdditional) second).requirements());
        return new RequireAdditional(merged);
    }
}
