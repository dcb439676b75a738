package com.docflow.engine.guard;

import com.docflow.core.model.guard.Guard;
import com.docflow.core.model.guard.GuardContext;
import com.docflow.core.model.guard.GuardResult;
import com.docflow.core.model.guard.NamedGuard;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Guard evaluator with a table of custom guards looked up by name.
 *
 * Built-in guards:
 * <ul>
 *   <li>role / permission - checked against the acting {@link com.docflow.core.model.guard.Actor}</li>
 *   <li>timeWindow - checked against the context's clock reading</li>
 *   <li>approvals - counts distinct entries of an array variable; short counts yield RequireAdditional</li>
 *   <li>allOf / anyOf / not - composition</li>
 * </ul>
 */
public class DefaultGuardEvaluator implements GuardEvaluator {

    private static final Logger log = LoggerFactory.getLogger(DefaultGuardEvaluator.class);

    private final Map<String, NamedGuard> namedGuards;

    public DefaultGuardEvaluator() {
        this(Map.of());
    }

    public DefaultGuardEvaluator(Map<String, NamedGuard> namedGuards) {
        this.namedGuards = Map.copyOf(namedGuards);
    }

    @Override
    public GuardResult evaluate(Guard guard, GuardContext context) {
        if (guard instanceof Guard.RequireRole) {
            String role = ((Guard.RequireRole) guard).role();
            return context.actor().hasRole(role)
                ? GuardResult.allow()
                : GuardResult.deny("Actor " + context.actor().id() + " lacks role " + role, guard.describe());
        }
        if (guard instanceof Guard.RequirePermission) {
            String permission = ((Guard.RequirePermission) guard).permission();
            return context.actor().hasPermission(permission)
                ? GuardResult.allow()
                : GuardResult.deny("Actor " + context.actor().id() + " lacks permission " + permission,
                    guard.describe());
        }
        if (guard instanceof Guard.WithinTimeWindow) {
            return ((Guard.WithinTimeWindow) guard).window().contains(context.now())
                ? GuardResult.allow()
                : GuardResult.deny("Outside allowed time window", guard.describe());
        }
        if (guard instanceof Guard.ApprovalCount) {
            return evaluateApprovals((Guard.ApprovalCount) guard, context);
        }
        if (guard instanceof Guard.Named) {
            return evaluateNamed(((Guard.Named) guard).name(), context);
        }
        if (guard instanceof Guard.AllOf) {
            return evaluateAll(((Guard.AllOf) guard).guards(), context);
        }
        if (guard instanceof Guard.AnyOf) {
            return evaluateAny((Guard.AnyOf) guard, context);
        }
        Guard.Not not = (Guard.Not) guard;
        GuardResult inner = evaluate(not.guard(), context);
        if (!inner.allowed()) {
            return GuardResult.allow();
        }
        String reason = not.reason() != null ? not.reason() : "Negated guard holds: " + not.guard().describe();
        return GuardResult.deny(reason, guard.describe());
    }

    @Override
    public GuardResult evaluateAll(List<Guard> guards, GuardContext context) {
        GuardResult combined = GuardResult.allow();
        for (Guard guard : guards) {
            GuardResult result = evaluate(guard, context);
            combined = GuardResult.combine(combined, result);
            if (combined instanceof GuardResult.Deny) {
                return combined;
            }
        }
        return combined;
    }

    @Override
    public GuardResult evaluateNamed(String name, GuardContext context) {
        NamedGuard guard = namedGuards.get(name);
        if (guard == null) {
            return GuardResult.deny("Unknown guard: " + name, "named:" + name);
        }
        try {
            GuardResult result = guard.evaluate(context);
            return result == null ? GuardResult.deny("Guard returned no result", "named:" + name) : result;
        } catch (RuntimeException e) {
            log.warn("Guard {} failed on node {}: {}", name, context.nodeId(), e.getMessage());
            return GuardResult.deny("Guard " + name + " failed: " + e.getMessage(), "named:" + name);
        }
    }

    @Override
    public Set<String> guardNames() {
        return namedGuards.keySet();
    }

    private GuardResult evaluateApprovals(Guard.ApprovalCount guard, GuardContext context) {
        JsonNode approvals = context.variable(guard.variable());
        Set<String> approvers = new LinkedHashSet<>();
        if (approvals != null && approvals.isArray()) {
            approvals.forEach(a -> {
                if (a.isTextual() && !a.asText().isBlank()) {
                    approvers.add(a.asText());
                }
            });
        }
        int outstanding = guard.required() - approvers.size();
        if (outstanding <= 0) {
            return GuardResult.allow();
        }
        return GuardResult.requireAdditional(new GuardResult.Requirement(
            "approval",
            outstanding + " more approval(s) recorded in " + guard.variable(),
            outstanding));
    }

    private GuardResult evaluateAny(Guard.AnyOf anyOf, GuardContext context) {
        if (anyOf.guards().isEmpty()) {
            return GuardResult.allow();
        }
        List<GuardResult> failures = new ArrayList<>();
        for (Guard guard : anyOf.guards()) {
            GuardResult result = evaluate(guard, context);
            if (result.allowed()) {
                return result;
            }
            failures.add(result);
        }
        GuardResult combined = failures.get(0);
        for (int i = 1; i < failures.size(); i++) {
            combined = GuardResult.combine(combined, failures.get(i));
        }
        return combined;
    }
}
