package com.docflow.core.model.action;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Time-based escalation for a waiting node, measured from when the branch entered it.
 *
 * Firing n (0-based) is due at {@code enteredAt + triggerAfter + n * repeatInterval}.
 * Without a repeat interval the rule fires once. With one, it repeats up to
 * {@code maxRepeats} times after the first firing, or forever when maxRepeats is null.
 *
 * An empty targets list means "the node's assignees".
 */
public record EscalationRule(
    Duration triggerAfter,
    List<String> targets,
    Duration repeatInterval,
    Integer maxRepeats,
    List<Action> actions
) {
    public EscalationRule {
        if (triggerAfter == null || triggerAfter.isNegative()) {
            throw new IllegalArgumentException("Escalation triggerAfter must be non-negative");
        }
        if (repeatInterval != null && (repeatInterval.isZero() || repeatInterval.isNegative())) {
            throw new IllegalArgumentException("Escalation repeat interval must be positive");
        }
        if (maxRepeats != null && maxRepeats < 0) {
            throw new IllegalArgumentException("Escalation maxRepeats must be >= 0");
        }
        targets = targets == null ? List.of() : List.copyOf(targets);
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    /**
     * Single escalation to the node's assignees once the SLA elapses.
     */
    public static EscalationRule onSla(String nodeId, Duration sla) {
        return new EscalationRule(sla, List.of(), null, null,
            List.of(new Action.Escalate("sla-escalation", List.of(), "SLA exceeded on " + nodeId)));
    }

    public static EscalationRule once(Duration triggerAfter, List<String> targets, Action... actions) {
        return new EscalationRule(triggerAfter, targets, null, null, List.of(actions));
    }

    public static EscalationRule repeating(Duration triggerAfter, Duration every, Integer maxRepeats,
                                           List<String> targets, Action... actions) {
        return new EscalationRule(triggerAfter, targets, every, maxRepeats, List.of(actions));
    }

    /**
     * When the given firing is due, or empty if the rule is exhausted.
     *
     * @param enteredAt when the branch entered the node
     * @param firing 0-based firing number
     */
    public Optional<Instant> firingTime(Instant enteredAt, int firing) {
        if (firing < 0) {
            throw new IllegalArgumentException("Firing number must be >= 0");
        }
        if (firing > 0 && repeatInterval == null) {
            return Optional.empty();
        }
        if (maxRepeats != null && firing > maxRepeats) {
            return Optional.empty();
        }
        Instant first = enteredAt.plus(triggerAfter);
        return Optional.of(firing == 0 ? first : first.plus(repeatInterval.multipliedBy(firing)));
    }

    /**
     * The last firing already due at {@code now}, or -1 when the first firing is still ahead.
     */
    public int latestFiringDue(Instant enteredAt, Instant now) {
        Instant first = enteredAt.plus(triggerAfter);
        if (now.isBefore(first)) {
            return -1;
        }
        if (repeatInterval == null) {
            return 0;
        }
        long elapsed = Duration.between(first, now).toMillis() / repeatInterval.toMillis();
        long capped = maxRepeats == null ? elapsed : Math.min(elapsed, maxRepeats);
        return (int) Math.min(capped, Integer.MAX_VALUE);
    }

    /**
     * Actions to run for a firing. Escalate actions without explicit targets inherit the rule's
     * targets, and those without either inherit {@code fallbackTargets}.
     */
    public List<Action> actionsFor(List<String> fallbackTargets) {
        List<String> effectiveTargets = targets.isEmpty() ? fallbackTargets : targets;
        List<Action> resolved = new ArrayList<>(actions.size());
        for (Action action : actions) {
            if (action.kind() == Action.ActionKind.ESCALATE && ((Action.Escalate) action).targets().isEmpty()) {
                Action.Escalate escalate = (Action.Escalate) action;
                resolved.add(new Action.Escalate(escalate.id(), effectiveTargets, escalate.reason()));
            } else {
                resolved.add(action);
            }
        }
        return resolved;
    }
}
