package com.docflow.scheduler;

import com.docflow.core.model.action.EscalationRule;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * A queued deadline for one node of one instance.
 *
 * @param ruleIndex position of the escalation rule on the node, -1 for timeouts
 * @param firing 0-based firing number of the rule
 * @param rule the escalation rule, null for timeouts
 * @param anchor when the branch entered the node; escalation firings are measured from it
 * @param armOrdinal history length when the node was entered; distinguishes re-entries
 * @param fireAttempts callback attempts that ended in an error
 */
public record ScheduledTimer(
    UUID timerId,
    UUID instanceId,
    String nodeId,
    TimerKind kind,
    int ruleIndex,
    int firing,
    EscalationRule rule,
    Instant anchor,
    Instant fireAt,
    long armOrdinal,
    int fireAttempts
) {
    public ScheduledTimer {
        if (instanceId == null || nodeId == null || kind == null || fireAt == null) {
            throw new IllegalArgumentException("Timer needs an instance, a node, a kind and a fire time");
        }
        if (kind == TimerKind.ESCALATION && rule == null) {
            throw new IllegalArgumentException("Escalation timer needs its rule: " + nodeId);
        }
    }

    public static ScheduledTimer timeout(UUID instanceId, String nodeId, Instant anchor, Instant fireAt,
                                         long armOrdinal) {
        return new ScheduledTimer(UUID.randomUUID(), instanceId, nodeId, TimerKind.TIMEOUT,
            -1, 0, null, anchor, fireAt, armOrdinal, 0);
    }

    /**
     * First firing of a rule, or empty if the rule never fires.
     */
    public static Optional<ScheduledTimer> escalation(UUID instanceId, String nodeId, int ruleIndex,
                                                      EscalationRule rule, Instant anchor, long armOrdinal) {
        return escalation(instanceId, nodeId, ruleIndex, rule, anchor, 0, armOrdinal);
    }

    /**
     * A given firing of a rule, or empty if the rule never reaches it.
     */
    public static Optional<ScheduledTimer> escalation(UUID instanceId, String nodeId, int ruleIndex,
                                                      EscalationRule rule, Instant anchor, int firing,
                                                      long armOrdinal) {
        return rule.firingTime(anchor, firing).map(fireAt -> new ScheduledTimer(UUID.randomUUID(), instanceId,
            nodeId, TimerKind.ESCALATION, ruleIndex, firing, rule, anchor, fireAt, armOrdinal, 0));
    }

    /**
     * Following firing of the same escalation rule, or empty once the rule is exhausted.
     */
    public Optional<ScheduledTimer> nextFiring() {
        if (kind != TimerKind.ESCALATION) {
            return Optional.empty();
        }
        return rule.firingTime(anchor, firing + 1).map(next -> new ScheduledTimer(UUID.randomUUID(),
            instanceId, nodeId, kind, ruleIndex, firing + 1, rule, anchor, next, armOrdinal, 0));
    }

    public ScheduledTimer retryAt(Instant when) {
        return new ScheduledTimer(timerId, instanceId, nodeId, kind, ruleIndex, firing, rule,
            anchor, when, armOrdinal, fireAttempts + 1);
    }
}
