package com.docflow.core.model.graph;

import com.docflow.core.model.action.Action;
import com.docflow.core.model.action.EscalationRule;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class EscalationRuleTest {

    private static final Instant ENTERED = Instant.parse("2024-01-15T09:00:00Z");

    @Test
    void firingTime_withoutRepeat_shouldFireOnce() {
        EscalationRule rule = EscalationRule.once(Duration.ofHours(1), List.of("manager"));

        assertThat(rule.firingTime(ENTERED, 0)).contains(ENTERED.plus(Duration.ofHours(1)));
        assertThat(rule.firingTime(ENTERED, 1)).isEmpty();
    }

    @Test
    void firingTime_withRepeat_shouldStopAfterMaxRepeats() {
        EscalationRule rule = EscalationRule.repeating(
            Duration.ofHours(1), Duration.ofMinutes(30), 2, List.of("manager"));

        assertThat(rule.firingTime(ENTERED, 0)).contains(Instant.parse("2024-01-15T10:00:00Z"));
        assertThat(rule.firingTime(ENTERED, 1)).contains(Instant.parse("2024-01-15T10:30:00Z"));
        assertThat(rule.firingTime(ENTERED, 2)).contains(Instant.parse("2024-01-15T11:00:00Z"));
        assertThat(rule.firingTime(ENTERED, 3)).isEmpty();
    }

    @Test
    void firingTime_withUnboundedRepeat_shouldNeverExhaust() {
        EscalationRule rule = EscalationRule.repeating(
            Duration.ZERO, Duration.ofDays(1), null, List.of());

        assertThat(rule.firingTime(ENTERED, 365)).contains(ENTERED.plus(Duration.ofDays(365)));
    }

    @Test
    void latestFiringDue_shouldCountElapsedRepeats() {
        EscalationRule rule = EscalationRule.repeating(
            Duration.ofHours(1), Duration.ofMinutes(30), 2, List.of("manager"));

        assertThat(rule.latestFiringDue(ENTERED, Instant.parse("2024-01-15T09:59:59Z"))).isEqualTo(-1);
        assertThat(rule.latestFiringDue(ENTERED, Instant.parse("2024-01-15T10:00:00Z"))).isZero();
        assertThat(rule.latestFiringDue(ENTERED, Instant.parse("2024-01-15T10:45:00Z"))).isEqualTo(1);
        assertThat(rule.latestFiringDue(ENTERED, Instant.parse("2024-01-16T09:00:00Z"))).isEqualTo(2);
    }

    @Test
    void latestFiringDue_withoutRepeat_shouldStayAtFirstFiring() {
        EscalationRule rule = EscalationRule.once(Duration.ofHours(1), List.of("manager"));

        assertThat(rule.latestFiringDue(ENTERED, ENTERED.plus(Duration.ofDays(3)))).isZero();
    }

    @Test
    void actionsFor_shouldFillMissingEscalationTargets() {
        EscalationRule rule = EscalationRule.once(Duration.ofHours(1), List.of(),
            Action.escalate("esc", "late"),
            Action.notify("ping", "reminder", "bob"));

        List<Action> actions = rule.actionsFor(List.of("alice"));

        assertThat(((Action.Escalate) actions.get(0)).targets()).containsExactly("alice");
        assertThat(((Action.Notify) actions.get(1)).recipients()).containsExactly("bob");
    }

    @Test
    void taskSla_withoutRules_shouldDefaultToSingleEscalation() {
        TaskNode task = TaskNode.builder("review").sla(Duration.ofHours(1)).build();

        List<EscalationRule> rules = task.effectiveEscalations();

        assertThat(rules).hasSize(1);
        assertThat(rules.get(0).triggerAfter()).isEqualTo(Duration.ofHours(1));
        assertThat(rules.get(0).repeatInterval()).isNull();
        assertThat(rules.get(0).actions()).extracting(Action::kind)
            .containsExactly(Action.ActionKind.ESCALATE);
    }
}
