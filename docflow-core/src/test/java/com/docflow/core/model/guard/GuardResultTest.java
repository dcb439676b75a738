package com.docflow.core.model.guard;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class GuardResultTest {

    @Test
    void combine_allowWithAnything_shouldReturnTheOther() {
        GuardResult deny = GuardResult.deny("no", "role:x");

        assertThat(GuardResult.combine(GuardResult.allow(), deny)).isSameAs(deny);
        assertThat(GuardResult.combine(deny, GuardResult.allow())).isSameAs(deny);
        assertThat(GuardResult.combine(GuardResult.allow(), GuardResult.allow()).allowed()).isTrue();
    }

    @Test
    void combine_twoDenials_shouldJoinReasons() {
        GuardResult combined = GuardResult.combine(
            GuardResult.deny("missing role", "role:legal"),
            GuardResult.deny("outside hours", "window"));

        assertThat(combined).isInstanceOf(GuardResult.Deny.class);
        assertThat(combined.reason()).isEqualTo("missing role; outside hours");
    }

    @Test
    void combine_requirements_shouldConcatenate() {
        GuardResult combined = GuardResult.combine(
            GuardResult.requireAdditional(new GuardResult.Requirement("approval", "1 more approval", 1)),
            GuardResult.requireAdditional(new GuardResult.Requirement("signature", "CFO signature", 1)));

        assertThat(combined).isInstanceOf(GuardResult.RequireAdditional.class);
        assertThat(((GuardResult.RequireAdditional) combined).requirements()).hasSize(2);
        assertThat(combined.allowed()).isFalse();
    }

    @Test
    void combine_denialBeatsRequirement() {
        GuardResult combined = GuardResult.combine(
            GuardResult.requireAdditional(new GuardResult.Requirement("approval", "1 more", 1)),
            GuardResult.deny("no", "role:x"));

        assertThat(combined).isInstanceOf(GuardResult.Deny.class);
    }

    @Test
    void actor_adminImpliesEveryPermission() {
        Actor admin = Actor.of("root").grant(Permission.ADMIN);

        assertThat(admin.hasPermission(Permission.APPROVE)).isTrue();
        assertThat(admin.hasPermission("publish-externally")).isTrue();
        assertThat(Actor.of("bob").hasPermission(Permission.VIEW)).isFalse();
    }

    @Test
    void timeWindow_shouldHonourDaysAndWrapPastMidnight() {
        ZoneId utc = ZoneId.of("UTC");
        TimeWindow business = TimeWindow.businessHours(utc);
        TimeWindow night = new TimeWindow(LocalTime.of(22, 0), LocalTime.of(6, 0), Set.of(), utc);

        // 2024-01-15 is a Monday
        assertThat(business.contains(Instant.parse("2024-01-15T10:00:00Z"))).isTrue();
        assertThat(business.contains(Instant.parse("2024-01-15T17:00:00Z"))).isFalse();
        assertThat(business.contains(Instant.parse("2024-01-13T10:00:00Z"))).isFalse();

        assertThat(night.contains(Instant.parse("2024-01-15T23:30:00Z"))).isTrue();
        assertThat(night.contains(Instant.parse("2024-01-15T03:00:00Z"))).isTrue();
        assertThat(night.contains(Instant.parse("2024-01-15T12:00:00Z"))).isFalse();
        assertThat(night.days()).hasSize(DayOfWeek.values().length);
    }
}
