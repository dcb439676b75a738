package com.docflow.core.model.guard;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Recurring daily window, optionally restricted to some weekdays.
 * A window whose end is before its start wraps past midnight.
 */
public record TimeWindow(
    LocalTime start,
    LocalTime end,
    Set<DayOfWeek> days,
    ZoneId zone
) {
    public TimeWindow {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Time window needs a start and an end");
        }
        days = days == null || days.isEmpty() ? EnumSet.allOf(DayOfWeek.class) : Set.copyOf(days);
        zone = zone == null ? ZoneId.of("UTC") : zone;
    }

    public static TimeWindow businessHours(ZoneId zone) {
        return new TimeWindow(LocalTime.of(9, 0), LocalTime.of(17, 0),
            EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY), zone);
    }

    public boolean contains(Instant instant) {
        ZonedDateTime local = instant.atZone(zone);
        if (!days.contains(local.getDayOfWeek())) {
            return false;
        }
        LocalTime time = local.toLocalTime();
        if (!end.isBefore(start)) {
            return !time.isBefore(start) && time.isBefore(end);
        }
        return !time.isBefore(start) || time.isBefore(end);
    }
}
