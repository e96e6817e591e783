package com.abba.rxreminder.domain.model;

import org.springframework.scheduling.support.CronExpression;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * "Every day at HH:mm" or "every {@code anchorDay} at HH:mm", evaluated in a fixed civil zone.
 */
public record FireRule(IntervalType intervalType, LocalTime timeOfDay, DayOfWeek anchorDay, ZoneId zone) {

    public FireRule {
        Objects.requireNonNull(intervalType, "intervalType");
        Objects.requireNonNull(timeOfDay, "timeOfDay");
        Objects.requireNonNull(zone, "zone");
        if (intervalType == IntervalType.WEEKLY && anchorDay == null) {
            throw new IllegalArgumentException("weekly rule requires an anchor day");
        }
        if (intervalType == IntervalType.DAILY) {
            anchorDay = null;
        }
        timeOfDay = timeOfDay.withSecond(0).withNano(0);
    }

    public static FireRule daily(LocalTime timeOfDay, ZoneId zone) {
        return new FireRule(IntervalType.DAILY, timeOfDay, null, zone);
    }

    public static FireRule weekly(DayOfWeek anchorDay, LocalTime timeOfDay, ZoneId zone) {
        return new FireRule(IntervalType.WEEKLY, timeOfDay, anchorDay, zone);
    }

    /**
     * Spring cron form of this rule, e.g. {@code 0 30 8 * * *} or {@code 0 30 8 * * MON}.
     */
    public CronExpression cronExpression() {
        String dayOfWeek = intervalType == IntervalType.WEEKLY
                ? anchorDay.name().substring(0, 3)
                : "*";
        return CronExpression.parse(String.format("0 %d %d * * %s", timeOfDay.getMinute(), timeOfDay.getHour(), dayOfWeek));
    }

    /**
     * First instant at or after {@code t} matching this rule. Unbounded; expiry is applied by
     * {@link ReminderTrigger}.
     */
    public Instant nextMatchAtOrAfter(Instant t) {
        ZonedDateTime next = cronExpression().next(t.atZone(zone).minusNanos(1));
        if (next == null) {
            throw new IllegalStateException("No fire time found for " + this);
        }
        return next.toInstant();
    }
}
