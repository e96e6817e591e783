package com.abba.rxreminder.application.scheduling;

import com.abba.rxreminder.domain.exception.InvalidParameterException;
import com.abba.rxreminder.domain.model.FireRule;
import com.abba.rxreminder.domain.model.IntervalType;
import com.abba.rxreminder.domain.model.ReminderTrigger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Builds bounded triggers in the scheduler's civil zone. Weekly reminders repeat on the weekday of
 * {@code now}; callers cannot choose the day.
 */
@Component
public class RecurrenceRuleEngine {

    private final Clock clock;

    public RecurrenceRuleEngine(Clock clock) {
        this.clock = clock;
    }

    public ZoneId zone() {
        return clock.getZone();
    }

    public ReminderTrigger buildTrigger(IntervalType intervalType, int hour, int minute, int durationCount) {
        return buildTrigger(intervalType, hour, minute, durationCount, clock.instant());
    }

    public ReminderTrigger buildTrigger(IntervalType intervalType, int hour, int minute, int durationCount, Instant now) {
        if (intervalType == null) {
            throw new InvalidParameterException("Invalid interval_type. Must be 'daily' or 'weekly'.");
        }
        if (hour < 0 || hour > 23) {
            throw new InvalidParameterException("Hour must be between 0 and 23.");
        }
        if (minute < 0 || minute > 59) {
            throw new InvalidParameterException("Minute must be between 0 and 59.");
        }
        if (durationCount <= 0) {
            throw new InvalidParameterException("Duration must be a positive number.");
        }

        ZonedDateTime localNow = now.atZone(zone());
        LocalTime timeOfDay = LocalTime.of(hour, minute);
        return switch (intervalType) {
            case DAILY -> new ReminderTrigger(
                    FireRule.daily(timeOfDay, zone()),
                    now,
                    localNow.plusDays(durationCount).toInstant());
            case WEEKLY -> new ReminderTrigger(
                    FireRule.weekly(localNow.getDayOfWeek(), timeOfDay, zone()),
                    now,
                    localNow.plusWeeks(durationCount).toInstant());
        };
    }
}
