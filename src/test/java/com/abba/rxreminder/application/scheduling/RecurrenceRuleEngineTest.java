package com.abba.rxreminder.application.scheduling;

import com.abba.rxreminder.domain.exception.InvalidParameterException;
import com.abba.rxreminder.domain.model.IntervalType;
import com.abba.rxreminder.domain.model.ReminderTrigger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecurrenceRuleEngineTest {

    private static final ZoneId KOLKATA = ZoneId.of("Asia/Kolkata");
    // Thursday 2026-03-05 18:45 IST
    private static final Instant NOW = ZonedDateTime.of(2026, 3, 5, 18, 45, 0, 0, KOLKATA).toInstant();

    private RecurrenceRuleEngine engine;

    @BeforeEach
    void setUp() {
        engine = new RecurrenceRuleEngine(Clock.fixed(NOW, KOLKATA));
    }

    @Test
    void dailyTriggerExpiresAfterDurationDays() {
        ReminderTrigger trigger = engine.buildTrigger(IntervalType.DAILY, 8, 30, 10);

        assertThat(trigger.createdAt()).isEqualTo(NOW);
        assertThat(trigger.expiresAt()).isEqualTo(ZonedDateTime.of(2026, 3, 15, 18, 45, 0, 0, KOLKATA).toInstant());
        assertThat(trigger.fireRule().intervalType()).isEqualTo(IntervalType.DAILY);
        assertThat(trigger.fireRule().timeOfDay()).isEqualTo(LocalTime.of(8, 30));
        assertThat(trigger.fireRule().zone()).isEqualTo(KOLKATA);
    }

    @Test
    void weeklyTriggerAnchorsOnTheDayOfCreation() {
        ReminderTrigger trigger = engine.buildTrigger(IntervalType.WEEKLY, 9, 0, 3);

        assertThat(trigger.fireRule().anchorDay()).isEqualTo(DayOfWeek.THURSDAY);
        assertThat(trigger.expiresAt()).isEqualTo(ZonedDateTime.of(2026, 3, 26, 18, 45, 0, 0, KOLKATA).toInstant());
        assertThat(trigger.nextFireAfter(NOW))
                .contains(ZonedDateTime.of(2026, 3, 12, 9, 0, 0, 0, KOLKATA).toInstant());
    }

    @Test
    void anchorDayFollowsTheSchedulerZoneNotUtc() {
        // 2026-03-05T20:00Z is already Friday in Kolkata
        Instant lateUtc = Instant.parse("2026-03-05T20:00:00Z");

        ReminderTrigger trigger = engine.buildTrigger(IntervalType.WEEKLY, 9, 0, 1, lateUtc);

        assertThat(trigger.fireRule().anchorDay()).isEqualTo(DayOfWeek.FRIDAY);
    }

    @Test
    void rejectsOutOfRangeParameters() {
        assertThatThrownBy(() -> engine.buildTrigger(IntervalType.DAILY, 24, 0, 1))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> engine.buildTrigger(IntervalType.DAILY, -1, 0, 1))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> engine.buildTrigger(IntervalType.DAILY, 8, 60, 1))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> engine.buildTrigger(IntervalType.WEEKLY, 8, 0, 0))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> engine.buildTrigger(null, 8, 0, 1))
                .isInstanceOf(InvalidParameterException.class);
    }
}
