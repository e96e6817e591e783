package com.abba.rxreminder.application.service;

import com.abba.rxreminder.application.dto.ReminderJobView;
import com.abba.rxreminder.application.dto.SetReminderRequest;
import com.abba.rxreminder.application.scheduling.RecurrenceRuleEngine;
import com.abba.rxreminder.application.scheduling.ReminderDispatcher;
import com.abba.rxreminder.application.scheduling.ReminderScheduler;
import com.abba.rxreminder.application.scheduling.ScheduledReminder;
import com.abba.rxreminder.domain.exception.InvalidFormatException;
import com.abba.rxreminder.domain.exception.InvalidParameterException;
import com.abba.rxreminder.domain.exception.MissingParameterException;
import com.abba.rxreminder.domain.model.IntervalType;
import com.abba.rxreminder.domain.model.ReminderJobId;
import com.abba.rxreminder.domain.service.SmsGateway;
import com.abba.rxreminder.infrastructure.config.ReminderProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@ExtendWith(MockitoExtension.class)
class ReminderServiceImplTest {

    private static final ZoneId KOLKATA = ZoneId.of("Asia/Kolkata");
    // Monday 2026-03-02 07:00 IST
    private static final Instant NOW = ZonedDateTime.of(2026, 3, 2, 7, 0, 0, 0, KOLKATA).toInstant();

    @Mock
    private SmsGateway smsGateway;

    private ReminderScheduler scheduler;
    private ReminderServiceImpl reminderService;

    @BeforeEach
    void setUp() {
        RecurrenceRuleEngine engine = new RecurrenceRuleEngine(Clock.fixed(NOW, KOLKATA));
        scheduler = new ReminderScheduler(new ReminderDispatcher(smsGateway, 1, Duration.ofSeconds(1)), Duration.ofMinutes(1));
        reminderService = new ReminderServiceImpl(engine, scheduler, new PhoneNumberNormalizer(new ReminderProperties()));
    }

    @Test
    @DisplayName("Daily Metformin reminder is registered under its identity with a ten day expiry")
    void schedulesDailyReminder() {
        ReminderJobView view = reminderService.scheduleReminder(request("9876543210", "Metformin", "08:30", "daily", "10"));

        ReminderJobId expectedId = new ReminderJobId("+919876543210", "Metformin", IntervalType.DAILY, LocalTime.of(8, 30));
        ScheduledReminder scheduled = scheduler.find(expectedId).orElseThrow();
        assertThat(scheduled.job().expiresAt()).isEqualTo(NOW.atZone(KOLKATA).plusDays(10).toInstant());
        assertThat(scheduled.nextFireAt()).isEqualTo(ZonedDateTime.of(2026, 3, 2, 8, 30, 0, 0, KOLKATA).toInstant());

        assertThat(view.jobId()).isEqualTo("+919876543210_Metformin_daily_0830");
        assertThat(view.phoneNumber()).isEqualTo("+91***210");
        assertThat(view.reminderTime()).isEqualTo("08:30");
        assertThat(view.nextFireAt()).isEqualTo(OffsetDateTime.parse("2026-03-02T08:30+05:30"));
        assertThat(view.expiresAt()).isEqualTo(OffsetDateTime.parse("2026-03-12T07:00+05:30"));
    }

    @Test
    void resubmissionKeepsASingleJob() {
        reminderService.scheduleReminder(request("9876543210", "Metformin", "08:30", "daily", "10"));
        reminderService.scheduleReminder(request("+919876543210", "Metformin", "8:30", "daily", "3"));

        assertThat(scheduler.activeJobs()).hasSize(1);
        assertThat(scheduler.activeJobs().get(0).job().durationCount()).isEqualTo(3);
    }

    @Test
    void weeklyReminderFiresOnTheDayItWasRequested() {
        ReminderJobView view = reminderService.scheduleReminder(request("9876543210", "Vitamin D", "06:00", "weekly", "4"));

        assertThat(view.intervalType()).isEqualTo("weekly");
        assertThat(view.nextFireAt().getDayOfWeek()).isEqualTo(DayOfWeek.MONDAY);
        assertThat(view.nextFireAt()).isEqualTo(OffsetDateTime.parse("2026-03-09T06:00+05:30"));
        assertThat(view.expiresAt()).isEqualTo(OffsetDateTime.parse("2026-03-30T07:00+05:30"));
    }

    @Test
    void intervalTypeIsCaseInsensitive() {
        ReminderJobView view = reminderService.scheduleReminder(request("9876543210", "Metformin", "20:00", "Daily", "2"));

        assertThat(view.intervalType()).isEqualTo("daily");
    }

    @Test
    void malformedTimeIsRejectedWithoutRegistryChange() {
        assertThatThrownBy(() -> reminderService.scheduleReminder(request("9876543210", "Metformin", "8:xx", "daily", "10")))
                .isInstanceOf(InvalidFormatException.class);

        assertThat(scheduler.activeJobs()).isEmpty();
    }

    @Test
    void nonNumericOrNonPositiveDurationIsAFormatError() {
        assertThatThrownBy(() -> reminderService.scheduleReminder(request("9876543210", "Metformin", "08:30", "daily", "ten")))
                .isInstanceOf(InvalidFormatException.class);
        assertThatThrownBy(() -> reminderService.scheduleReminder(request("9876543210", "Metformin", "08:30", "daily", "0")))
                .isInstanceOf(InvalidFormatException.class);
        assertThatThrownBy(() -> reminderService.scheduleReminder(request("9876543210", "Metformin", "08:30", "daily", "-2")))
                .isInstanceOf(InvalidFormatException.class);

        assertThat(scheduler.activeJobs()).isEmpty();
    }

    @Test
    void unknownIntervalTypeIsAParameterError() {
        assertThatThrownBy(() -> reminderService.scheduleReminder(request("9876543210", "Metformin", "08:30", "monthly", "10")))
                .isInstanceOf(InvalidParameterException.class);

        assertThat(scheduler.activeJobs()).isEmpty();
    }

    @Test
    void outOfRangeTimeIsAParameterError() {
        assertThatThrownBy(() -> reminderService.scheduleReminder(request("9876543210", "Metformin", "25:00", "daily", "10")))
                .isInstanceOf(InvalidParameterException.class);
    }

    @Test
    void missingFieldsAreRejected() {
        assertThatThrownBy(() -> reminderService.scheduleReminder(request("9876543210", null, "08:30", "daily", "10")))
                .isInstanceOf(MissingParameterException.class);
        assertThatThrownBy(() -> reminderService.scheduleReminder(request("9876543210", "Metformin", "08:30", "daily", null)))
                .isInstanceOf(MissingParameterException.class);
        assertThatThrownBy(() -> reminderService.scheduleReminder(null))
                .isInstanceOf(MissingParameterException.class);

        assertThat(scheduler.activeJobs()).isEmpty();
    }

    @Test
    void listsActiveRemindersSoonestFirst() {
        reminderService.scheduleReminder(request("9876543210", "Metformin", "20:00", "daily", "10"));
        reminderService.scheduleReminder(request("9876543210", "Aspirin", "08:00", "daily", "10"));

        assertThat(reminderService.listActiveReminders())
                .extracting(ReminderJobView::medicationName)
                .containsExactly("Aspirin", "Metformin");
    }

    private SetReminderRequest request(String phone, String medication, String time, String interval, String duration) {
        return SetReminderRequest.builder()
                .phoneNumber(phone)
                .medicationName(medication)
                .reminderTime(time)
                .intervalType(interval)
                .duration(duration)
                .build();
    }
}
