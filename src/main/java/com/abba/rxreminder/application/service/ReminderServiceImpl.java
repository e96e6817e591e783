package com.abba.rxreminder.application.service;

import com.abba.rxreminder.application.dto.ReminderJobView;
import com.abba.rxreminder.application.dto.SetReminderRequest;
import com.abba.rxreminder.application.scheduling.RecurrenceRuleEngine;
import com.abba.rxreminder.application.scheduling.ReminderScheduler;
import com.abba.rxreminder.application.scheduling.ScheduledReminder;
import com.abba.rxreminder.domain.exception.InvalidFormatException;
import com.abba.rxreminder.domain.exception.InvalidParameterException;
import com.abba.rxreminder.domain.exception.MissingParameterException;
import com.abba.rxreminder.domain.model.IntervalType;
import com.abba.rxreminder.domain.model.ReminderJob;
import com.abba.rxreminder.domain.model.ReminderJobId;
import com.abba.rxreminder.domain.model.ReminderTrigger;
import com.abba.rxreminder.domain.service.ReminderService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
@Slf4j
@RequiredArgsConstructor
public class ReminderServiceImpl implements ReminderService {

    private static final Pattern REMINDER_TIME = Pattern.compile("^(\\d{1,2}):(\\d{2})$");
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final RecurrenceRuleEngine recurrenceRuleEngine;
    private final ReminderScheduler reminderScheduler;
    private final PhoneNumberNormalizer phoneNumberNormalizer;

    @Override
    public ReminderJobView scheduleReminder(SetReminderRequest request) {
        requireParameters(request);

        String phoneNumber = phoneNumberNormalizer.normalize(request.getPhoneNumber());
        LocalTime timeOfDay = parseReminderTime(request.getReminderTime());
        int durationCount = parseDuration(request.getDuration());
        IntervalType intervalType = IntervalType.fromValue(request.getIntervalType())
                .orElseThrow(() -> new InvalidParameterException("Invalid interval_type. Must be 'daily' or 'weekly'."));

        ReminderTrigger trigger = recurrenceRuleEngine.buildTrigger(
                intervalType, timeOfDay.getHour(), timeOfDay.getMinute(), durationCount);
        ReminderJobId id = new ReminderJobId(phoneNumber, request.getMedicationName(), intervalType, timeOfDay);
        ReminderJob job = new ReminderJob(id, durationCount, trigger);

        reminderScheduler.upsert(job);

        return reminderScheduler.find(id)
                .map(this::toView)
                .orElseGet(() -> toView(new ScheduledReminder(job,
                        reminderScheduler.nextFireAfter(job, trigger.createdAt()).orElse(null))));
    }

    @Override
    public List<ReminderJobView> listActiveReminders() {
        return reminderScheduler.activeJobs().stream()
                .sorted(Comparator.comparing(ScheduledReminder::nextFireAt, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(this::toView)
                .toList();
    }

    private void requireParameters(SetReminderRequest request) {
        if (request == null
                || isBlank(request.getPhoneNumber())
                || isBlank(request.getMedicationName())
                || isBlank(request.getReminderTime())
                || isBlank(request.getIntervalType())
                || isBlank(request.getDuration())) {
            log.warn("Rejecting reminder request with missing parameters");
            throw new MissingParameterException("Missing required parameters for reminder.");
        }
    }

    private LocalTime parseReminderTime(String value) {
        Matcher matcher = REMINDER_TIME.matcher(value.trim());
        if (!matcher.matches()) {
            log.warn("Rejecting reminder_time={}", value);
            throw new InvalidFormatException("Invalid time or duration format.");
        }
        int hour = Integer.parseInt(matcher.group(1));
        int minute = Integer.parseInt(matcher.group(2));
        if (hour > 23 || minute > 59) {
            throw new InvalidParameterException("reminder_time must be between 00:00 and 23:59.");
        }
        return LocalTime.of(hour, minute);
    }

    private int parseDuration(String value) {
        int duration;
        try {
            duration = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Rejecting duration={}", value);
            throw new InvalidFormatException("Invalid time or duration format.");
        }
        if (duration <= 0) {
            throw new InvalidFormatException("Duration must be a positive integer.");
        }
        return duration;
    }

    private ReminderJobView toView(ScheduledReminder scheduled) {
        ReminderJob job = scheduled.job();
        return new ReminderJobView(
                job.id().displayValue(),
                PhoneNumberNormalizer.mask(job.phoneNumber()),
                job.medicationName(),
                job.intervalType().getValue(),
                TIME_FORMAT.format(job.id().timeOfDay()),
                toOffset(scheduled.nextFireAt()),
                toOffset(job.expiresAt()));
    }

    private OffsetDateTime toOffset(Instant instant) {
        return instant == null ? null : instant.atZone(recurrenceRuleEngine.zone()).toOffsetDateTime();
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
