package com.abba.rxreminder.domain.model;

import java.time.Instant;
import java.util.Objects;

public record ReminderJob(ReminderJobId id, int durationCount, ReminderTrigger trigger) {

    public ReminderJob {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(trigger, "trigger");
        if (trigger.fireRule().intervalType() != id.intervalType()) {
            throw new IllegalArgumentException("trigger interval does not match job id");
        }
    }

    public String phoneNumber() {
        return id.phoneNumber();
    }

    public String medicationName() {
        return id.medicationName();
    }

    public IntervalType intervalType() {
        return id.intervalType();
    }

    public Instant expiresAt() {
        return trigger.expiresAt();
    }

    public String createReminderMessage() {
        return "Reminder: It's time to take your medication - " + medicationName() + ".";
    }
}
