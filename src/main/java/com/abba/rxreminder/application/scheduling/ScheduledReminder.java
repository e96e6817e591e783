package com.abba.rxreminder.application.scheduling;

import com.abba.rxreminder.domain.model.ReminderJob;

import java.time.Instant;
import java.util.Optional;

/**
 * Read-only snapshot of a registry entry. {@code nextFireAt} is null once the job has no fire
 * left before its expiry.
 */
public record ScheduledReminder(ReminderJob job, Instant nextFireAt) {

    public Optional<Instant> nextFire() {
        return Optional.ofNullable(nextFireAt);
    }
}
