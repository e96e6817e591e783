package com.abba.rxreminder.domain.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * A fire rule bounded by an absolute expiry. No fire is produced at or after {@code expiresAt}.
 */
public record ReminderTrigger(FireRule fireRule, Instant createdAt, Instant expiresAt) {

    public ReminderTrigger {
        Objects.requireNonNull(fireRule, "fireRule");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
        if (!expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("expiresAt must be after createdAt");
        }
    }

    public Optional<Instant> nextFireAfter(Instant t) {
        Instant candidate = fireRule.nextMatchAtOrAfter(t);
        return candidate.isBefore(expiresAt) ? Optional.of(candidate) : Optional.empty();
    }

    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
