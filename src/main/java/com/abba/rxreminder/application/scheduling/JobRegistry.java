package com.abba.rxreminder.application.scheduling;

import com.abba.rxreminder.domain.model.ReminderJob;
import com.abba.rxreminder.domain.model.ReminderJobId;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Active reminder jobs keyed by identity. Every operation runs under one lock, so a replace never
 * interleaves with a due-time scan of the same id.
 */
class JobRegistry {

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<ReminderJobId, Entry> entries = new LinkedHashMap<>();

    Optional<ReminderJob> put(ReminderJob job, Instant firstFireAt) {
        lock.lock();
        try {
            Entry previous = entries.put(job.id(), new Entry(job, firstFireAt));
            return previous == null ? Optional.empty() : Optional.of(previous.job);
        } finally {
            lock.unlock();
        }
    }

    Optional<ScheduledReminder> find(ReminderJobId id) {
        lock.lock();
        try {
            Entry entry = entries.get(id);
            return entry == null ? Optional.empty() : Optional.of(entry.snapshot());
        } finally {
            lock.unlock();
        }
    }

    List<ReminderJob> removeExpired(Instant now) {
        lock.lock();
        try {
            List<ReminderJob> removed = new ArrayList<>();
            Iterator<Entry> iterator = entries.values().iterator();
            while (iterator.hasNext()) {
                Entry entry = iterator.next();
                if (entry.job.trigger().isExpiredAt(now)) {
                    removed.add(entry.job);
                    iterator.remove();
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Collects every job whose next fire is at or before {@code now} and advances it to its
     * following fire. Fires older than {@code misfireGrace} are reported as missed, not due.
     */
    DueScan pollDue(Instant now, Duration misfireGrace) {
        lock.lock();
        try {
            List<ReminderJob> due = new ArrayList<>();
            List<ScheduledReminder> missed = new ArrayList<>();
            Instant afterNow = now.plusNanos(1);
            for (Entry entry : entries.values()) {
                if (entry.nextFireAt == null || entry.nextFireAt.isAfter(now)) {
                    continue;
                }
                if (Duration.between(entry.nextFireAt, now).compareTo(misfireGrace) <= 0) {
                    due.add(entry.job);
                } else {
                    missed.add(entry.snapshot());
                }
                entry.nextFireAt = entry.job.trigger().nextFireAfter(afterNow).orElse(null);
            }
            return new DueScan(due, missed);
        } finally {
            lock.unlock();
        }
    }

    List<ScheduledReminder> snapshot() {
        lock.lock();
        try {
            return entries.values().stream().map(Entry::snapshot).toList();
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    record DueScan(List<ReminderJob> due, List<ScheduledReminder> missed) {
    }

    private static final class Entry {

        private final ReminderJob job;
        private Instant nextFireAt;

        private Entry(ReminderJob job, Instant nextFireAt) {
            this.job = job;
            this.nextFireAt = nextFireAt;
        }

        private ScheduledReminder snapshot() {
            return new ScheduledReminder(job, nextFireAt);
        }
    }
}
