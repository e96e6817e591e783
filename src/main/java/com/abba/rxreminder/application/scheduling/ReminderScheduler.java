package com.abba.rxreminder.application.scheduling;

import com.abba.rxreminder.application.service.PhoneNumberNormalizer;
import com.abba.rxreminder.domain.model.ReminderJob;
import com.abba.rxreminder.domain.model.ReminderJobId;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Owns the registry of recurring reminders and turns their fire instants into dispatches.
 *
 * <p>Lifecycle: {@link #start()} opens the dispatcher, {@link #tick(Instant)} is driven by a single
 * background loop, {@link #stop()} refuses further ticks and waits for in-flight sends. Upserts are
 * accepted in any state.
 */
@Slf4j
public class ReminderScheduler {

    private final JobRegistry registry = new JobRegistry();
    private final ReminderDispatcher dispatcher;
    private final Duration misfireGrace;
    private volatile boolean running;

    public ReminderScheduler(ReminderDispatcher dispatcher, Duration misfireGrace) {
        this.dispatcher = dispatcher;
        this.misfireGrace = misfireGrace;
    }

    public void start() {
        dispatcher.start();
        running = true;
        log.info("Reminder scheduler started misfireGrace={}", misfireGrace);
    }

    public void stop() {
        running = false;
        dispatcher.stop();
        log.info("Reminder scheduler stopped with {} active job(s)", registry.size());
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Installs the job, replacing any job with the same id. The replaced job's pending fires are
     * dropped; a send of the old job already handed to the dispatcher still completes.
     */
    public ReminderJobId upsert(ReminderJob job) {
        Instant createdAt = job.trigger().createdAt();
        Instant firstFire = nextFireAfter(job, createdAt).orElse(null);
        Optional<ReminderJob> replaced = registry.put(job, firstFire);
        log.info("{} {} reminder jobId={} to={} nextFire={} expiresAt={}",
                replaced.isPresent() ? "Replaced" : "Scheduled",
                job.intervalType().getValue(),
                job.id().displayValue(),
                PhoneNumberNormalizer.mask(job.phoneNumber()),
                firstFire,
                job.expiresAt());
        return job.id();
    }

    public Optional<Instant> nextFireAfter(ReminderJob job, Instant t) {
        return job.trigger().nextFireAfter(t);
    }

    public Optional<ScheduledReminder> find(ReminderJobId id) {
        return registry.find(id);
    }

    public List<ScheduledReminder> activeJobs() {
        return registry.snapshot();
    }

    public int sweepExpired(Instant now) {
        List<ReminderJob> removed = registry.removeExpired(now);
        removed.forEach(job -> log.info("Evicted expired reminder jobId={} expiresAt={}",
                job.id().displayValue(), job.expiresAt()));
        return removed.size();
    }

    /**
     * Evicts expired jobs, then hands every due job to the dispatcher.
     *
     * @return number of dispatches submitted
     */
    public int tick(Instant now) {
        if (!running) {
            return 0;
        }
        sweepExpired(now);
        JobRegistry.DueScan scan = registry.pollDue(now, misfireGrace);
        scan.missed().forEach(missed -> log.warn("Skipping missed reminder jobId={} scheduledFor={} now={}",
                missed.job().id().displayValue(), missed.nextFireAt(), now));
        int submitted = 0;
        for (ReminderJob job : scan.due()) {
            if (dispatcher.submit(job)) {
                submitted++;
            }
        }
        return submitted;
    }
}
