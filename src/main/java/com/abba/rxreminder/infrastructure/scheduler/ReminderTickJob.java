package com.abba.rxreminder.infrastructure.scheduler;

import com.abba.rxreminder.application.scheduling.ReminderScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "rxreminder.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReminderTickJob {

    private final ReminderScheduler reminderScheduler;
    private final Clock clock;

    public ReminderTickJob(ReminderScheduler reminderScheduler, Clock clock) {
        this.reminderScheduler = reminderScheduler;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${rxreminder.scheduler.tick-interval-ms:15000}")
    public void tick() {
        int dispatched = reminderScheduler.tick(clock.instant());
        if (dispatched > 0) {
            log.debug("Reminder tick dispatched {} job(s)", dispatched);
        }
    }
}
