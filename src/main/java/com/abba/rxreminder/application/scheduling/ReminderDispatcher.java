package com.abba.rxreminder.application.scheduling;

import com.abba.rxreminder.application.service.PhoneNumberNormalizer;
import com.abba.rxreminder.domain.model.ReminderJob;
import com.abba.rxreminder.domain.service.SmsGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Sends reminder messages on a bounded pool, one task per fire. Delivery is at-most-once: a failed
 * send is logged and dropped, and the job's next scheduled fire is the only retry.
 */
@Slf4j
public class ReminderDispatcher {

    private final SmsGateway smsGateway;
    private final int threads;
    private final Duration shutdownTimeout;
    private volatile ExecutorService executor;

    public ReminderDispatcher(SmsGateway smsGateway, int threads, Duration shutdownTimeout) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be positive");
        }
        this.smsGateway = smsGateway;
        this.threads = threads;
        this.shutdownTimeout = shutdownTimeout;
    }

    public synchronized void start() {
        if (executor != null && !executor.isShutdown()) {
            return;
        }
        executor = Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("reminder-dispatch-"));
    }

    public boolean submit(ReminderJob job) {
        ExecutorService current = executor;
        if (current == null || current.isShutdown()) {
            log.warn("Dispatcher not running, dropping reminder jobId={}", job.id().displayValue());
            return false;
        }
        try {
            current.execute(() -> dispatch(job));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Dispatch rejected for jobId={}: {}", job.id().displayValue(), e.getMessage());
            return false;
        }
    }

    void dispatch(ReminderJob job) {
        String to = job.phoneNumber();
        try {
            String deliveryId = smsGateway.send(to, job.createReminderMessage());
            log.info("SMS reminder sent to={} medication={} deliveryId={}",
                    PhoneNumberNormalizer.mask(to), job.medicationName(), deliveryId);
        } catch (Exception e) {
            log.error("Failed to send SMS reminder to={} medication={}: {}",
                    PhoneNumberNormalizer.mask(to), job.medicationName(), e.getMessage(), e);
        }
    }

    public synchronized void stop() {
        ExecutorService current = executor;
        if (current == null) {
            return;
        }
        current.shutdown();
        try {
            if (!current.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Reminder dispatches still running after {}, interrupting", shutdownTimeout);
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            current.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
