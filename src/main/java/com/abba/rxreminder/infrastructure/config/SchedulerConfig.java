package com.abba.rxreminder.infrastructure.config;

import com.abba.rxreminder.application.scheduling.ReminderDispatcher;
import com.abba.rxreminder.application.scheduling.ReminderScheduler;
import com.abba.rxreminder.domain.service.SmsGateway;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableScheduling
public class SchedulerConfig {

    @Bean
    public Clock clock(SchedulerProperties properties) {
        return Clock.system(ZoneId.of(properties.getTimezone()));
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public ReminderScheduler reminderScheduler(SmsGateway smsGateway, SchedulerProperties properties) {
        ReminderDispatcher dispatcher = new ReminderDispatcher(
                smsGateway,
                properties.getDispatchThreads(),
                properties.getShutdownTimeout());
        return new ReminderScheduler(dispatcher, properties.getMisfireGrace());
    }
}
