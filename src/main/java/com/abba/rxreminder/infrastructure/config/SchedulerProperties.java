package com.abba.rxreminder.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "rxreminder.scheduler")
@Data
public class SchedulerProperties {

    private boolean enabled = true;
    private String timezone = "Asia/Kolkata";
    private long tickIntervalMs = 15_000;
    private Duration misfireGrace = Duration.ofMinutes(1);
    private int dispatchThreads = 4;
    private Duration shutdownTimeout = Duration.ofSeconds(10);
}
