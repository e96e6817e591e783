package com.abba.rxreminder.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "rxreminder.reminder")
@Data
public class ReminderProperties {

    private String defaultCountryCode = "+91";
}
