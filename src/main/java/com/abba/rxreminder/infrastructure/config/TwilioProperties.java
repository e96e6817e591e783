package com.abba.rxreminder.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "rxreminder.twilio")
@Data
public class TwilioProperties {

    private boolean enabled = false;
    private String apiBaseUrl = "https://api.twilio.com";
    private String accountSid;
    private String authToken;
    private String fromNumber;
}
