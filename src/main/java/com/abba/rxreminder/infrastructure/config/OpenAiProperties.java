package com.abba.rxreminder.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "rxreminder.openai")
@Data
public class OpenAiProperties {

    private String model = "gpt-4o-mini";
}
