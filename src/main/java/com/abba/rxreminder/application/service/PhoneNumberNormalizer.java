package com.abba.rxreminder.application.service;

import com.abba.rxreminder.infrastructure.config.ReminderProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PhoneNumberNormalizer {

    private final ReminderProperties reminderProperties;

    /**
     * Numbers starting with {@code +} are kept as they are; anything else is treated as a national
     * number and gets the default country code.
     */
    public String normalize(String phoneNumber) {
        String trimmed = phoneNumber == null ? "" : phoneNumber.trim();
        if (trimmed.startsWith("+")) {
            return trimmed;
        }
        return reminderProperties.getDefaultCountryCode() + trimmed;
    }

    public static String mask(String phoneNumber) {
        if (phoneNumber == null || phoneNumber.isBlank()) return "";
        if (phoneNumber.length() <= 6) return "***";
        return phoneNumber.substring(0, 3) + "***" + phoneNumber.substring(phoneNumber.length() - 3);
    }
}
