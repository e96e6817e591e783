package com.abba.rxreminder.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;

public record ReminderJobView(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("phone_number") String phoneNumber,
        @JsonProperty("medication_name") String medicationName,
        @JsonProperty("interval_type") String intervalType,
        @JsonProperty("reminder_time") String reminderTime,
        @JsonProperty("next_fire_at") OffsetDateTime nextFireAt,
        @JsonProperty("expires_at") OffsetDateTime expiresAt
) {
}
