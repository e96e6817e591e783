package com.abba.rxreminder.application.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SetReminderResponse(
        @JsonProperty("message") String message,
        @JsonProperty("job_id") String jobId,
        @JsonProperty("interval_type") String intervalType,
        @JsonProperty("next_fire_at") OffsetDateTime nextFireAt,
        @JsonProperty("expires_at") OffsetDateTime expiresAt
) {

    public static SetReminderResponse scheduled(ReminderJobView view) {
        return new SetReminderResponse(
                "Reminder for " + view.medicationName() + " scheduled successfully!",
                view.jobId(),
                view.intervalType(),
                view.nextFireAt(),
                view.expiresAt()
        );
    }
}
