package com.abba.rxreminder.application.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SetReminderRequest {

    @JsonProperty("phone_number")
    private String phoneNumber;

    @JsonProperty("medication_name")
    private String medicationName;

    @JsonProperty("reminder_time")
    private String reminderTime;

    @JsonProperty("interval_type")
    private String intervalType;

    // numbers are accepted too and read as text
    @JsonProperty("duration")
    private String duration;
}
