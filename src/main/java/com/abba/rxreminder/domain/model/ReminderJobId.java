package com.abba.rxreminder.domain.model;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Identity of a recurring reminder. Two submissions with the same phone number, medication,
 * interval and time of day address the same job.
 */
public record ReminderJobId(String phoneNumber,
                            String medicationName,
                            IntervalType intervalType,
                            LocalTime timeOfDay) {

    private static final DateTimeFormatter COMPACT_TIME = DateTimeFormatter.ofPattern("HHmm");

    public ReminderJobId {
        Objects.requireNonNull(phoneNumber, "phoneNumber");
        Objects.requireNonNull(medicationName, "medicationName");
        Objects.requireNonNull(intervalType, "intervalType");
        Objects.requireNonNull(timeOfDay, "timeOfDay");
    }

    /**
     * Human readable form, e.g. {@code +919876543210_Metformin_daily_0830}. Underscores and
     * backslashes inside the free-text parts are escaped so distinct ids never render the same.
     */
    public String displayValue() {
        return escape(phoneNumber) + "_" + escape(medicationName) + "_" + intervalType.getValue() + "_" + COMPACT_TIME.format(timeOfDay);
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("_", "\\_");
    }
}
