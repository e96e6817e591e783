package com.abba.rxreminder.domain.model;

import java.util.Locale;
import java.util.Optional;

public enum IntervalType {
    DAILY("daily"),
    WEEKLY("weekly");

    private final String value;

    IntervalType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<IntervalType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (IntervalType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
