package com.nlfhir.clinical.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum UrgencyLevel {

    ROUTINE("routine"),
    URGENT("urgent"),
    STAT("stat"),
    ASAP("asap");

    private final String value;

    UrgencyLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static UrgencyLevel fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return ROUTINE;
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (UrgencyLevel level : values()) {
            if (level.value.equals(key)) {
                return level;
            }
        }
        return ROUTINE;
    }
}
