package com.nlfhir.clinical.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Standardized medication routes.
 */
public enum MedicationRoute {

    ORAL("oral"),
    INTRAVENOUS("intravenous"),
    INTRAMUSCULAR("intramuscular"),
    SUBLINGUAL("sublingual"),
    TOPICAL("topical"),
    INHALATION("inhalation"),
    UNKNOWN("unknown");

    private final String value;

    MedicationRoute(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Lenient lookup by wire value or constant name. Anything unrecognised is {@link #UNKNOWN}.
     */
    @JsonCreator
    public static MedicationRoute fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (MedicationRoute route : values()) {
            if (route.value.equals(key) || route.name().toLowerCase(Locale.ROOT).equals(key)) {
                return route;
            }
        }
        return UNKNOWN;
    }
}
