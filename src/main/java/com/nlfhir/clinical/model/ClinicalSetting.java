package com.nlfhir.clinical.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ClinicalSetting {

    OUTPATIENT("outpatient"),
    INPATIENT("inpatient"),
    EMERGENCY("emergency"),
    INTENSIVE_CARE("intensive_care"),
    UNKNOWN("unknown");

    private final String value;

    ClinicalSetting(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Like {@link #fromValue(String)}, but an absent value means {@link #OUTPATIENT}, the same
     * default a {@link ClinicalStructure} applies. Unrecognized values are still {@link #UNKNOWN}.
     */
    public static ClinicalSetting fromValueOrDefault(String raw) {
        return raw == null || raw.isBlank() ? OUTPATIENT : fromValue(raw);
    }

    @JsonCreator
    public static ClinicalSetting fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (ClinicalSetting setting : values()) {
            if (setting.value.equals(key) || setting.name().toLowerCase(Locale.ROOT).equals(key)) {
                return setting;
            }
        }
        return UNKNOWN;
    }
}
