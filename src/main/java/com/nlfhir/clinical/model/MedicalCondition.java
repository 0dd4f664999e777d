package com.nlfhir.clinical.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MedicalCondition(
        @JsonProperty("name")     String name,
        @JsonProperty("severity") String severity,
        @JsonProperty("onset")    String onset,
        @JsonProperty("status")   String status
) {

    public static final String DEFAULT_STATUS = "active";

    public MedicalCondition {
        name = EntityFields.requireName(name, "Condition");
        severity = EntityFields.blankToNull(severity);
        onset = EntityFields.blankToNull(onset);
        status = EntityFields.orDefault(status, DEFAULT_STATUS);
    }

    public static MedicalCondition active(String name) {
        return new MedicalCondition(name, null, null, DEFAULT_STATUS);
    }
}
