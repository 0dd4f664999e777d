package com.nlfhir.clinical.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Diagnostic procedure or imaging order.
 */
public record DiagnosticProcedure(
        @JsonProperty("name")            String name,
        @JsonProperty("procedure_type")  String procedureType,
        @JsonProperty("urgency")         UrgencyLevel urgency,
        @JsonProperty("body_site")       String bodySite,
        @JsonProperty("contrast_needed") boolean contrastNeeded,
        @JsonProperty("special_prep")    List<String> specialPrep
) {

    public static final String DEFAULT_PROCEDURE_TYPE = "diagnostic";

    public DiagnosticProcedure {
        name = EntityFields.requireName(name, "Procedure");
        procedureType = EntityFields.orDefault(procedureType, DEFAULT_PROCEDURE_TYPE);
        urgency = urgency != null ? urgency : UrgencyLevel.ROUTINE;
        bodySite = EntityFields.blankToNull(bodySite);
        specialPrep = EntityFields.copyOf(specialPrep);
    }

    public DiagnosticProcedure(String name, UrgencyLevel urgency, boolean contrastNeeded) {
        this(name, DEFAULT_PROCEDURE_TYPE, urgency, null, contrastNeeded, List.of());
    }
}
