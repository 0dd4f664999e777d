package com.nlfhir.clinical.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * A single medication mention with its dosing details.
 *
 * <p>{@code safetyFlag} is derived: it is true whenever the order has a name but is
 * missing either dosage or frequency. Any value passed for it is ignored and recomputed,
 * so a record rebuilt after dosage/frequency were cleared is re-flagged automatically.</p>
 *
 * @param name                lower-cased, trimmed, never empty
 * @param dosage              free text such as "500mg", or null
 * @param frequency           free text such as "twice daily", or null
 * @param route               route of administration, {@link MedicationRoute#UNKNOWN} if not stated
 * @param indication          reason for the prescription, or null
 * @param duration            treatment duration, or null
 * @param specialInstructions administration notes, possibly empty
 * @param safetyFlag          derived, see above
 */
public record MedicationOrder(
        @JsonProperty("name")                 String name,
        @JsonProperty("dosage")               String dosage,
        @JsonProperty("frequency")            String frequency,
        @JsonProperty("route")                MedicationRoute route,
        @JsonProperty("indication")           String indication,
        @JsonProperty("duration")             String duration,
        @JsonProperty("special_instructions") List<String> specialInstructions,
        @JsonProperty("safety_flag")          boolean safetyFlag
) {

    private static final Logger log = LoggerFactory.getLogger(MedicationOrder.class);

    public MedicationOrder {
        name = EntityFields.requireName(name, "Medication");
        dosage = EntityFields.blankToNull(dosage);
        frequency = EntityFields.blankToNull(frequency);
        route = route != null ? route : MedicationRoute.UNKNOWN;
        indication = EntityFields.blankToNull(indication);
        duration = EntityFields.blankToNull(duration);
        specialInstructions = EntityFields.copyOf(specialInstructions);
        safetyFlag = dosage == null || frequency == null;
        if (safetyFlag) {
            log.warn("Medication '{}' missing critical safety information - dosage: {}, frequency: {}",
                    name, dosage != null, frequency != null);
        }
    }

    public MedicationOrder(String name, String dosage, String frequency, MedicationRoute route) {
        this(name, dosage, frequency, route, null, null, List.of(), false);
    }

    public static MedicationOrder named(String name) {
        return new MedicationOrder(name, null, null, MedicationRoute.UNKNOWN);
    }
}
