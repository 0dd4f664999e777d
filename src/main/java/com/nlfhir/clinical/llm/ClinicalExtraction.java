package com.nlfhir.clinical.llm;

import com.nlfhir.clinical.model.ClinicalSetting;
import com.nlfhir.clinical.model.ClinicalStructure;
import com.nlfhir.clinical.model.DiagnosticProcedure;
import com.nlfhir.clinical.model.LabTest;
import com.nlfhir.clinical.model.MedicalCondition;
import com.nlfhir.clinical.model.MedicationOrder;
import com.nlfhir.clinical.model.MedicationRoute;
import com.nlfhir.clinical.model.UrgencyLevel;
import dev.langchain4j.model.output.structured.Description;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Response schema for {@link ClinicalExtractionAssistant}.
 *
 * <p>Kept separate from the domain records so the provider sees plain strings and lists;
 * {@link #toClinicalStructure()} applies the domain normalization and drops entries the
 * domain rejects (for example a blank name).</p>
 */
public record ClinicalExtraction(
        @Description("Medications explicitly named in the text")
        List<Medication> medications,
        @Description("Laboratory tests explicitly ordered in the text")
        List<Lab> labTests,
        @Description("Diagnostic procedures or imaging explicitly ordered in the text")
        List<Procedure> procedures,
        @Description("Conditions, diagnoses and presenting symptoms, each as the complete term written")
        List<Condition> conditions,
        @Description("Patient proper names exactly as written; empty when no name is given")
        List<String> patients,
        @Description("Imperative instructions as written")
        List<String> clinicalInstructions,
        @Description("One of routine, urgent, stat, asap")
        String urgencyLevel,
        @Description("One of outpatient, inpatient, emergency, intensive_care, unknown")
        String clinicalSetting,
        @Description("Allergy, contraindication and caution statements as written")
        List<String> patientSafetyAlerts
) {

    private static final Logger log = LoggerFactory.getLogger(ClinicalExtraction.class);

    public record Medication(
            @Description("Drug name as written") String name,
            @Description("Dose as written, e.g. 500mg; null if not stated") String dosage,
            @Description("Frequency as written, e.g. twice daily; null if not stated") String frequency,
            @Description("One of oral, intravenous, intramuscular, sublingual, topical, inhalation, unknown")
            String route,
            String indication,
            String duration
    ) {}

    public record Lab(
            String name,
            @Description("One of routine, urgent, stat, asap") String urgency,
            boolean fastingRequired
    ) {}

    public record Procedure(
            String name,
            @Description("One of routine, urgent, stat, asap") String urgency,
            String bodySite,
            boolean contrastNeeded
    ) {}

    public record Condition(
            @Description("Complete condition term as written") String name,
            String severity,
            String onset,
            String status
    ) {}

    /**
     * Converts to the domain aggregate. Entries failing domain validation are skipped.
     */
    public ClinicalStructure toClinicalStructure() {
        return new ClinicalStructure(
                convert(medications, "medication", m -> new MedicationOrder(
                        m.name(), m.dosage(), m.frequency(), MedicationRoute.fromValue(m.route()),
                        m.indication(), m.duration(), List.of(), false)),
                convert(labTests, "lab test", l -> new LabTest(
                        l.name(), UrgencyLevel.fromValue(l.urgency()), l.fastingRequired())),
                convert(procedures, "procedure", p -> new DiagnosticProcedure(
                        p.name(), DiagnosticProcedure.DEFAULT_PROCEDURE_TYPE, UrgencyLevel.fromValue(p.urgency()),
                        p.bodySite(), p.contrastNeeded(), List.of())),
                convert(conditions, "condition", c -> new MedicalCondition(
                        c.name(), c.severity(), c.onset(), c.status())),
                patients,
                clinicalInstructions,
                UrgencyLevel.fromValue(urgencyLevel),
                ClinicalSetting.fromValueOrDefault(clinicalSetting),
                patientSafetyAlerts);
    }

    private static <S, T> List<T> convert(List<S> items, String kind, Function<S, T> factory) {
        if (items == null) {
            return List.of();
        }
        List<T> converted = new ArrayList<>(items.size());
        for (S item : items) {
            if (item == null) {
                continue;
            }
            try {
                converted.add(factory.apply(item));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping invalid {} from model output: {}", kind, e.getMessage());
            }
        }
        return converted;
    }
}
