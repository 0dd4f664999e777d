package com.nlfhir.clinical.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Aggregate of everything extracted from one clinical text.
 *
 * <p>All entity lists are independent siblings; nothing cross-references anything else.
 * Field names are the contract with downstream record assembly and must not change.</p>
 */
public record ClinicalStructure(
        @JsonProperty("medications")           List<MedicationOrder> medications,
        @JsonProperty("lab_tests")             List<LabTest> labTests,
        @JsonProperty("procedures")            List<DiagnosticProcedure> procedures,
        @JsonProperty("conditions")            List<MedicalCondition> conditions,
        @JsonProperty("patients")              List<String> patients,
        @JsonProperty("clinical_instructions") List<String> clinicalInstructions,
        @JsonProperty("urgency_level")         UrgencyLevel urgencyLevel,
        @JsonProperty("clinical_setting")      ClinicalSetting clinicalSetting,
        @JsonProperty("patient_safety_alerts") List<String> patientSafetyAlerts
) {

    public ClinicalStructure {
        medications = immutable(medications);
        labTests = immutable(labTests);
        procedures = immutable(procedures);
        conditions = immutable(conditions);
        patients = immutable(patients);
        clinicalInstructions = immutable(clinicalInstructions);
        urgencyLevel = urgencyLevel != null ? urgencyLevel : UrgencyLevel.ROUTINE;
        clinicalSetting = clinicalSetting != null ? clinicalSetting : ClinicalSetting.OUTPATIENT;
        patientSafetyAlerts = immutable(patientSafetyAlerts);
    }

    public static ClinicalStructure empty() {
        return new ClinicalStructure(null, null, null, null, null, null, null, null, null);
    }

    /**
     * Medications, lab tests, procedures and conditions combined.
     */
    @JsonIgnore
    public int totalEntityCount() {
        return medications.size() + labTests.size() + procedures.size() + conditions.size();
    }

    /**
     * True when at least one medication, lab test or procedure order is present.
     */
    @JsonIgnore
    public boolean hasOrders() {
        return !medications.isEmpty() || !labTests.isEmpty() || !procedures.isEmpty();
    }

    /**
     * Names of every medication, lab test, procedure and condition, in that order.
     */
    @JsonIgnore
    public List<String> entityNames() {
        return Stream.of(
                        medications.stream().map(MedicationOrder::name),
                        labTests.stream().map(LabTest::name),
                        procedures.stream().map(DiagnosticProcedure::name),
                        conditions.stream().map(MedicalCondition::name))
                .flatMap(s -> s)
                .toList();
    }

    private static <T> List<T> immutable(List<T> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return values.stream().filter(Objects::nonNull).toList();
    }
}
