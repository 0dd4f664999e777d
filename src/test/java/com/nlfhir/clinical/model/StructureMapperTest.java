package com.nlfhir.clinical.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class StructureMapperTest {

    private StructureMapper mapper;

    @BeforeEach
    void setUp() {
        mapper = new StructureMapper();
    }

    @Test
    @DisplayName("toMap uses the downstream snake_case field names and enum values")
    void toMapUsesContractFieldNames() {
        ClinicalStructure structure = new ClinicalStructure(
                List.of(new MedicationOrder("metformin", "500mg", "twice daily", MedicationRoute.ORAL)),
                List.of(new LabTest("hba1c", UrgencyLevel.URGENT, true)),
                List.of(),
                List.of(MedicalCondition.active("type 2 diabetes mellitus")),
                List.of("John Smith"),
                List.of(),
                UrgencyLevel.URGENT,
                ClinicalSetting.INPATIENT,
                List.of("Consider elderly"));

        Map<String, Object> map = mapper.toMap(structure);

        assertThat(map).containsOnlyKeys("medications", "lab_tests", "procedures", "conditions", "patients",
                "clinical_instructions", "urgency_level", "clinical_setting", "patient_safety_alerts");
        assertThat(map).containsEntry("urgency_level", "urgent")
                .containsEntry("clinical_setting", "inpatient");

        @SuppressWarnings("unchecked")
        Map<String, Object> medication = ((List<Map<String, Object>>) map.get("medications")).get(0);
        assertThat(medication)
                .containsEntry("name", "metformin")
                .containsEntry("dosage", "500mg")
                .containsEntry("frequency", "twice daily")
                .containsEntry("route", "oral")
                .containsEntry("safety_flag", false)
                .containsKey("special_instructions");

        @SuppressWarnings("unchecked")
        Map<String, Object> lab = ((List<Map<String, Object>>) map.get("lab_tests")).get(0);
        assertThat(lab).containsEntry("test_type", "laboratory")
                .containsEntry("fasting_required", true);
    }

    @Test
    @DisplayName("fromMap re-derives the safety flag after dosage is nulled")
    void fromMapRederivesSafetyFlag() {
        Map<String, Object> medication = new HashMap<>();
        medication.put("name", "metformin");
        medication.put("dosage", null);
        medication.put("frequency", "twice daily");
        medication.put("safety_flag", false);

        ClinicalStructure structure = mapper.fromMap(Map.of("medications", List.of(medication)));

        assertThat(structure.medications()).singleElement()
                .satisfies(order -> {
                    assertThat(order.dosage()).isNull();
                    assertThat(order.safetyFlag()).isTrue();
                });
    }

    @Test
    @DisplayName("fromMap drops invalid entries and keeps the rest")
    void fromMapDropsInvalidEntries() {
        List<Object> conditions = new ArrayList<>();
        conditions.add(Map.of("name", ""));
        conditions.add(Map.of("name", "asthma"));
        conditions.add(null);

        ClinicalStructure structure = mapper.fromMap(Map.of(
                "conditions", conditions,
                "urgency_level", "bogus",
                "patients", List.of("Mary Johnson", " ")));

        assertThat(structure.conditions()).extracting(MedicalCondition::name).containsExactly("asthma");
        assertThat(structure.urgencyLevel()).isEqualTo(UrgencyLevel.ROUTINE);
        assertThat(structure.patients()).containsExactly("Mary Johnson");
    }

    @Test
    @DisplayName("missing clinical setting defaults to outpatient, unrecognized setting is unknown")
    void fromMapSettingDefault() {
        Map<String, Object> noSetting = new HashMap<>();
        noSetting.put("medications", List.of(Map.of("name", "aspirin")));
        Map<String, Object> blankSetting = Map.of("clinical_setting", " ");
        Map<String, Object> oddSetting = Map.of("clinical_setting", "home visit");

        assertThat(mapper.fromMap(noSetting).clinicalSetting()).isEqualTo(ClinicalSetting.OUTPATIENT);
        assertThat(mapper.fromMap(blankSetting).clinicalSetting()).isEqualTo(ClinicalSetting.OUTPATIENT);
        assertThat(mapper.fromMap(oddSetting).clinicalSetting()).isEqualTo(ClinicalSetting.UNKNOWN);
        assertThat(mapper.fromMap(noSetting).clinicalSetting()).isEqualTo(ClinicalStructure.empty().clinicalSetting());
    }

    @Test
    void fromNullMapIsEmpty() {
        assertThat(mapper.fromMap(null)).isEqualTo(ClinicalStructure.empty());
    }
}
