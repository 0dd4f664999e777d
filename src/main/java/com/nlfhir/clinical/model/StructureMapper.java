package com.nlfhir.clinical.model;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Converts between {@link ClinicalStructure} and the plain nested map handed to downstream
 * record assembly.
 *
 * <p>{@link #fromMap(Map)} is lenient: each list entry is rebuilt on its own, and an entry that
 * fails entity validation (for example a name nulled by grounding) is skipped with a warning
 * instead of failing the whole structure. Every medication's {@code safety_flag} is re-derived
 * on the way back in.</p>
 */
@Slf4j
public class StructureMapper {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public StructureMapper() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public StructureMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Serializes a structure (or any DTO) into plain nested maps and lists.
     */
    public Map<String, Object> toMap(Object value) {
        return objectMapper.convertValue(value, MAP_TYPE);
    }

    public ClinicalStructure fromMap(Map<String, Object> map) {
        if (map == null) {
            return ClinicalStructure.empty();
        }
        return new ClinicalStructure(
                entries(map.get("medications"), "medication", MedicationOrder.class),
                entries(map.get("lab_tests"), "lab test", LabTest.class),
                entries(map.get("procedures"), "procedure", DiagnosticProcedure.class),
                entries(map.get("conditions"), "condition", MedicalCondition.class),
                strings(map.get("patients")),
                strings(map.get("clinical_instructions")),
                UrgencyLevel.fromValue(stringValue(map.get("urgency_level"))),
                ClinicalSetting.fromValueOrDefault(stringValue(map.get("clinical_setting"))),
                strings(map.get("patient_safety_alerts")));
    }

    private <T> List<T> entries(Object raw, String kind, Class<T> type) {
        return convertEach(raw, kind, entry -> objectMapper.convertValue(entry, type));
    }

    private <T> List<T> convertEach(Object raw, String kind, Function<Object, T> converter) {
        if (!(raw instanceof List<?> list)) {
            return List.of();
        }
        List<T> result = new ArrayList<>(list.size());
        for (Object entry : list) {
            if (entry == null) {
                continue;
            }
            try {
                result.add(converter.apply(entry));
            } catch (IllegalArgumentException e) {
                // Jackson wraps constructor failures in IllegalArgumentException from convertValue
                log.warn("Dropping invalid {} entry {}: {}", kind, entry, rootMessage(e));
            }
        }
        return result;
    }

    private static List<String> strings(Object raw) {
        if (!(raw instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
                .filter(item -> item != null && !item.toString().isBlank())
                .map(Object::toString)
                .toList();
    }

    private static String stringValue(Object raw) {
        return raw == null ? null : raw.toString();
    }

    private static String rootMessage(Throwable e) {
        Throwable current = e;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage();
    }
}
