package com.nlfhir.clinical.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Normalization shared by the entity records.
 */
final class EntityFields {

    private EntityFields() {
    }

    /**
     * Trims and lower-cases a required name.
     *
     * @throws IllegalArgumentException if the name is null or blank
     */
    static String requireName(String name, String entityKind) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException(entityKind + " name cannot be empty");
        }
        return name.trim().toLowerCase(Locale.ROOT);
    }

    static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    static String orDefault(String value, String fallback) {
        String cleaned = blankToNull(value);
        return cleaned != null ? cleaned : fallback;
    }

    static List<String> copyOf(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .toList();
    }
}
