package com.nlfhir.clinical.grounding;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Anti-hallucination gate for generative output.
 *
 * <p>Every extracted field must be locatable in the source text, which is lower-cased and
 * whitespace-collapsed once per call. Medications, lab tests and procedures need an exact
 * substring match on their name. A medication's dosage and frequency are checked on their own
 * and nulled when absent, leaving the entry in place. Conditions need all significant words
 * present, in order, with at most {@value #MAX_CONDITION_WORD_GAP} characters between consecutive
 * words. Patient names need a full match or, failing that, every word present somewhere.</p>
 *
 * <p>The input map is never mutated. Rejections are logged and never thrown.</p>
 */
@Slf4j
public class SourceGroundingValidator {

    static final int MAX_CONDITION_WORD_GAP = 20;
    private static final int MIN_SIGNIFICANT_WORD_LENGTH = 3;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public Map<String, Object> validate(Map<String, Object> extracted, String sourceText, String requestId) {
        if (extracted == null) {
            return new LinkedHashMap<>();
        }
        log.info("[{}] Validating extracted content against source text", requestId);
        String source = normalize(sourceText);
        Map<String, Object> validated = new LinkedHashMap<>(extracted);

        validated.computeIfPresent("medications",
                (key, value) -> validateMedications(value, source, requestId));
        validated.computeIfPresent("conditions",
                (key, value) -> validateConditions(value, source, requestId));
        validated.computeIfPresent("patients",
                (key, value) -> validatePatients(value, source, requestId));
        if (validated.containsKey("patient_name") && validated.get("patient_name") != null) {
            validated.put("patient_name", validatePatientName(validated.get("patient_name").toString(), source, requestId));
        }
        validated.computeIfPresent("lab_tests",
                (key, value) -> validateNamed(value, source, "lab test", requestId));
        validated.computeIfPresent("procedures",
                (key, value) -> validateNamed(value, source, "procedure", requestId));

        log.info("[{}] Validation complete", requestId);
        return validated;
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text.toLowerCase(Locale.ROOT).strip()).replaceAll(" ");
    }

    private List<Object> validateMedications(Object raw, String source, String requestId) {
        List<Object> kept = new ArrayList<>();
        for (Object entry : asList(raw)) {
            if (!(entry instanceof Map<?, ?> medication)) {
                log.warn("[{}] Removing malformed medication entry {}", requestId, entry);
                continue;
            }
            String name = lowerName(medication.get("name"));
            if (name.isEmpty() || !source.contains(name)) {
                log.warn("[{}] Removing hallucinated medication '{}' - name not in source", requestId, name);
                continue;
            }
            Map<String, Object> copy = copy(medication);
            nullIfAbsent(copy, "dosage", name, source, requestId);
            nullIfAbsent(copy, "frequency", name, source, requestId);
            kept.add(copy);
        }
        return kept;
    }

    private void nullIfAbsent(Map<String, Object> medication, String field, String name,
                              String source, String requestId) {
        Object value = medication.get(field);
        if (value == null) {
            return;
        }
        String text = value.toString().toLowerCase(Locale.ROOT).strip();
        if (!text.isEmpty() && !source.contains(text)) {
            log.warn("[{}] Removing hallucinated {} '{}' for {}", requestId, field, text, name);
            medication.put(field, null);
        }
    }

    private List<Object> validateConditions(Object raw, String source, String requestId) {
        List<Object> kept = new ArrayList<>();
        for (Object entry : asList(raw)) {
            String name;
            if (entry instanceof Map<?, ?> condition) {
                name = lowerName(condition.get("name"));
            } else if (entry instanceof String s) {
                name = lowerName(s);
            } else {
                log.warn("[{}] Removing malformed condition entry {}", requestId, entry);
                continue;
            }
            if (name.isEmpty()) {
                log.warn("[{}] Removing condition with empty name", requestId);
                continue;
            }
            if (isConditionGrounded(name, source, requestId)) {
                kept.add(entry instanceof Map<?, ?> map ? copy(map) : entry);
            }
        }
        return kept;
    }

    private boolean isConditionGrounded(String name, String source, String requestId) {
        List<String> significant = Arrays.stream(WHITESPACE.split(name))
                .filter(word -> word.length() >= MIN_SIGNIFICANT_WORD_LENGTH)
                .toList();
        if (significant.isEmpty()) {
            if (source.contains(name)) {
                return true;
            }
            log.warn("[{}] Removing hallucinated condition '{}'", requestId, name);
            return false;
        }
        if (!significant.stream().allMatch(source::contains)) {
            log.warn("[{}] Removing hallucinated condition '{}'", requestId, name);
            return false;
        }
        String ordered = significant.stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("\\b.{0," + MAX_CONDITION_WORD_GAP + "}\\b", "\\b", "\\b"));
        if (!Pattern.compile(ordered).matcher(source).find()) {
            log.warn("[{}] Removing hallucinated condition '{}' - words too far apart", requestId, name);
            return false;
        }
        return true;
    }

    private List<Object> validatePatients(Object raw, String source, String requestId) {
        List<Object> kept = new ArrayList<>();
        for (Object entry : asList(raw)) {
            if (entry == null) {
                continue;
            }
            String grounded = validatePatientName(entry.toString(), source, requestId);
            if (grounded != null) {
                kept.add(entry);
            }
        }
        return kept;
    }

    /**
     * Returns the name unchanged if grounded, otherwise null.
     */
    String validatePatientName(String patientName, String source, String requestId) {
        String lower = normalize(patientName);
        if (lower.isEmpty()) {
            log.warn("[{}] Removing empty patient name", requestId);
            return null;
        }
        if (source.contains(lower)) {
            return patientName;
        }
        // Names split across lines or with odd spacing
        boolean allWordsPresent = Arrays.stream(lower.split(" ")).allMatch(source::contains);
        if (!allWordsPresent) {
            log.warn("[{}] Removing hallucinated patient name '{}'", requestId, patientName);
            return null;
        }
        return patientName;
    }

    private List<Object> validateNamed(Object raw, String source, String kind, String requestId) {
        List<Object> kept = new ArrayList<>();
        for (Object entry : asList(raw)) {
            if (!(entry instanceof Map<?, ?> map)) {
                log.warn("[{}] Removing malformed {} entry {}", requestId, kind, entry);
                continue;
            }
            String name = lowerName(map.get("name"));
            if (!name.isEmpty() && source.contains(name)) {
                kept.add(copy(map));
            } else {
                log.warn("[{}] Removing hallucinated {} '{}'", requestId, kind, name);
            }
        }
        return kept;
    }

    private static List<?> asList(Object raw) {
        return raw instanceof List<?> list ? list : List.of();
    }

    private static String lowerName(Object name) {
        return name == null ? "" : name.toString().toLowerCase(Locale.ROOT).strip();
    }

    private static Map<String, Object> copy(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return copy;
    }
}
