package com.nlfhir.clinical.escalation;

import com.nlfhir.clinical.extraction.Lexicon;
import com.nlfhir.clinical.model.ClinicalStructure;
import com.nlfhir.clinical.model.MedicationOrder;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decides whether pattern extraction was good enough or the generative extractor is needed.
 *
 * <p>Rules are evaluated in {@link EscalationRule} order and the first that fires wins.
 * Keyword rules use plain substring checks on the lower-cased text; the patient-name rule is
 * case-sensitive because capitalization is what identifies a name. Pure apart from logging.</p>
 */
@Slf4j
public class EscalationPolicy {

    private static final int MIN_QUALITY_NAME_LENGTH = 3;
    private static final int MIN_QUALITY_ENTITIES_WITH_ACTIONS = 2;

    private static final List<Pattern> PATIENT_NAME_PATTERNS = List.of(
            Pattern.compile("\\bpatient\\s+([A-Z][a-z]+\\s+[A-Z][a-z]+)\\b"),
            Pattern.compile("\\b(?:started|initiated|prescribed)\\s+patient\\s+([A-Z][a-z]+\\s+[A-Z][a-z]+)\\b"));

    private final Lexicon noiseWords;
    private final Lexicon hardMedications;
    private final Lexicon dosingKeywords;
    private final Lexicon actionVerbs;

    public EscalationPolicy() {
        this(Lexicon.load("escalation-noise-words"),
                Lexicon.load("hard-medications"),
                Lexicon.load("escalation-dosing-keywords"),
                Lexicon.load("escalation-action-verbs"));
    }

    public EscalationPolicy(Lexicon noiseWords, Lexicon hardMedications,
                            Lexicon dosingKeywords, Lexicon actionVerbs) {
        this.noiseWords = noiseWords;
        this.hardMedications = hardMedications;
        this.dosingKeywords = dosingKeywords;
        this.actionVerbs = actionVerbs;
    }

    public boolean shouldEscalate(ClinicalStructure extracted, String text) {
        return evaluate(extracted, text).escalate();
    }

    public EscalationDecision evaluate(ClinicalStructure extracted, String text) {
        ClinicalStructure structure = extracted != null ? extracted : ClinicalStructure.empty();
        String source = text != null ? text : "";
        String lower = source.toLowerCase(Locale.ROOT);

        int total = structure.totalEntityCount();
        if (total == 0) {
            return fire(EscalationRule.ZERO_YIELD, "No entities found by pattern extraction");
        }

        long quality = countQualityEntities(structure);
        if (quality == 0) {
            return fire(EscalationRule.NOISE_ONLY,
                    "Only noise words found (" + total + " entities, none of quality)");
        }

        Set<String> medicationNames = structure.medications().stream()
                .map(MedicationOrder::name)
                .collect(Collectors.toSet());
        for (String hard : hardMedications.entries()) {
            if (lower.contains(hard) && !medicationNames.contains(hard)) {
                return fire(EscalationRule.HARD_MEDICATION_MISSED,
                        "Complex medication '" + hard + "' detected but not extracted");
            }
        }

        String dosingKeyword = dosingKeywords.firstContainedIn(lower);
        if (dosingKeyword != null && structure.medications().isEmpty()) {
            return fire(EscalationRule.DOSING_WITHOUT_MEDICATION,
                    "Dosing language '" + dosingKeyword + "' detected but no medications extracted");
        }

        String actionVerb = actionVerbs.firstContainedIn(lower);
        if (actionVerb != null && quality < MIN_QUALITY_ENTITIES_WITH_ACTIONS) {
            return fire(EscalationRule.ACTIONS_WITHOUT_QUALITY,
                    "Medical action '" + actionVerb + "' present but only " + quality + " quality entities");
        }

        if (structure.patients().isEmpty() && mentionsPatientName(source)) {
            return fire(EscalationRule.PATIENT_NAME_MISSED,
                    "Patient name pattern detected but no patients extracted");
        }

        String reason = String.format(
                "%d total entities, %d quality entities, has_dosing: %s, has_medical_actions: %s",
                total, quality, dosingKeyword != null, actionVerb != null);
        log.info("Escalation check passed: {}", reason);
        return EscalationDecision.sufficient(reason);
    }

    /**
     * Entities whose trimmed, lower-cased name is longer than two characters and not a noise word.
     */
    long countQualityEntities(ClinicalStructure structure) {
        return structure.entityNames().stream()
                .map(name -> name.trim().toLowerCase(Locale.ROOT))
                .filter(name -> name.length() >= MIN_QUALITY_NAME_LENGTH && !noiseWords.contains(name))
                .count();
    }

    private static boolean mentionsPatientName(String text) {
        return PATIENT_NAME_PATTERNS.stream().anyMatch(p -> p.matcher(text).find());
    }

    private static EscalationDecision fire(EscalationRule rule, String reason) {
        log.info("LLM escalation [{}]: {}", rule, reason);
        return EscalationDecision.escalate(rule, reason);
    }
}
