package com.nlfhir.clinical.extraction;

import com.nlfhir.clinical.model.ClinicalSetting;
import com.nlfhir.clinical.model.ClinicalStructure;
import com.nlfhir.clinical.model.DiagnosticProcedure;
import com.nlfhir.clinical.model.LabTest;
import com.nlfhir.clinical.model.MedicalCondition;
import com.nlfhir.clinical.model.MedicationOrder;
import com.nlfhir.clinical.model.MedicationRoute;
import com.nlfhir.clinical.model.UrgencyLevel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic first-pass extractor.
 *
 * <p>Every value this class emits is a substring of the input, so its output is trusted without
 * grounding. Route, urgency, setting, fasting and contrast are whole-text signals applied to all
 * entities found in the call. Medications are not de-duplicated: overlapping templates may report
 * the same drug more than once.</p>
 *
 * <p>{@link #extract(String)} never throws. A single entity that fails validation is skipped with a
 * warning; an unexpected failure degrades to an empty structure.</p>
 */
@Slf4j
public class PatternExtractor {

    static final String DOSE =
            "\\d+(?:\\.\\d+)?\\s*(?:mcg|mg|ml|iu|units?|grams?|tablets?|capsules?|%)(?![a-z])";

    private static final String DRUG = "[a-z][\\w\\-]*";

    private static final String ACTION =
            "\\b(?:start(?:ed)?|prescribed?|give|given|administer(?:ed)?|initiated?|recommended)\\s+";

    private static final String PATIENT_PREFIX = "(?:patient\\s+(?:\\w+\\s+){0,2}?(?:on\\s+)?)?";

    private static final String FREQUENCY_WORDS =
            "three\\s+times\\s+daily|twice\\s+daily|once\\s+daily|daily|once|bid|tid|qid|prn"
                    + "|at\\s+bedtime|as\\s+needed|every\\s+\\d+\\s+hours|q\\d+h";

    private static final int MIN_MEDICATION_NAME_LENGTH = 3;
    private static final int MAX_CONDITION_WORDS = 6;

    private static final Map<Pattern, MedicationRoute> ROUTES = routeTable();

    private static final List<Pattern> LAB_PATTERNS = compileAll(
            "\\border(?:ed)?\\s+([^.;\\n]*?(?:level|panel|test|screen)s?)\\b",
            "\\b(cbc|complete\\s+blood\\s+count)\\b",
            "\\b(comprehensive\\s+metabolic\\s+panel|cmp)\\b",
            "\\b(hba1c|hemoglobin\\s+a1c)\\b",
            "\\b(lipid\\s+panel)\\b",
            "\\b(liver\\s+function\\s+(?:\\w+\\s+)?tests?)\\b",
            "\\b(thyroid\\s+(?:\\w+\\s+)?tests?|tsh)\\b",
            "\\b(blood\\s+cultures?)\\b",
            "\\b(urinalysis|ua)\\b");

    private static final List<Pattern> PROCEDURE_PATTERNS = compileAll(
            "\\border(?:ed)?\\s+([^.;\\n]*?\\b(?:x-ray|ct|mri|ultrasound|scan|ecg|ekg))\\b",
            "\\b(chest\\s+x-ray)\\b",
            "\\b(ct(?:\\s+scan)?)\\b",
            "\\b(mri)\\b",
            "\\b(ultrasound)\\b",
            "\\b(ecg|ekg|electrocardiogram)\\b",
            "\\b(endoscopy)\\b",
            "\\b(biopsy)\\b",
            "\\b(holter\\s+monitor)\\b",
            "\\b(pulmonary\\s+function\\s+tests?)\\b");

    private static final String CONDITION_PHRASE =
            "([a-z][a-z0-9'\\-]*(?:\\s+[a-z0-9][a-z0-9'\\-]*){0," + (MAX_CONDITION_WORDS - 1) + "}?)";

    private static final String CONDITION_END =
            "(?=\\s*(?:[.,;:!?)]|$)|\\s+(?:and|or|with|secondary|due|since|starting|after|before|in|on|at"
                    + "|to|for|until|but|who|which|that|per|x|management|treatment|therapy|follow|then)\\b)";

    private static final List<Pattern> CONDITION_CAPTURES = compileAll(
            "\\bfor\\s+" + CONDITION_PHRASE + CONDITION_END,
            "\\bdiagnosis\\s+of\\s+" + CONDITION_PHRASE + CONDITION_END,
            "\\bpatient\\s+(?:has|with)\\s+" + CONDITION_PHRASE + CONDITION_END,
            "\\bfor\\s+" + CONDITION_PHRASE + "\\s+(?:management|treatment|therapy)\\b");

    private static final Set<String> LEADING_ARTICLES = Set.of("a", "an", "the");

    private static final Pattern DURATION_TAIL =
            Pattern.compile("\\b(?:hours?|days?|weeks?|months?|years?)$");

    private static final List<Pattern> INSTRUCTION_PATTERNS =
            Arrays.stream(new String[]{"take", "start", "continue", "stop", "follow", "monitor", "schedule"})
                    .map(verb -> Pattern.compile(
                            "\\b(" + verb + "\\s+[^.\\n]*?)(?=\\s*(?:\\.|\\bfor\\b|\\n|$))",
                            Pattern.CASE_INSENSITIVE))
                    .toList();

    private static final List<Pattern> ALERT_PATTERNS = compileAll(
            "\\b(allergy\\s+to\\s+[^.\\n]*)",
            "\\b(contraindicated\\b[^.\\n]*)",
            "\\b(caution\\b[^.\\n]*)",
            "\\b(warning\\b[^.\\n]*)",
            "\\b(avoid\\b[^.\\n]*)");

    // Case-sensitive: the capitalization is the signal.
    private static final Pattern PATIENT_NAME =
            Pattern.compile("\\b[Pp]atient\\s+([A-Z][a-z]+\\s+[A-Z][a-z]+)\\b");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ExtractionLexicons lexicons;
    private final List<MedicationTemplate> medicationTemplates;
    private final Pattern complexConditionPattern;
    private final Pattern commonConditionPattern;

    public PatternExtractor() {
        this(ExtractionLexicons.loadDefaults());
    }

    public PatternExtractor(ExtractionLexicons lexicons) {
        this.lexicons = lexicons;
        this.medicationTemplates = buildTemplates(lexicons.medicationNames());
        this.complexConditionPattern = lexicons.complexConditions().wholePhrasePattern();
        this.commonConditionPattern = lexicons.commonConditions().wholePhrasePattern();
    }

    /**
     * Extracts every entity class from {@code text}. Null is treated as empty text.
     */
    public ClinicalStructure extract(String text) {
        String source = text == null ? "" : text;
        try {
            String lower = source.toLowerCase(Locale.ROOT);
            UrgencyLevel orderUrgency = orderUrgency(lower);

            ClinicalStructure structure = new ClinicalStructure(
                    extractMedications(source),
                    extractLabTests(source, orderUrgency, lower.contains("fasting")),
                    extractProcedures(source, orderUrgency, lower.contains("contrast")),
                    extractConditions(source),
                    extractPatients(source),
                    extractInstructions(source),
                    documentUrgency(lower),
                    clinicalSetting(lower),
                    extractSafetyAlerts(source, lower));

            if (!structure.hasOrders()) {
                log.warn("No clinical orders (medications, lab tests, procedures) extracted");
            }
            log.debug("Pattern extraction: {} medications, {} lab tests, {} procedures, {} conditions, {} patients",
                    structure.medications().size(), structure.labTests().size(),
                    structure.procedures().size(), structure.conditions().size(), structure.patients().size());
            return structure;
        } catch (RuntimeException e) {
            log.error("Pattern extraction failed, returning empty structure", e);
            return ClinicalStructure.empty();
        }
    }

    // ---------------------------------------------------------------------
    // Medications
    // ---------------------------------------------------------------------

    List<MedicationOrder> extractMedications(String text) {
        MedicationRoute route = documentRoute(text);
        List<MedicationOrder> medications = new ArrayList<>();

        for (MedicationTemplate template : medicationTemplates) {
            Matcher matcher = template.pattern().matcher(text);
            while (matcher.find()) {
                String name = template.name(matcher);
                if (name == null || isRejectedMedicationName(name.trim())) {
                    continue;
                }
                name = collapse(name);
                String dosage = template.dosage(matcher);
                if (dosage == null) {
                    dosage = lookBackDosage(name, text);
                }
                String frequency = lookBackFrequency(name, text);
                try {
                    medications.add(new MedicationOrder(name, dosage, frequency, route));
                } catch (IllegalArgumentException e) {
                    log.warn("Failed to create medication order from '{}': {}", name, e.getMessage());
                }
            }
        }
        return medications;
    }

    private boolean isRejectedMedicationName(String name) {
        return name.length() < MIN_MEDICATION_NAME_LENGTH || lexicons.medicationStopwords().contains(name);
    }

    private static String lookBackDosage(String name, String text) {
        Matcher matcher = Pattern.compile(Pattern.quote(name) + "\\s+(" + DOSE + ")", Pattern.CASE_INSENSITIVE)
                .matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static String lookBackFrequency(String name, String text) {
        Matcher matcher = Pattern.compile(
                        Pattern.quote(name) + ".*?\\b(" + FREQUENCY_WORDS + ")\\b", Pattern.CASE_INSENSITIVE)
                .matcher(text);
        return matcher.find() ? collapse(matcher.group(1)) : null;
    }

    /**
     * First route whose keywords appear anywhere in the text. Route is a document-level signal.
     */
    static MedicationRoute documentRoute(String text) {
        for (Map.Entry<Pattern, MedicationRoute> entry : ROUTES.entrySet()) {
            if (entry.getKey().matcher(text).find()) {
                return entry.getValue();
            }
        }
        return MedicationRoute.UNKNOWN;
    }

    private static List<MedicationTemplate> buildTemplates(Lexicon medicationNames) {
        return List.of(
                MedicationTemplate.doseThenName("action-dose-name",
                        ACTION + PATIENT_PREFIX + "(" + DOSE + ")\\s+(" + DRUG + ")"),
                MedicationTemplate.nameThenDose("action-name-dose",
                        ACTION + PATIENT_PREFIX + "(" + DRUG + ")\\s+(" + DOSE + ")"),
                MedicationTemplate.nameThenDose("name-dose-frequency",
                        "\\b(" + DRUG + ")\\s+(" + DOSE + ")\\s+(?:daily|twice\\s+daily|three\\s+times|once"
                                + "|bid|tid|qid|prn|orally|at\\s+bedtime)\\b"),
                MedicationTemplate.nameThenDose("inhaler-puffs",
                        "\\b(" + DRUG + ")\\s+inhaler\\s+(\\d+\\s+puffs?)\\b"),
                MedicationTemplate.nameOnly("topical-form",
                        "\\b(" + DRUG + ")\\s+(?:topical\\s+cream|patch|gel)\\b"),
                MedicationTemplate.nameOnly("known-drug",
                        "\\b(" + medicationNames.alternation() + ")\\b"),
                MedicationTemplate.nameOnly("monoclonal-antibody",
                        "\\b(rsv\\s+monoclonal\\s+antibody|monoclonal\\s+antibody)\\b"),
                MedicationTemplate.nameThenDose("extended-release",
                        "\\b(" + DRUG + ")\\s+(?:xl|sr|cr|la)\\s+(\\d+\\s*(?:mg|%|tablets?))"),
                MedicationTemplate.nameOnly("patch",
                        "\\b(" + DRUG + ")\\s+patch\\b"),
                MedicationTemplate.nameOnly("gel-cream",
                        "\\b(" + DRUG + ")\\s+(?:vaginal\\s+gel|topical\\s+cream)\\b"));
    }

    private static Map<Pattern, MedicationRoute> routeTable() {
        Map<Pattern, MedicationRoute> routes = new LinkedHashMap<>();
        routes.put(ci("\\boral\\b|\\bpo\\b|\\bby\\s+mouth\\b"), MedicationRoute.ORAL);
        routes.put(ci("\\bintravenous\\b|\\biv\\b"), MedicationRoute.INTRAVENOUS);
        routes.put(ci("\\bintramuscular\\b|\\bim\\b"), MedicationRoute.INTRAMUSCULAR);
        routes.put(ci("\\binhaler?\\b|\\binhalation\\b"), MedicationRoute.INHALATION);
        routes.put(ci("\\btopical\\b|\\bapply\\b"), MedicationRoute.TOPICAL);
        routes.put(ci("\\bsublingual\\b"), MedicationRoute.SUBLINGUAL);
        return routes;
    }

    // ---------------------------------------------------------------------
    // Lab tests and procedures
    // ---------------------------------------------------------------------

    List<LabTest> extractLabTests(String text, UrgencyLevel urgency, boolean fasting) {
        List<LabTest> labTests = new ArrayList<>();
        for (String name : captureAll(LAB_PATTERNS, text)) {
            try {
                labTests.add(new LabTest(name, urgency, fasting));
            } catch (IllegalArgumentException e) {
                log.warn("Failed to create lab test order from '{}': {}", name, e.getMessage());
            }
        }
        return labTests;
    }

    List<DiagnosticProcedure> extractProcedures(String text, UrgencyLevel urgency, boolean contrast) {
        List<DiagnosticProcedure> procedures = new ArrayList<>();
        for (String name : captureAll(PROCEDURE_PATTERNS, text)) {
            try {
                procedures.add(new DiagnosticProcedure(name, urgency, contrast));
            } catch (IllegalArgumentException e) {
                log.warn("Failed to create procedure order from '{}': {}", name, e.getMessage());
            }
        }
        return procedures;
    }

    /**
     * Urgency shared by every lab test and procedure in the call: first of stat, urgent, asap,
     * routine found anywhere in the text.
     */
    static UrgencyLevel orderUrgency(String lowerText) {
        if (containsWord(lowerText, "stat")) {
            return UrgencyLevel.STAT;
        }
        if (containsWord(lowerText, "urgent")) {
            return UrgencyLevel.URGENT;
        }
        if (containsWord(lowerText, "asap")) {
            return UrgencyLevel.ASAP;
        }
        return UrgencyLevel.ROUTINE;
    }

    // ---------------------------------------------------------------------
    // Conditions
    // ---------------------------------------------------------------------

    List<MedicalCondition> extractConditions(String text) {
        Map<String, String> unique = new LinkedHashMap<>();

        for (Pattern pattern : CONDITION_CAPTURES) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                addCondition(unique, cleanConditionPhrase(matcher.group(1)));
            }
        }
        for (Pattern pattern : List.of(complexConditionPattern, commonConditionPattern)) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                addCondition(unique, collapse(matcher.group(1)));
            }
        }

        List<MedicalCondition> conditions = new ArrayList<>(unique.size());
        for (String name : unique.values()) {
            try {
                conditions.add(MedicalCondition.active(name));
            } catch (IllegalArgumentException e) {
                log.warn("Failed to create condition from '{}': {}", name, e.getMessage());
            }
        }
        return conditions;
    }

    private void addCondition(Map<String, String> unique, String phrase) {
        if (phrase == null || phrase.isEmpty() || isNonCondition(phrase)) {
            return;
        }
        unique.putIfAbsent(phrase.toLowerCase(Locale.ROOT), phrase);
    }

    private boolean isNonCondition(String phrase) {
        String lower = phrase.toLowerCase(Locale.ROOT);
        if (DURATION_TAIL.matcher(lower).find()) {
            return true;
        }
        return Arrays.stream(lower.split(" "))
                .allMatch(word -> lexicons.conditionStopwords().contains(word) || LEADING_ARTICLES.contains(word));
    }

    private static String cleanConditionPhrase(String raw) {
        if (raw == null) {
            return null;
        }
        String phrase = collapse(raw);
        int space = phrase.indexOf(' ');
        if (space > 0 && LEADING_ARTICLES.contains(phrase.substring(0, space).toLowerCase(Locale.ROOT))) {
            phrase = phrase.substring(space + 1);
        }
        return phrase;
    }

    // ---------------------------------------------------------------------
    // Document context
    // ---------------------------------------------------------------------

    static UrgencyLevel documentUrgency(String lowerText) {
        if (containsWord(lowerText, "stat") || containsWord(lowerText, "emergency")) {
            return UrgencyLevel.STAT;
        }
        if (containsWord(lowerText, "urgent")) {
            return UrgencyLevel.URGENT;
        }
        if (containsWord(lowerText, "asap")) {
            return UrgencyLevel.ASAP;
        }
        return UrgencyLevel.ROUTINE;
    }

    static ClinicalSetting clinicalSetting(String lowerText) {
        if (find("\\b(?:hospital\\w*|inpatient|admission|icu)\\b", lowerText)) {
            return ClinicalSetting.INPATIENT;
        }
        if (find("\\b(?:emergency|er|urgent\\s+care)\\b", lowerText)) {
            return ClinicalSetting.EMERGENCY;
        }
        if (find("\\b(?:icu|intensive\\s+care)\\b", lowerText)) {
            return ClinicalSetting.INTENSIVE_CARE;
        }
        return ClinicalSetting.OUTPATIENT;
    }

    List<String> extractPatients(String text) {
        Set<String> patients = new LinkedHashSet<>();
        Matcher matcher = PATIENT_NAME.matcher(text);
        while (matcher.find()) {
            patients.add(collapse(matcher.group(1)));
        }
        return List.copyOf(patients);
    }

    List<String> extractInstructions(String text) {
        return captureAll(INSTRUCTION_PATTERNS, text);
    }

    List<String> extractSafetyAlerts(String text, String lowerText) {
        List<String> alerts = captureAll(ALERT_PATTERNS, text);
        for (String keyword : lexicons.safetyKeywords().entries()) {
            if (lowerText.contains(keyword)) {
                alerts.add("Consider " + keyword);
            }
        }
        return alerts;
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static List<String> captureAll(List<Pattern> patterns, String text) {
        List<String> captured = new ArrayList<>();
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String value = collapse(matcher.group(1));
                if (!value.isEmpty()) {
                    captured.add(value);
                }
            }
        }
        return captured;
    }

    private static boolean containsWord(String lowerText, String word) {
        return find("\\b" + word + "\\b", lowerText);
    }

    private static boolean find(String regex, String lowerText) {
        return Pattern.compile(regex).matcher(lowerText).find();
    }

    private static String collapse(String value) {
        return WHITESPACE.matcher(value.trim()).replaceAll(" ");
    }

    private static Pattern ci(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    private static List<Pattern> compileAll(String... regexes) {
        return Arrays.stream(regexes).map(PatternExtractor::ci).toList();
    }
}
