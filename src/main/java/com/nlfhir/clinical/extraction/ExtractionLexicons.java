package com.nlfhir.clinical.extraction;

/**
 * Data tables the {@link PatternExtractor} matches against.
 *
 * @param medicationNames     drug names recognized without dose or verb context
 * @param medicationStopwords captured words that are never drug names
 * @param complexConditions   multi-word condition phrases, longest first
 * @param commonConditions    single-word conditions and symptoms
 * @param conditionStopwords  captured phrases that are never conditions
 * @param safetyKeywords      keywords that each add a "Consider ..." alert
 */
public record ExtractionLexicons(
        Lexicon medicationNames,
        Lexicon medicationStopwords,
        Lexicon complexConditions,
        Lexicon commonConditions,
        Lexicon conditionStopwords,
        Lexicon safetyKeywords
) {

    public static ExtractionLexicons loadDefaults() {
        return new ExtractionLexicons(
                Lexicon.load("medication-names"),
                Lexicon.load("medication-stopwords"),
                Lexicon.load("complex-conditions"),
                Lexicon.load("common-conditions"),
                Lexicon.load("condition-stopwords"),
                Lexicon.load("safety-keywords"));
    }
}
