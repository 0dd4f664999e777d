package com.nlfhir.clinical.extraction;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One medication pattern and the capture groups holding the drug name and, optionally, the dose.
 *
 * @param label       short name used in debug logging
 * @param pattern     compiled, case-insensitive
 * @param nameGroup   group holding the drug name
 * @param dosageGroup group holding the dose, or {@code 0} when the template captures none
 */
record MedicationTemplate(String label, Pattern pattern, int nameGroup, int dosageGroup) {

    static MedicationTemplate nameOnly(String label, String regex) {
        return new MedicationTemplate(label, compile(regex), 1, 0);
    }

    static MedicationTemplate nameThenDose(String label, String regex) {
        return new MedicationTemplate(label, compile(regex), 1, 2);
    }

    static MedicationTemplate doseThenName(String label, String regex) {
        return new MedicationTemplate(label, compile(regex), 2, 1);
    }

    String name(Matcher matcher) {
        return matcher.group(nameGroup);
    }

    String dosage(Matcher matcher) {
        return dosageGroup == 0 ? null : matcher.group(dosageGroup);
    }

    private static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
