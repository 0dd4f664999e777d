package com.nlfhir.clinical.escalation;

/**
 * Escalation rules in evaluation order. The first one that fires decides.
 */
public enum EscalationRule {
    ZERO_YIELD,
    NOISE_ONLY,
    HARD_MEDICATION_MISSED,
    DOSING_WITHOUT_MEDICATION,
    ACTIONS_WITHOUT_QUALITY,
    PATIENT_NAME_MISSED
}
