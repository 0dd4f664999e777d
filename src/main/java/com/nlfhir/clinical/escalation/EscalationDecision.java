package com.nlfhir.clinical.escalation;

/**
 * Outcome of {@link EscalationPolicy#evaluate}.
 *
 * @param escalate true when the generative extractor should be invoked
 * @param rule     the rule that fired, or null when extraction was sufficient
 * @param reason   human-readable explanation, always present
 */
public record EscalationDecision(boolean escalate, EscalationRule rule, String reason) {

    public static EscalationDecision escalate(EscalationRule rule, String reason) {
        return new EscalationDecision(true, rule, reason);
    }

    public static EscalationDecision sufficient(String reason) {
        return new EscalationDecision(false, null, reason);
    }
}
