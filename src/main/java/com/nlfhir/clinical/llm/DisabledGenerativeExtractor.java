package com.nlfhir.clinical.llm;

import com.nlfhir.clinical.model.ClinicalStructure;

/**
 * Stand-in used when no model credentials are configured.
 */
public class DisabledGenerativeExtractor implements GenerativeExtractor {

    private final String reason;

    public DisabledGenerativeExtractor(String reason) {
        this.reason = reason;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public ClinicalStructure extract(String text, String requestId) {
        throw new IllegalStateException("Generative extraction unavailable: " + reason);
    }

    public String reason() {
        return reason;
    }
}
