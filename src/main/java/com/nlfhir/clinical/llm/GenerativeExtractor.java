package com.nlfhir.clinical.llm;

import com.nlfhir.clinical.model.ClinicalStructure;

/**
 * Capability seam for model-backed extraction. Callers check {@link #isAvailable()} before
 * calling {@link #extract}.
 */
public interface GenerativeExtractor {

    boolean isAvailable();

    /**
     * Extracts a grounded structure from {@code text}.
     *
     * @throws GenerativeExtractionException if the model call or response handling fails
     * @throws IllegalStateException         if the capability is not configured
     */
    ClinicalStructure extract(String text, String requestId);
}
