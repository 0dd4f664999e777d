package com.nlfhir.clinical.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Capability snapshot of a coordinator.
 */
public record ProcessorStatus(
        @JsonProperty("initialized")     boolean initialized,
        @JsonProperty("method")          String method,
        @JsonProperty("api_available")   boolean apiAvailable,
        @JsonProperty("fallback_active") boolean fallbackActive
) {

    public static final String METHOD_LLM = "instructor_llm";
    public static final String METHOD_RULE_BASED = "rule_based_enhanced";

    public static ProcessorStatus of(boolean generativeAvailable) {
        return new ProcessorStatus(true,
                generativeAvailable ? METHOD_LLM : METHOD_RULE_BASED,
                generativeAvailable,
                !generativeAvailable);
    }
}
