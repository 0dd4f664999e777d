package com.nlfhir.clinical.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProcessingMethod {
    REGEX_ENHANCED("regex_enhanced"),
    ESCALATED_TO_LLM("escalated_to_llm"),
    FALLBACK("fallback");

    private final String value;

    ProcessingMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
