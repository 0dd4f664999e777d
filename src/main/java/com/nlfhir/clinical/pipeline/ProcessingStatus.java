package com.nlfhir.clinical.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProcessingStatus {
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    ProcessingStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
