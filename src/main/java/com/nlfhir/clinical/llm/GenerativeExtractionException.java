package com.nlfhir.clinical.llm;

import lombok.Getter;

@Getter
public class GenerativeExtractionException extends RuntimeException {

    private final String requestId;

    public GenerativeExtractionException(String requestId, String message) {
        super(message);
        this.requestId = requestId;
    }

    public GenerativeExtractionException(String requestId, String message, Throwable cause) {
        super(message, cause);
        this.requestId = requestId;
    }
}
