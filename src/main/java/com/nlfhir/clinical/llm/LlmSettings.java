package com.nlfhir.clinical.llm;

import java.time.Duration;

/**
 * Model client settings, resolved once at startup.
 *
 * @param apiKey         provider credential; blank disables generative extraction
 * @param modelName      provider model id
 * @param temperature    sampling temperature, near zero for extraction
 * @param maxTokens      response token cap
 * @param timeoutSeconds per-call timeout
 * @param maxInputTokens input budget; longer text is truncated before the call
 * @param logRequests    log raw requests and responses at the client
 */
public record LlmSettings(
        String apiKey,
        String modelName,
        double temperature,
        int maxTokens,
        int timeoutSeconds,
        int maxInputTokens,
        boolean logRequests
) {

    public static final String DEFAULT_MODEL = "gpt-4o-mini";

    public LlmSettings {
        apiKey = apiKey == null ? "" : apiKey.trim();
        modelName = modelName == null || modelName.isBlank() ? DEFAULT_MODEL : modelName.trim();
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive: " + maxTokens);
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive: " + timeoutSeconds);
        }
        if (maxInputTokens <= 0) {
            throw new IllegalArgumentException("maxInputTokens must be positive: " + maxInputTokens);
        }
    }

    public static LlmSettings disabled() {
        return new LlmSettings("", DEFAULT_MODEL, 0.0, 2000, 30, 8000, false);
    }

    public boolean hasCredentials() {
        return !apiKey.isEmpty();
    }

    public Duration timeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    @Override
    public String toString() {
        return "LlmSettings[model=" + modelName
                + ", temperature=" + temperature
                + ", maxTokens=" + maxTokens
                + ", timeoutSeconds=" + timeoutSeconds
                + ", maxInputTokens=" + maxInputTokens
                + ", apiKey=" + (hasCredentials() ? "****" : "<none>") + "]";
    }
}
