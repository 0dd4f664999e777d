package com.nlfhir.clinical.llm;

/**
 * Rough token arithmetic at four characters per token. Good enough to keep prompts inside
 * the model's input window without a tokenizer dependency.
 */
public final class TokenEstimator {

    static final int CHARS_PER_TOKEN = 4;

    private TokenEstimator() {
    }

    public static int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    /**
     * Returns {@code text} cut to at most {@code maxTokens} estimated tokens.
     */
    public static String truncate(String text, int maxTokens) {
        if (text == null) {
            return "";
        }
        long maxChars = (long) maxTokens * CHARS_PER_TOKEN;
        if (text.length() <= maxChars) {
            return text;
        }
        return text.substring(0, (int) maxChars);
    }
}
