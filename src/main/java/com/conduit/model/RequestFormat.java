package com.conduit.model;

import java.util.Locale;

/**
 * Wire shapes a request body can arrive in, and that a response can be re-shaped into.
 */
public enum RequestFormat {
    OPENAI,
    BEDROCK_CLAUDE,
    BEDROCK_TITAN;

    /**
     * Resolve the response shape from an out-of-band selector such as {@code bedrock-claude}.
     * Anything unrecognised selects the OpenAI shape.
     */
    public static RequestFormat fromSelector(String selector) {
        if (selector == null || selector.isBlank()) {
            return OPENAI;
        }
        String normalized = selector.toLowerCase(Locale.ROOT);
        if (normalized.contains("claude")) {
            return BEDROCK_CLAUDE;
        }
        if (normalized.contains("titan")) {
            return BEDROCK_TITAN;
        }
        return OPENAI;
    }
}
