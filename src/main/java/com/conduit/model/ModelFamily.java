package com.conduit.model;

import java.util.Locale;

/**
 * Wire-protocol families the gateway speaks, with their built-in generation defaults.
 */
public enum ModelFamily {
    OPENAI(1024),
    CLAUDE(2048),
    TITAN(512),
    NOVA(4096),
    AI21(2048),
    COHERE(2048),
    META(2048),
    MISTRAL(4096),
    STABILITY(2048),
    WRITER(2048);

    public static final double DEFAULT_TEMPERATURE = 0.7;

    private final int defaultMaxTokens;

    ModelFamily(int defaultMaxTokens) {
        this.defaultMaxTokens = defaultMaxTokens;
    }

    public int defaultMaxTokens() {
        return defaultMaxTokens;
    }

    /**
     * Key used for this family under {@code conduit.defaults}.
     */
    public String configKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
