package io.campus.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Marks a turn that was produced through a fallback path after a recoverable failure.
 */
public enum Degradation {
    LANGUAGE_FALLBACK("language_fallback"),
    TRANSLATION_DEGRADED("translation_degraded"),
    RETRIEVAL_UNAVAILABLE("retrieval_unavailable"),
    GENERATION_DEGRADED("generation_degraded");

    private final String code;

    Degradation(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static Degradation fromCode(String code) {
        for (Degradation degradation : values()) {
            if (degradation.code.equalsIgnoreCase(code)) {
                return degradation;
            }
        }
        throw new IllegalArgumentException("Unknown degradation: " + code);
    }
}
