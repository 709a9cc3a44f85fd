package io.campus.core.language;

public record LanguageDetection(String languageCode, double confidence) {
    public LanguageDetection {
        if (languageCode == null || languageCode.isBlank()) {
            throw new IllegalArgumentException("languageCode must not be blank");
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }
}
