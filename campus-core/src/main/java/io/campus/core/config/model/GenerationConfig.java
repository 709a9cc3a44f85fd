package io.campus.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GenerationConfig(
    String provider,
    String model,
    double temperature,
    int maxTokens,
    int maxAttempts,
    long initialBackoffMs,
    long maxBackoffMs
) {

    public static GenerationConfig defaults() {
        return new GenerationConfig("gemini", "gemini-2.0-flash", 0.3, 1024, 3, 250, 2_000);
    }
}
