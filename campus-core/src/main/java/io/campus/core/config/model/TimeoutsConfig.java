package io.campus.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Duration;

/**
 * Stage deadlines, plus the per-call budgets that must fit inside them: a translation chain gets one
 * {@code translationAttemptMs} per translator, and generation one {@code generationAttemptMs} per retry.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TimeoutsConfig(
    long detectionMs,
    long translationMs,
    long retrievalMs,
    long generationMs,
    long translationAttemptMs,
    long generationAttemptMs
) {

    public static TimeoutsConfig defaults() {
        return new TimeoutsConfig(1_000, 8_000, 5_000, 45_000, 3_500, 12_000);
    }

    public Duration translationAttempt() {
        return Duration.ofMillis(translationAttemptMs > 0 ? Math.min(translationAttemptMs, translationMs) : translationMs);
    }

    public Duration generationAttempt() {
        return Duration.ofMillis(generationAttemptMs > 0 ? Math.min(generationAttemptMs, generationMs) : generationMs);
    }
}
