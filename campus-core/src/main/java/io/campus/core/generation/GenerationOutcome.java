package io.campus.core.generation;

public record GenerationOutcome(String answer, String intent, boolean degraded, String failure, int attempts) {
    public GenerationOutcome {
        answer = answer == null ? "" : answer;
        intent = intent == null || intent.isBlank() ? null : intent;
        failure = failure == null ? "" : failure;
    }

    public static GenerationOutcome success(String answer, String intent, int attempts) {
        return new GenerationOutcome(answer, intent, false, "", attempts);
    }

    public static GenerationOutcome fallback(String fallbackText, String failure, int attempts) {
        return new GenerationOutcome(fallbackText, null, true, failure, attempts);
    }
}
