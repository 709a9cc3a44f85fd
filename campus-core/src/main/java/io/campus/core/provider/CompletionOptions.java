package io.campus.core.provider;

public record CompletionOptions(double temperature, int maxTokens) {
    public CompletionOptions {
        temperature = Math.max(0.0, Math.min(2.0, temperature));
        maxTokens = Math.max(1, maxTokens);
    }

    public static CompletionOptions defaults() {
        return new CompletionOptions(0.3, 1024);
    }
}
