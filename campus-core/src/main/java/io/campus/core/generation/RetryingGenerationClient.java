package io.campus.core.generation;

import io.campus.core.context.Prompt;
import io.campus.core.provider.CompletionOptions;
import io.campus.core.provider.LlmException;
import io.campus.core.provider.LlmProvider;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class RetryingGenerationClient implements GenerationClient {
    private static final Logger LOG = LoggerFactory.getLogger(RetryingGenerationClient.class);

    private final LlmProvider provider;
    private final String model;
    private final CompletionOptions options;
    private final RetryPolicy policy;
    private final String fallbackText;
    private final Sleeper sleeper;

    public RetryingGenerationClient(
        LlmProvider provider,
        String model,
        CompletionOptions options,
        RetryPolicy policy,
        String fallbackText
    ) {
        this(provider, model, options, policy, fallbackText, duration -> Thread.sleep(duration.toMillis()));
    }

    public RetryingGenerationClient(
        LlmProvider provider,
        String model,
        CompletionOptions options,
        RetryPolicy policy,
        String fallbackText,
        Sleeper sleeper
    ) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.model = model;
        this.options = options == null ? CompletionOptions.defaults() : options;
        this.policy = policy == null ? RetryPolicy.defaults() : policy;
        this.fallbackText = Objects.requireNonNull(fallbackText, "fallbackText must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    @Override
    public GenerationOutcome generate(Prompt prompt) {
        String failure = "";
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            try {
                String content = provider.complete(model, prompt.messages(), options).content();
                IntentTag tagged = IntentTag.parse(content);
                if (tagged.answer().isBlank()) {
                    LOG.warn("Provider {} returned an empty answer", provider.name());
                    return GenerationOutcome.fallback(fallbackText, "empty_answer", attempt);
                }
                return GenerationOutcome.success(tagged.answer(), tagged.intent(), attempt);
            } catch (LlmException e) {
                failure = e.getMessage();
                if (!e.transientFailure()) {
                    LOG.warn("Generation failed permanently on attempt {} (status {}): {}", attempt, e.statusCode(), e.getMessage());
                    return GenerationOutcome.fallback(fallbackText, failure, attempt);
                }
                LOG.warn("Generation attempt {}/{} failed (status {}): {}",
                    attempt, policy.maxAttempts(), e.statusCode(), e.getMessage());
                if (attempt < policy.maxAttempts()) {
                    try {
                        sleeper.sleep(policy.backoffAfter(attempt));
                    } catch (InterruptedException interrupted) {
                        Thread.currentThread().interrupt();
                        return GenerationOutcome.fallback(fallbackText, "interrupted", attempt);
                    }
                }
            }
        }
        return GenerationOutcome.fallback(fallbackText, failure, policy.maxAttempts());
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }
}
