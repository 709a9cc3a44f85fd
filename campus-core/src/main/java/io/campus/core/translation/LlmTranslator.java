package io.campus.core.translation;

import io.campus.core.language.Languages;
import io.campus.core.model.ChatMessage;
import io.campus.core.provider.CompletionOptions;
import io.campus.core.provider.LlmException;
import io.campus.core.provider.LlmProvider;
import java.util.List;
import java.util.Objects;

/**
 * Translates through the language model. Semantic rather than literal; numbers, dates and names are kept.
 */
public final class LlmTranslator extends AbstractTranslator {
    private static final CompletionOptions OPTIONS = new CompletionOptions(0.0, 1024);

    private final LlmProvider provider;
    private final String model;

    public LlmTranslator(LlmProvider provider, String model) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.model = model;
    }

    @Override
    public String name() {
        return "llm:" + provider.name();
    }

    @Override
    protected String doTranslate(String text, String source, String target) throws TranslationUnavailableException {
        String instructions = "Translate the user's message from " + Languages.displayName(source)
            + " to " + Languages.displayName(target) + ". "
            + "Keep numbers, dates, amounts, names and course codes unchanged. "
            + "Reply with the translation only, without quotes or commentary.";
        try {
            String translated = provider.complete(
                model,
                List.of(ChatMessage.system(instructions), ChatMessage.user(text)),
                OPTIONS
            ).content();
            return stripQuotes(translated);
        } catch (LlmException e) {
            throw new TranslationUnavailableException("model translation failed: " + e.getMessage(), e);
        }
    }

    private String stripQuotes(String value) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }
}
