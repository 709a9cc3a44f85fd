package io.campus.core.pipeline;

import io.campus.core.config.model.AssistantConfig;
import io.campus.core.config.model.AssistantSettings;
import io.campus.core.config.model.TimeoutsConfig;
import io.campus.core.language.Languages;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

public record PipelineSettings(
    String pivotLanguage,
    String defaultLanguage,
    List<String> supportedLanguages,
    int retrievalK,
    int contextBudgetChars,
    int maxHistoryTurns,
    String fallbackResponse,
    String errorResponse,
    List<String> defaultSuggestions,
    Duration detectionTimeout,
    Duration translationTimeout,
    Duration retrievalTimeout,
    Duration generationTimeout
) {
    public PipelineSettings {
        pivotLanguage = Languages.normalize(pivotLanguage);
        defaultLanguage = Languages.normalize(defaultLanguage);
        List<String> normalized = new ArrayList<>();
        for (String code : supportedLanguages == null ? List.<String>of() : supportedLanguages) {
            normalized.add(Languages.normalize(code));
        }
        supportedLanguages = List.copyOf(normalized);
        defaultSuggestions = defaultSuggestions == null ? List.of() : List.copyOf(defaultSuggestions);
    }

    public static PipelineSettings from(AssistantConfig config) {
        AssistantSettings assistant = config.assistant();
        TimeoutsConfig timeouts = config.timeouts();
        return new PipelineSettings(
            assistant.pivotLanguage(),
            assistant.defaultLanguage(),
            assistant.supportedLanguages(),
            assistant.retrievalK(),
            assistant.contextBudgetChars(),
            assistant.maxHistoryTurns(),
            assistant.fallbackResponse(),
            assistant.errorResponse(),
            assistant.defaultSuggestions(),
            Duration.ofMillis(timeouts.detectionMs()),
            Duration.ofMillis(timeouts.translationMs()),
            Duration.ofMillis(timeouts.retrievalMs()),
            Duration.ofMillis(timeouts.generationMs())
        );
    }

    public boolean supports(String code) {
        return code != null && supportedLanguages.contains(Languages.normalize(code));
    }
}
