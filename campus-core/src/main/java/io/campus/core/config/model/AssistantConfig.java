package io.campus.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AssistantConfig(
    AssistantSettings assistant,
    GenerationConfig generation,
    TimeoutsConfig timeouts,
    ProvidersConfig providers,
    TranslationConfig translation,
    StorageConfig storage,
    GatewayConfig gateway
) {

    public static AssistantConfig defaults() {
        return new AssistantConfig(
            AssistantSettings.defaults(),
            GenerationConfig.defaults(),
            TimeoutsConfig.defaults(),
            ProvidersConfig.defaults(),
            TranslationConfig.defaults(),
            StorageConfig.defaults(),
            GatewayConfig.defaults()
        );
    }
}
