package io.campus.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidersConfig(
    ProviderConfig openai,
    ProviderConfig gemini
) {

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(ProviderConfig.defaults(), ProviderConfig.defaults());
    }
}
