package io.campus.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TranslationConfig(
    String mode,
    @JsonAlias({"googleTranslateApiKey"}) String googleApiKey,
    String googleApiBase
) {

    public static TranslationConfig defaults() {
        return new TranslationConfig("chain", "", "https://translation.googleapis.com/language/translate/v2");
    }

    public boolean googleConfigured() {
        return googleApiKey != null && !googleApiKey.isBlank();
    }
}
