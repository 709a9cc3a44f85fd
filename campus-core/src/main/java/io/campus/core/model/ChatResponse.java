package io.campus.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ChatResponse(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("response") String responseText,
    @JsonProperty("detected_language") String detectedLanguage,
    @JsonProperty("response_language") String responseLanguage,
    @JsonProperty("intent") String intent,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("sources") List<SourceView> sources,
    @JsonProperty("needs_escalation") boolean needsEscalation,
    @JsonProperty("suggested_questions") List<String> suggestedQuestions,
    @JsonProperty("escalation_reason") @JsonInclude(JsonInclude.Include.NON_NULL) String escalationReason,
    @JsonProperty("error") @JsonInclude(JsonInclude.Include.NON_NULL) String error
) {
    public ChatResponse {
        sources = sources == null ? List.of() : List.copyOf(sources);
        suggestedQuestions = suggestedQuestions == null ? List.of() : List.copyOf(suggestedQuestions);
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public static ChatResponse error(String sessionId, String text, String language, String errorCode) {
        return new ChatResponse(sessionId, text, language, language, null, 0.0, List.of(), false, List.of(), null, errorCode);
    }

    @JsonIgnore
    public boolean failed() {
        return error != null;
    }
}
