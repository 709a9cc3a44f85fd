package io.campus.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AssistantSettings(
    String workspace,
    String pivotLanguage,
    String defaultLanguage,
    List<String> supportedLanguages,
    @JsonAlias({"vectorSearchK"}) int retrievalK,
    @JsonAlias({"vectorScoreThreshold"}) double minScore,
    int contextBudgetChars,
    @JsonAlias({"maxConversationHistory"}) int maxHistoryTurns,
    double confidenceThreshold,
    List<String> escalationPatterns,
    String fallbackResponse,
    String errorResponse,
    String welcomeMessage,
    List<String> defaultSuggestions,
    double detectionConfidenceFloor,
    int detectionMinLetters
) {

    public static AssistantSettings defaults() {
        return new AssistantSettings(
            "~/.campus-assistant/data",
            "en",
            "en",
            List.of("en", "hi", "raj", "gu", "mr", "pa", "ta"),
            5,
            0.3,
            6_000,
            10,
            0.65,
            List.of(
                "\\b(talk|speak|connect)\\s+(to|with)\\s+(a\\s+)?(human|person|someone|staff|counsell?or|agent)\\b",
                "\\b(human|real person|live agent)\\b",
                "इंसान|व्यक्ति से बात"
            ),
            "I'm sorry, I couldn't find a reliable answer right now. A staff member will follow up with you shortly.",
            "The assistant is temporarily unavailable. Please try again in a few minutes.",
            "Hello! I am your campus assistant. Ask me about admissions, fees, exams, timetables or campus facilities.",
            List.of(
                "What are the admission requirements?",
                "When is the fee payment deadline?",
                "What are the library hours?"
            ),
            0.6,
            2
        );
    }
}
