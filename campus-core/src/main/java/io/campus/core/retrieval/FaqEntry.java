package io.campus.core.retrieval;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Locale;

@JsonIgnoreProperties(ignoreUnknown = true)
public record FaqEntry(String id, String question, String answer, String category) {
    public FaqEntry {
        question = question == null ? "" : question.trim();
        answer = answer == null ? "" : answer.trim();
        category = category == null ? "" : category.trim();
        if (id == null || id.isBlank()) {
            id = Integer.toHexString(question.toLowerCase(Locale.ROOT).hashCode());
        }
    }
}
