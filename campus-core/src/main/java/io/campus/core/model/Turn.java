package io.campus.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One immutable entry of a session's history.
 *
 * <p>{@code content} is the text as the student saw it; {@code pivotContent} is the same text in the
 * pivot language and is what later prompts are built from. Both are equal when no translation happened.
 */
public record Turn(
    TurnRole role,
    String content,
    String pivotContent,
    String language,
    String intent,
    Double confidence,
    List<String> sources,
    boolean escalated,
    Set<Degradation> degradations,
    Instant createdAt
) {
    public Turn {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
        pivotContent = pivotContent == null || pivotContent.isBlank() ? content : pivotContent;
        sources = sources == null ? List.of() : List.copyOf(sources);
        degradations = degradations == null || degradations.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(degradations));
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
        if (confidence != null && (confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
    }

    public static Turn user(String content, String pivotContent, String language, Set<Degradation> degradations, Instant at) {
        return new Turn(TurnRole.USER, content, pivotContent, language, null, null, List.of(), false, degradations, at);
    }

    public boolean degraded() {
        return !degradations.isEmpty();
    }
}
