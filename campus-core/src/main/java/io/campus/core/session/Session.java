package io.campus.core.session;

import java.time.Instant;
import java.util.Objects;

public record Session(String id, String language, Instant createdAt, Instant lastActivity) {
    public Session {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        language = language == null ? "" : language;
        createdAt = createdAt == null ? Instant.now() : createdAt;
        lastActivity = lastActivity == null ? createdAt : lastActivity;
    }

    public static Session open(String id, String language, Instant at) {
        return new Session(id, language, at, at);
    }

    public Session touch(String newLanguage, Instant at) {
        String resolved = newLanguage == null || newLanguage.isBlank() ? language : newLanguage;
        return new Session(id, resolved, createdAt, at == null ? lastActivity : at);
    }
}
