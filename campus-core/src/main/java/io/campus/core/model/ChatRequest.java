package io.campus.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Inbound chat message. Construction validates the shape, so a request that exists is well formed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatRequest(
    @JsonProperty("message") String message,
    @JsonProperty("session_id") @JsonAlias({"sessionId"}) String sessionId,
    @JsonProperty("language") String language
) {
    public static final int MAX_MESSAGE_CHARS = 2_000;
    private static final Pattern SESSION_ID = Pattern.compile("^[A-Za-z0-9._:-]{1,128}$");
    private static final Pattern LANGUAGE_CODE = Pattern.compile("^[a-z]{2,3}(-[A-Za-z0-9]{2,8})?$");

    public ChatRequest {
        if (message == null || message.isBlank()) {
            throw new InvalidChatRequestException("message", "message must not be blank");
        }
        message = message.trim();
        if (message.length() > MAX_MESSAGE_CHARS) {
            throw new InvalidChatRequestException("message", "message exceeds " + MAX_MESSAGE_CHARS + " characters");
        }

        sessionId = sessionId == null || sessionId.isBlank() ? null : sessionId.trim();
        if (sessionId != null && !SESSION_ID.matcher(sessionId).matches()) {
            throw new InvalidChatRequestException("session_id", "session_id has an invalid format");
        }

        language = language == null || language.isBlank() ? null : language.trim().toLowerCase(Locale.ROOT);
        if (language != null && !LANGUAGE_CODE.matcher(language).matches()) {
            throw new InvalidChatRequestException("language", "language must be a language code such as 'en' or 'hi'");
        }
    }

    public static ChatRequest of(String message) {
        return new ChatRequest(message, null, null);
    }
}
