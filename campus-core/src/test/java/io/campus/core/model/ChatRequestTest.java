package io.campus.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChatRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void shouldNormalizeMessageAndLanguage() {
        ChatRequest request = new ChatRequest("  library hours?  ", " s-1 ", "HI");

        assertThat(request.message()).isEqualTo("library hours?");
        assertThat(request.sessionId()).isEqualTo("s-1");
        assertThat(request.language()).isEqualTo("hi");
    }

    @Test
    void shouldRejectBlankOrOversizedMessages() {
        assertThatThrownBy(() -> ChatRequest.of("   "))
            .isInstanceOfSatisfying(InvalidChatRequestException.class, e -> assertThat(e.field()).isEqualTo("message"));
        assertThatThrownBy(() -> ChatRequest.of("x".repeat(ChatRequest.MAX_MESSAGE_CHARS + 1)))
            .isInstanceOf(InvalidChatRequestException.class);
        assertThat(ChatRequest.of("x".repeat(ChatRequest.MAX_MESSAGE_CHARS)).message()).hasSize(ChatRequest.MAX_MESSAGE_CHARS);
    }

    @Test
    void shouldRejectMalformedSessionAndLanguage() {
        assertThatThrownBy(() -> new ChatRequest("hi", "bad id!", null))
            .isInstanceOfSatisfying(InvalidChatRequestException.class, e -> assertThat(e.field()).isEqualTo("session_id"));
        assertThatThrownBy(() -> new ChatRequest("hi", null, "hindi-language-please"))
            .isInstanceOfSatisfying(InvalidChatRequestException.class, e -> assertThat(e.field()).isEqualTo("language"));
    }

    @Test
    void shouldBindFromSnakeCaseJson() throws Exception {
        ChatRequest request = mapper.readValue("{\"message\":\"fees?\",\"session_id\":\"abc-1\",\"language\":\"raj\"}", ChatRequest.class);

        assertThat(request.sessionId()).isEqualTo("abc-1");
        assertThat(request.language()).isEqualTo("raj");
    }

    @Test
    void shouldSurfaceValidationFailureThroughJsonBinding() {
        assertThatThrownBy(() -> mapper.readValue("{\"message\":\"\"}", ChatRequest.class))
            .isInstanceOf(JsonMappingException.class)
            .hasRootCauseInstanceOf(InvalidChatRequestException.class);
    }

    @Test
    void shouldSerializeResponseWithSnakeCaseKeys() throws Exception {
        ChatResponse response = new ChatResponse("s-1", "Open 8am to 10pm.", "en", "en", "library", 0.84,
            List.of(new SourceView("Library hours", "Open 8am to 10pm.", 0.77)), false, List.of("When are fees due?"), null, null);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(response));

        assertThat(json.path("session_id").asText()).isEqualTo("s-1");
        assertThat(json.path("response").asText()).isEqualTo("Open 8am to 10pm.");
        assertThat(json.path("needs_escalation").asBoolean()).isFalse();
        assertThat(json.path("suggested_questions").get(0).asText()).isEqualTo("When are fees due?");
        assertThat(json.has("escalation_reason")).isFalse();
        assertThat(json.has("error")).isFalse();
        assertThat(json.has("failed")).isFalse();
    }

    @Test
    void shouldClampConfidenceIntoUnitRange() {
        ChatResponse response = new ChatResponse("s", "t", "en", "en", null, 1.7, null, false, null, null, null);

        assertThat(response.confidence()).isEqualTo(1.0);
        assertThat(ChatResponse.error("s", "down", "en", "internal_error").failed()).isTrue();
    }
}
