package io.campus.core.translation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GoogleTranslateTranslatorTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldTranslateThroughV2Api() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {"data": {"translations": [{"translatedText": "When does the library open?"}]}}
                """));
        GoogleTranslateTranslator translator = new GoogleTranslateTranslator("g-key", server.url("/v2").toString());

        String translated = translator.translate("पुस्तकालय कब खुलता है?", "hi", "en");

        assertThat(translated).isEqualTo("When does the library open?");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getRequestUrl().queryParameter("key")).isEqualTo("g-key");
        JsonNode body = new ObjectMapper().readTree(request.getBody().readUtf8());
        assertThat(body.path("source").asText()).isEqualTo("hi");
        assertThat(body.path("target").asText()).isEqualTo("en");
        assertThat(body.path("format").asText()).isEqualTo("text");
    }

    @Test
    void shouldMapRajasthaniOntoHindiForTheBackend() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"data\":{\"translations\":[{\"translatedText\":\"ok\"}]}}"));
        GoogleTranslateTranslator translator = new GoogleTranslateTranslator("g-key", server.url("/v2").toString());

        translator.translate("result", "en", "raj");

        JsonNode body = new ObjectMapper().readTree(server.takeRequest().getBody().readUtf8());
        assertThat(body.path("target").asText()).isEqualTo("hi");
    }

    @Test
    void shouldReturnTextUnchangedForSameLanguageWithoutCalling() throws Exception {
        GoogleTranslateTranslator translator = new GoogleTranslateTranslator("g-key", server.url("/v2").toString());

        assertThat(translator.translate("hello", "en", "en")).isEqualTo("hello");
        assertThat(translator.translate("नमस्ते", "raj", "hi")).isEqualTo("नमस्ते");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldFailOnUpstreamError() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\":{\"message\":\"Bad language pair\"}}"));
        GoogleTranslateTranslator translator = new GoogleTranslateTranslator("g-key", server.url("/v2").toString());

        assertThatThrownBy(() -> translator.translate("hello", "en", "xx"))
            .isInstanceOf(TranslationUnavailableException.class)
            .hasMessageContaining("HTTP 400");
    }

    @Test
    void shouldFailWhenNotConfigured() {
        GoogleTranslateTranslator translator = new GoogleTranslateTranslator("", server.url("/v2").toString());

        assertThatThrownBy(() -> translator.translate("hello", "en", "hi"))
            .isInstanceOf(TranslationUnavailableException.class)
            .hasMessageContaining("not configured");
    }
}
