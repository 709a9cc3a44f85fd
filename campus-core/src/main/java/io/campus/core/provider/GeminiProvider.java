package io.campus.core.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.campus.core.model.ChatMessage;
import io.campus.core.model.MessageRole;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Single-attempt client for the Google Gemini {@code models/{model}:generateContent} endpoint.
 */
public final class GeminiProvider implements LlmProvider {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String name;
    private final String apiKey;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public GeminiProvider(String name, String apiKey, String apiBase) {
        this(name, apiKey, apiBase, Duration.ofSeconds(60));
    }

    public GeminiProvider(String name, String apiKey, String apiBase, Duration callTimeout) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiKey = apiKey == null ? "" : apiKey;
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(10))
            .readTimeout(callTimeout)
            .writeTimeout(Duration.ofSeconds(20))
            .callTimeout(callTimeout)
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse complete(String model, List<ChatMessage> messages, CompletionOptions options) throws LlmException {
        if (apiKey.isBlank()) {
            throw LlmException.fatal("missing API key for provider " + name, -1, null);
        }

        Request request;
        try {
            request = new Request.Builder()
                .url(generateUrl(model))
                .post(RequestBody.create(mapper.writeValueAsString(payload(messages, options)), JSON))
                .header("x-goog-api-key", apiKey)
                .header("Accept", "application/json")
                .build();
        } catch (IOException e) {
            throw LlmException.fatal("could not encode request: " + e.getMessage(), -1, e);
        }

        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw LlmException.forStatus(response.code(), text);
            }
            return parse(text);
        } catch (IOException e) {
            throw LlmException.transientFailure("I/O error calling " + name + ": " + e.getMessage(), -1, e);
        }
    }

    private HttpUrl generateUrl(String model) {
        String bare = model == null ? "" : model.replaceFirst("^models/", "");
        return apiBase.newBuilder()
            .addPathSegment("models")
            .addPathSegment(bare + ":generateContent")
            .build();
    }

    private Map<String, Object> payload(List<ChatMessage> messages, CompletionOptions options) {
        StringBuilder system = new StringBuilder();
        List<Map<String, Object>> contents = new ArrayList<>();
        for (ChatMessage message : messages) {
            if (message.role() == MessageRole.SYSTEM) {
                if (system.length() > 0) {
                    system.append("\n\n");
                }
                system.append(message.content());
                continue;
            }
            contents.add(Map.of(
                "role", message.role() == MessageRole.ASSISTANT ? "model" : "user",
                "parts", List.of(Map.of("text", message.content()))
            ));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        if (system.length() > 0) {
            payload.put("systemInstruction", Map.of("parts", List.of(Map.of("text", system.toString()))));
        }
        payload.put("contents", contents);
        payload.put("generationConfig", Map.of(
            "temperature", options.temperature(),
            "maxOutputTokens", options.maxTokens()
        ));
        return payload;
    }

    private LlmResponse parse(String body) throws LlmException {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (IOException e) {
            throw LlmException.fatal("malformed generateContent response from " + name, 200, e);
        }
        JsonNode candidate = root.path("candidates").path(0);
        if (candidate.isMissingNode()) {
            String blockReason = root.path("promptFeedback").path("blockReason").asText("");
            throw LlmException.fatal(
                "no candidates from " + name + (blockReason.isBlank() ? "" : " (blocked: " + blockReason + ")"),
                200,
                null
            );
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            text.append(part.path("text").asText(""));
        }
        Map<String, Object> usage = root.has("usageMetadata")
            ? mapper.convertValue(root.path("usageMetadata"), new TypeReference<Map<String, Object>>() {
            })
            : Map.of();
        return new LlmResponse(text.toString(), usage);
    }
}
