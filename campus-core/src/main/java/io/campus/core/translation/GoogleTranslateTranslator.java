package io.campus.core.translation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
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
 * Google Cloud Translation v2 REST client.
 */
public final class GoogleTranslateTranslator extends AbstractTranslator {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String apiKey;
    private final HttpUrl endpoint;
    private final OkHttpClient client;
    private final ObjectMapper mapper;

    public GoogleTranslateTranslator(String apiKey, String endpoint) {
        this(apiKey, endpoint, Duration.ofSeconds(15));
    }

    public GoogleTranslateTranslator(String apiKey, String endpoint, Duration callTimeout) {
        this.apiKey = apiKey == null ? "" : apiKey;
        this.endpoint = HttpUrl.get(Objects.requireNonNull(endpoint, "endpoint must not be null"));
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(5))
            .readTimeout(callTimeout)
            .callTimeout(callTimeout)
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return "google";
    }

    @Override
    protected String doTranslate(String text, String source, String target) throws TranslationUnavailableException {
        if (apiKey.isBlank()) {
            throw new TranslationUnavailableException("google translation is not configured");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("q", text);
        payload.put("source", source);
        payload.put("target", target);
        payload.put("format", "text");

        try {
            Request request = new Request.Builder()
                .url(endpoint.newBuilder().addQueryParameter("key", apiKey).build())
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
                .header("Accept", "application/json")
                .build();
            try (Response response = client.newCall(request).execute()) {
                ResponseBody body = response.body();
                String raw = body == null ? "" : body.string();
                if (!response.isSuccessful()) {
                    throw new TranslationUnavailableException(
                        "google translation failed for " + source + "->" + target + ": HTTP " + response.code()
                    );
                }
                JsonNode translated = mapper.readTree(raw).path("data").path("translations").path(0).path("translatedText");
                if (translated.isMissingNode()) {
                    throw new TranslationUnavailableException("google translation response has no translatedText");
                }
                return translated.asText("");
            }
        } catch (IOException e) {
            throw new TranslationUnavailableException("google translation unreachable: " + e.getMessage(), e);
        }
    }
}
