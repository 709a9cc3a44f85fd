package io.campus.core.provider;

import java.util.Map;

public record LlmResponse(String content, Map<String, Object> usage) {
    public LlmResponse {
        content = content == null ? "" : content;
        usage = usage == null ? Map.of() : Map.copyOf(usage);
    }
}
