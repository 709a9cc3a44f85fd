package io.campus.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GatewayConfig(
    String host,
    int port,
    List<String> corsOrigins
) {

    public static GatewayConfig defaults() {
        return new GatewayConfig("0.0.0.0", 8000, List.of("http://localhost:3000", "http://localhost:8000"));
    }
}
