package io.campus.cli;

import io.campus.core.config.ConfigService;
import io.campus.core.runtime.AssistantRuntime;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    RuntimeFactory runtimeFactory,
    GatewayRunner gatewayRunner
) {
    public CliContext(ConfigService configService, Path configPath) {
        this(configService, configPath, AssistantRuntime::open, portOverride -> {
            throw new UnsupportedOperationException("gateway runner is not configured");
        });
    }
}
