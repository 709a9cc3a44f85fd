package io.campus.cli;

import io.campus.core.config.model.AssistantConfig;
import io.campus.core.runtime.AssistantRuntime;
import java.io.IOException;

@FunctionalInterface
public interface RuntimeFactory {
    AssistantRuntime open(AssistantConfig config) throws IOException;
}
