package io.campus.core.provider;

import io.campus.core.model.ChatMessage;
import java.util.List;

public interface LlmProvider {
    String name();

    LlmResponse complete(String model, List<ChatMessage> messages, CompletionOptions options) throws LlmException;
}
