package io.campus.core.provider;

import io.campus.core.model.ChatMessage;
import io.campus.core.model.MessageRole;
import java.util.List;
import java.util.Map;

/**
 * Offline provider that answers with the last user message. Used when no model endpoint is configured.
 */
public final class EchoProvider implements LlmProvider {
    private final String name;

    public EchoProvider(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public LlmResponse complete(String model, List<ChatMessage> messages, CompletionOptions options) {
        String lastUserMessage = messages.stream()
            .filter(message -> message.role() == MessageRole.USER)
            .reduce((first, second) -> second)
            .map(ChatMessage::content)
            .orElse("");

        return new LlmResponse("[" + name + "] " + lastUserMessage, Map.of("provider", name));
    }
}
