package io.campus.core.context;

import io.campus.core.model.ChatMessage;
import io.campus.core.retrieval.RetrievedChunk;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Assembled model input. {@code size} counts only the variable content: knowledge block, history and the
 * current message.
 */
public record Prompt(
    List<ChatMessage> messages,
    List<RetrievedChunk> includedChunks,
    int includedHistoryTurns,
    int droppedHistoryTurns,
    int droppedChunks,
    int size
) {
    public Prompt {
        messages = messages == null ? List.of() : List.copyOf(messages);
        includedChunks = includedChunks == null ? List.of() : List.copyOf(includedChunks);
    }

    public String render() {
        return messages.stream()
            .map(message -> message.role().name().toLowerCase(Locale.ROOT) + ": " + message.content())
            .collect(Collectors.joining("\n\n"));
    }

    public String currentMessage() {
        return messages.isEmpty() ? "" : messages.get(messages.size() - 1).content();
    }
}
