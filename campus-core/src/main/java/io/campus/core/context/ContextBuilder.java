package io.campus.core.context;

import io.campus.core.model.ChatMessage;
import io.campus.core.model.Turn;
import io.campus.core.model.TurnRole;
import io.campus.core.retrieval.RetrievedChunk;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds a bounded prompt. Over budget, the oldest history goes first, then the lowest-scoring chunks.
 * The current message is always kept, even when it alone exceeds the budget. Output depends only on the
 * inputs.
 */
public final class ContextBuilder {
    static final String INSTRUCTIONS = """
        You are the campus help desk assistant. Answer the student's question using only the knowledge below \
        and the conversation so far. Keep answers short and factual. Keep numbers, dates, amounts and names \
        exactly as written in the knowledge. If the knowledge does not contain the answer, say that you do not \
        know and that a staff member can help.
        Finish your answer with one line of the form [intent: <label>] where <label> is one of: \
        admissions, fees, exams, library, hostel, timetable, scholarship, placement, general.""";
    static final String NO_KNOWLEDGE = "(no relevant knowledge found)";

    private final int maxHistoryTurns;

    public ContextBuilder(int maxHistoryTurns) {
        this.maxHistoryTurns = Math.max(0, maxHistoryTurns);
    }

    public Prompt build(List<RetrievedChunk> chunks, List<Turn> history, String currentMessage, int budget) {
        String current = currentMessage == null ? "" : currentMessage;
        List<RetrievedChunk> keptChunks = new ArrayList<>(chunks == null ? List.of() : chunks);
        List<Turn> allHistory = history == null ? List.of() : history;
        List<Turn> keptHistory = new ArrayList<>(
            allHistory.subList(Math.max(0, allHistory.size() - maxHistoryTurns), allHistory.size())
        );
        int droppedHistory = allHistory.size() - keptHistory.size();
        int droppedChunks = 0;

        int size = size(keptChunks, keptHistory, current);
        while (size > budget) {
            if (!keptHistory.isEmpty()) {
                keptHistory.remove(0);
                droppedHistory++;
            } else if (!keptChunks.isEmpty()) {
                keptChunks.remove(lowestScoring(keptChunks));
                droppedChunks++;
            } else {
                break;
            }
            size = size(keptChunks, keptHistory, current);
        }

        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(INSTRUCTIONS + "\n\nKnowledge:\n" + knowledgeBlock(keptChunks)));
        for (Turn turn : keptHistory) {
            messages.add(turn.role() == TurnRole.USER
                ? ChatMessage.user(turn.pivotContent())
                : ChatMessage.assistant(turn.pivotContent()));
        }
        messages.add(ChatMessage.user(current));
        return new Prompt(messages, keptChunks, keptHistory.size(), droppedHistory, droppedChunks, size);
    }

    // last of the lowest, so equal scores drop in reverse insertion order
    private int lowestScoring(List<RetrievedChunk> chunks) {
        int index = 0;
        for (int i = 1; i < chunks.size(); i++) {
            if (chunks.get(i).score() <= chunks.get(index).score()) {
                index = i;
            }
        }
        return index;
    }

    private int size(List<RetrievedChunk> chunks, List<Turn> history, String current) {
        int total = chunks.isEmpty() ? 0 : knowledgeBlock(chunks).length();
        for (Turn turn : history) {
            total += turn.pivotContent().length();
        }
        return total + current.length();
    }

    static String knowledgeBlock(List<RetrievedChunk> chunks) {
        if (chunks.isEmpty()) {
            return NO_KNOWLEDGE;
        }
        StringBuilder block = new StringBuilder();
        for (int i = 0; i < chunks.size(); i++) {
            RetrievedChunk chunk = chunks.get(i);
            if (i > 0) {
                block.append("\n\n");
            }
            block.append('[').append(i + 1).append("] ")
                .append(chunk.title())
                .append(String.format(Locale.ROOT, " (relevance %.2f)", chunk.score()))
                .append('\n')
                .append(chunk.text());
        }
        return block.toString();
    }
}
