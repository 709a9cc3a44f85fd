package io.campus.core.retrieval;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns FAQ entries and already-extracted document text into knowledge chunks.
 */
public final class KnowledgeIngestor {
    public static final String FAQ_PREFIX = "faq:";
    public static final String DOCUMENT_PREFIX = "doc:";
    static final int MAX_CHUNK_CHARS = 800;

    private static final Logger LOG = LoggerFactory.getLogger(KnowledgeIngestor.class);

    private final KnowledgeStore store;
    private final ObjectMapper mapper;

    public KnowledgeIngestor(KnowledgeStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.mapper = new ObjectMapper();
    }

    public int ingestFaqs(List<FaqEntry> entries) throws IOException {
        int indexed = 0;
        for (FaqEntry entry : entries) {
            if (entry.question().isBlank() || entry.answer().isBlank()) {
                LOG.warn("Skipping FAQ {} without question or answer", entry.id());
                continue;
            }
            String sourceId = FAQ_PREFIX + entry.id();
            store.index(sourceId, List.of(new KnowledgeChunk(sourceId, sourceId, entry.question(), entry.answer(), List.of())));
            indexed++;
        }
        LOG.info("Indexed {} FAQ entries", indexed);
        return indexed;
    }

    public int ingestFaqFile(Path file) throws IOException {
        List<FaqEntry> entries = mapper.readValue(Files.readString(file), new TypeReference<List<FaqEntry>>() {
        });
        return ingestFaqs(entries);
    }

    /**
     * Indexes plain text under {@code doc:<documentId>}, replacing any earlier version.
     *
     * @return number of chunks written
     */
    public int ingestDocument(String documentId, String title, String text) throws IOException {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("documentId must not be blank");
        }
        String sourceId = DOCUMENT_PREFIX + documentId.trim();
        List<String> parts = chunk(text);
        List<KnowledgeChunk> chunks = new ArrayList<>(parts.size());
        for (int i = 0; i < parts.size(); i++) {
            chunks.add(new KnowledgeChunk(sourceId, sourceId + "#" + i, title, parts.get(i), List.of()));
        }
        store.index(sourceId, chunks);
        LOG.info("Indexed document {} as {} chunks", sourceId, chunks.size());
        return chunks.size();
    }

    public int ingestDocumentFile(Path file) throws IOException {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return ingestDocument(stem, stem.replace('_', ' ').replace('-', ' '), Files.readString(file));
    }

    /**
     * Splits on blank lines and packs paragraphs up to {@link #MAX_CHUNK_CHARS}. Oversized paragraphs are cut
     * at word boundaries.
     */
    static List<String> chunk(String text) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        StringBuilder current = new StringBuilder();
        for (String paragraph : text.trim().split("\\R\\s*\\R")) {
            String normalized = paragraph.trim().replaceAll("\\s+", " ");
            if (normalized.isEmpty()) {
                continue;
            }
            if (current.length() > 0 && current.length() + 2 + normalized.length() > MAX_CHUNK_CHARS) {
                out.add(current.toString());
                current.setLength(0);
            }
            while (normalized.length() > MAX_CHUNK_CHARS) {
                int cut = normalized.lastIndexOf(' ', MAX_CHUNK_CHARS);
                if (cut <= 0) {
                    cut = MAX_CHUNK_CHARS;
                }
                if (current.length() > 0) {
                    out.add(current.toString());
                    current.setLength(0);
                }
                out.add(normalized.substring(0, cut).trim());
                normalized = normalized.substring(cut).trim();
            }
            if (current.length() > 0) {
                current.append("\n\n");
            }
            current.append(normalized);
        }
        if (current.length() > 0) {
            out.add(current.toString());
        }
        return out;
    }
}
