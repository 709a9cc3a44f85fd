package io.campus.core.retrieval;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * JSON-file knowledge store. Similarity blends a hashed bag-of-words cosine with query term coverage, so
 * scores stay within [0, 1].
 *
 * <p>Queries read an immutable snapshot without locking. Writers serialize among themselves and publish a
 * new snapshot after the file is replaced; a file changed by another process is reloaded on the next read.
 */
public final class FileKnowledgeStore implements KnowledgeStore {
    private static final int EMBEDDING_DIM = 512;
    private static final double COSINE_WEIGHT = 0.7;
    private static final double COVERAGE_WEIGHT = 0.3;

    private final Path path;
    private final ObjectMapper mapper;
    private final Object writeLock = new Object();
    private volatile Snapshot snapshot;

    public FileKnowledgeStore(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.mapper = new ObjectMapper();
    }

    @Override
    public void index(String documentId, List<KnowledgeChunk> chunks) throws IOException {
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("documentId must not be blank");
        }
        synchronized (writeLock) {
            indexLocked(documentId, chunks);
        }
    }

    private void indexLocked(String documentId, List<KnowledgeChunk> chunks) throws IOException {
        List<KnowledgeChunk> entries = new ArrayList<>(entries());
        entries.removeIf(chunk -> chunk.documentId().equals(documentId));
        for (KnowledgeChunk chunk : chunks == null ? List.<KnowledgeChunk>of() : chunks) {
            if (chunk.text().isBlank()) {
                continue;
            }
            entries.add(new KnowledgeChunk(
                documentId,
                chunk.sourceId().isBlank() ? documentId : chunk.sourceId(),
                chunk.title(),
                chunk.text(),
                embed(chunk.title() + " " + chunk.text())
            ));
        }
        save(entries);
    }

    @Override
    public List<RetrievedChunk> query(String text, int k) throws IOException {
        if (text == null || text.isBlank() || k <= 0) {
            return List.of();
        }
        List<KnowledgeChunk> entries = entries();
        if (entries.isEmpty()) {
            return List.of();
        }

        Set<String> terms = new HashSet<>(tokenize(text));
        List<Double> queryEmbedding = embed(text);
        List<RetrievedChunk> scored = new ArrayList<>();
        for (KnowledgeChunk chunk : entries) {
            double score = score(chunk, terms, queryEmbedding);
            if (score > 0) {
                scored.add(new RetrievedChunk(chunk.sourceId(), chunk.title(), chunk.text(), score));
            }
        }
        scored.sort((a, b) -> Double.compare(b.score(), a.score()));
        return List.copyOf(scored.subList(0, Math.min(k, scored.size())));
    }

    @Override
    public boolean remove(String documentId) throws IOException {
        synchronized (writeLock) {
            List<KnowledgeChunk> entries = new ArrayList<>(entries());
            boolean removed = entries.removeIf(chunk -> chunk.documentId().equals(documentId));
            if (removed) {
                save(entries);
            }
            return removed;
        }
    }

    @Override
    public int count() throws IOException {
        return entries().size();
    }

    private List<KnowledgeChunk> entries() throws IOException {
        FileTime modified = lastModified();
        Snapshot current = snapshot;
        if (current != null && Objects.equals(current.modified(), modified)) {
            return current.chunks();
        }
        synchronized (writeLock) {
            modified = lastModified();
            current = snapshot;
            if (current == null || !Objects.equals(current.modified(), modified)) {
                current = new Snapshot(List.copyOf(load()), modified);
                snapshot = current;
            }
            return current.chunks();
        }
    }

    private FileTime lastModified() throws IOException {
        return Files.exists(path) ? Files.getLastModifiedTime(path) : null;
    }

    private List<KnowledgeChunk> load() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        String raw = Files.readString(path);
        if (raw.isBlank()) {
            return List.of();
        }
        return mapper.readValue(raw, new TypeReference<List<KnowledgeChunk>>() {
        });
    }

    private void save(List<KnowledgeChunk> entries) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(entries);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        snapshot = new Snapshot(List.copyOf(entries), lastModified());
    }

    private double score(KnowledgeChunk chunk, Set<String> terms, List<Double> queryEmbedding) {
        if (terms.isEmpty()) {
            return 0;
        }
        Set<String> chunkTerms = new HashSet<>(tokenize(chunk.title() + " " + chunk.text()));
        int hits = 0;
        for (String term : terms) {
            if (chunkTerms.contains(term)) {
                hits++;
            }
        }
        double coverage = (double) hits / terms.size();
        List<Double> embedding = chunk.embedding().isEmpty() ? embed(chunk.title() + " " + chunk.text()) : chunk.embedding();
        double value = COSINE_WEIGHT * cosine(queryEmbedding, embedding) + COVERAGE_WEIGHT * coverage;
        return Math.min(1.0, Math.max(0.0, value));
    }

    static List<String> tokenize(String text) {
        if (text == null) {
            return List.of();
        }
        String[] raw = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+");
        List<String> out = new ArrayList<>();
        for (String token : raw) {
            if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                out.add(stem(token));
            }
        }
        return out;
    }

    // plural folding only; "hours" and "hour" should meet
    private static String stem(String token) {
        if (token.length() > 3 && token.endsWith("s") && !token.endsWith("ss")) {
            return token.substring(0, token.length() - 1);
        }
        return token;
    }

    private List<Double> embed(String content) {
        double[] vector = new double[EMBEDDING_DIM];
        for (String token : tokenize(content)) {
            vector[Math.floorMod(token.hashCode(), EMBEDDING_DIM)] += 1.0;
        }
        double norm = 0.0;
        for (double value : vector) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);

        List<Double> embedding = new ArrayList<>(EMBEDDING_DIM);
        for (double value : vector) {
            embedding.add(norm == 0.0 ? 0.0 : value / norm);
        }
        return embedding;
    }

    private double cosine(List<Double> a, List<Double> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        int dim = Math.min(a.size(), b.size());
        double dot = 0.0;
        for (int i = 0; i < dim; i++) {
            dot += a.get(i) * b.get(i);
        }
        return Math.max(0.0, dot);
    }

    private record Snapshot(List<KnowledgeChunk> chunks, FileTime modified) {
    }

    private static final Set<String> STOP_WORDS = Set.of(
        "a", "an", "the", "and", "or", "is", "are", "was", "were", "to", "of", "in", "for", "on", "with",
        "at", "by", "from", "it", "this", "that", "these", "those", "be", "been", "as", "if", "but",
        "what", "when", "where", "how", "do", "does", "can", "my", "me", "you", "your", "we", "our", "they"
    );
}
