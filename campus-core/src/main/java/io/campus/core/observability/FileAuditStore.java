package io.campus.core.observability;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON Lines audit log. Each event is one appended line; the file is compacted to the newest
 * {@code maxEvents} once it holds twice that many.
 */
public final class FileAuditStore implements AuditStore {
    static final int DEFAULT_MAX_EVENTS = 20_000;

    private final Path path;
    private final int maxEvents;
    private final ObjectMapper mapper;
    private final Object writeLock = new Object();
    private int lineCount = -1;

    public FileAuditStore(Path path) {
        this(path, DEFAULT_MAX_EVENTS);
    }

    public FileAuditStore(Path path, int maxEvents) {
        this.path = path;
        this.maxEvents = Math.max(1, maxEvents);
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public List<AuditEvent> load() throws IOException {
        List<AuditEvent> events = readAll();
        return events.size() <= maxEvents ? events : List.copyOf(events.subList(events.size() - maxEvents, events.size()));
    }

    @Override
    public void append(AuditEvent event) throws IOException {
        byte[] line = (mapper.writeValueAsString(event) + "\n").getBytes(StandardCharsets.UTF_8);
        synchronized (writeLock) {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (lineCount < 0) {
                lineCount = Files.exists(path) ? readAll().size() : 0;
            }
            Files.write(path, line, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            lineCount++;
            if (lineCount > maxEvents * 2) {
                compact();
            }
        }
    }

    private void compact() throws IOException {
        List<AuditEvent> kept = load();
        StringBuilder out = new StringBuilder();
        for (AuditEvent event : kept) {
            out.append(mapper.writeValueAsString(event)).append('\n');
        }
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, out.toString());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        lineCount = kept.size();
    }

    private List<AuditEvent> readAll() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        String raw = Files.readString(path, StandardCharsets.UTF_8);
        // a line without its newline is still being appended
        int complete = raw.lastIndexOf('\n');
        if (complete < 0) {
            return List.of();
        }
        List<AuditEvent> events = new ArrayList<>();
        for (String line : raw.substring(0, complete).split("\n")) {
            if (!line.isBlank()) {
                events.add(mapper.readValue(line, AuditEvent.class));
            }
        }
        return events;
    }
}
