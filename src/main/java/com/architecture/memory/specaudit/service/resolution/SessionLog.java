package com.architecture.memory.specaudit.service.resolution;

import com.architecture.memory.specaudit.dto.resolution.Disposition;
import com.architecture.memory.specaudit.dto.resolution.SessionLogEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * Append-only record of one resolution session, one entry per queue item.
 */
@Slf4j
public class SessionLog {

    private static final DateTimeFormatter FILE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper;
    private final List<SessionLogEntry> entries = new ArrayList<>();

    public SessionLog(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void append(SessionLogEntry entry) {
        entries.add(entry);
        log.info("#{} {} -> {}: {}", entry.getPosition(), entry.getSubject(), entry.getDisposition(), entry.getReasoning());
    }

    public List<SessionLogEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public Map<Disposition, Integer> counts() {
        Map<Disposition, Integer> counts = new EnumMap<>(Disposition.class);
        for (Disposition disposition : Disposition.values()) {
            counts.put(disposition, 0);
        }
        entries.forEach(e -> counts.merge(e.getDisposition(), 1, Integer::sum));
        return counts;
    }

    /**
     * Writes the entries as a JSON array to {@code resolution-session-<stamp>.json}.
     */
    public Path write(Path directory, Instant startedAt) {
        Path file = directory.resolve("resolution-session-" + FILE_STAMP.format(startedAt) + ".json");
        try {
            Files.createDirectories(directory);
            Files.writeString(file, objectMapper.writeValueAsString(entries) + "\n", StandardCharsets.UTF_8);
            log.info("Session log written to {}", file);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write session log " + file, e);
        }
    }
}
