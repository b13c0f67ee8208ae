package com.architecture.memory.specaudit.service.resolution;

import com.architecture.memory.specaudit.exception.WriteFailureException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * All file changes of one remediation, computed before anything touches the disk.
 * Writes are applied first, then deletes.
 */
@Slf4j
@Getter
public class SchemaTransaction {

    private final Map<Path, String> writes = new LinkedHashMap<>();
    private final Set<Path> deletes = new LinkedHashSet<>();

    public SchemaTransaction write(Path file, String content) {
        Path normalized = file.normalize();
        deletes.remove(normalized);
        writes.put(normalized, content);
        return this;
    }

    public SchemaTransaction delete(Path file) {
        Path normalized = file.normalize();
        if (!writes.containsKey(normalized)) {
            deletes.add(normalized);
        }
        return this;
    }

    public boolean isEmpty() {
        return writes.isEmpty() && deletes.isEmpty();
    }

    /**
     * Applies every change in order. On the first failure, reports the files already changed
     * and the file that failed.
     */
    public List<Path> apply(SchemaFileWriter writer) {
        List<Path> completed = new ArrayList<>();
        for (Map.Entry<Path, String> write : writes.entrySet()) {
            try {
                writer.write(write.getKey(), write.getValue());
                completed.add(write.getKey());
            } catch (IOException e) {
                throw new WriteFailureException("Failed to write " + write.getKey() + ": " + e.getMessage(),
                        completed, write.getKey(), e);
            }
        }
        for (Path delete : deletes) {
            try {
                writer.delete(delete);
                completed.add(delete);
            } catch (IOException e) {
                throw new WriteFailureException("Failed to delete " + delete + ": " + e.getMessage(),
                        completed, delete, e);
            }
        }
        log.debug("Applied transaction: {} writes, {} deletes", writes.size(), deletes.size());
        return completed;
    }
}
