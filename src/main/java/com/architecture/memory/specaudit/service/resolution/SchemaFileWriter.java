package com.architecture.memory.specaudit.service.resolution;

import java.io.IOException;
import java.nio.file.Path;

/**
 * File operations used when applying a {@link SchemaTransaction}.
 */
public interface SchemaFileWriter {

    void write(Path file, String content) throws IOException;

    void delete(Path file) throws IOException;
}
