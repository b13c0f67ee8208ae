package com.architecture.memory.specaudit.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * A schema file is malformed or lacks its identity constants. The file is excluded from the graph.
 */
@Getter
public class SchemaParseException extends RuntimeException {

    private final Path file;

    public SchemaParseException(Path file, String message) {
        super(file + ": " + message);
        this.file = file;
    }

    public SchemaParseException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }
}
