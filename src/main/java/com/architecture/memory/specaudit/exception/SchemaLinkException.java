package com.architecture.memory.specaudit.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * A relationship type references a node type or predicate that the graph does not contain.
 */
@Getter
public class SchemaLinkException extends RuntimeException {

    private final Path file;

    public SchemaLinkException(Path file, String message) {
        super(file + ": " + message);
        this.file = file;
    }

    public SchemaLinkException(Path file, String message, Throwable cause) {
        super(file + ": " + message, cause);
        this.file = file;
    }
}
