package com.architecture.memory.specaudit.exception;

import lombok.Getter;

import java.nio.file.Path;
import java.util.List;

/**
 * An I/O failure in the middle of a multi-file mutation.
 */
@Getter
public class WriteFailureException extends RuntimeException {

    private final List<Path> completedFiles;
    private final Path failedFile;
    private final int queuePosition;

    public WriteFailureException(String message, List<Path> completedFiles, Path failedFile,
                                 int queuePosition, Throwable cause) {
        super(message, cause);
        this.completedFiles = List.copyOf(completedFiles);
        this.failedFile = failedFile;
        this.queuePosition = queuePosition;
    }

    public WriteFailureException(String message, List<Path> completedFiles, Path failedFile, Throwable cause) {
        this(message, completedFiles, failedFile, -1, cause);
    }

    public WriteFailureException atQueuePosition(int position) {
        return new WriteFailureException(getMessage(), completedFiles, failedFile, position, getCause());
    }
}
