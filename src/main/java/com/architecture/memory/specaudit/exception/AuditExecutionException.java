package com.architecture.memory.specaudit.exception;

/**
 * Fatal execution problem unrelated to specification content (missing root, unreadable directory, report I/O).
 */
public class AuditExecutionException extends RuntimeException {

    public AuditExecutionException(String message) {
        super(message);
    }

    public AuditExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
