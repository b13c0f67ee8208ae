package com.architecture.memory.specaudit.exception;

/**
 * The live specification diverged from what a remediation expects. Blocks only the current queue item.
 */
public class ActionConflictException extends RuntimeException {

    public ActionConflictException(String message) {
        super(message);
    }

    public ActionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
