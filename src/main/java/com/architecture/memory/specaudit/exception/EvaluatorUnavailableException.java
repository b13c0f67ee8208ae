package com.architecture.memory.specaudit.exception;

/**
 * The external recommendation source cannot be reached, timed out, or was aborted.
 */
public class EvaluatorUnavailableException extends RuntimeException {

    public EvaluatorUnavailableException(String message) {
        super(message);
    }

    public EvaluatorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
