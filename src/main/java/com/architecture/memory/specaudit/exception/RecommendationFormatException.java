package com.architecture.memory.specaudit.exception;

/**
 * The recommendation source answered, but the answer could not be understood.
 */
public class RecommendationFormatException extends RuntimeException {

    public RecommendationFormatException(String message) {
        super(message);
    }

    public RecommendationFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
