package com.assistant.relevance.memory;

/**
 * Thrown by a recall backend that cannot complete a search. The engine catches it
 * and falls back to the next backend.
 */
public class RecallBackendException extends RuntimeException {

    public RecallBackendException(String message) {
        super(message);
    }

    public RecallBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
