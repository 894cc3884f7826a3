package com.assistant.relevance.router.config;

/**
 * Runtime exception thrown when a persisted router configuration is missing,
 * unreadable or has no valid routes.
 */
public class RouterConfigException extends RuntimeException {

    public RouterConfigException(String message) {
        super(message);
    }

    public RouterConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
