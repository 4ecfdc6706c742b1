package com.purchasingpower.recall.exception;

/**
 * Base class for all knowledge engine failures.
 *
 * @since 1.0.0
 */
public abstract class KnowledgeGraphException extends RuntimeException {

    protected KnowledgeGraphException(String message) {
        super(message);
    }

    protected KnowledgeGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
