package com.purchasingpower.recall.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * An external collaborator (LLM or vector store) did not answer in time or
 * failed outright. Recoverable: callers degrade instead of failing.
 */
@Getter
public class CollaboratorTimeoutException extends KnowledgeGraphException {

    private final String collaborator;
    private final Duration timeout;

    public CollaboratorTimeoutException(String collaborator, Duration timeout) {
        super(collaborator + " did not respond within " + timeout.toMillis() + "ms");
        this.collaborator = collaborator;
        this.timeout = timeout;
    }

    public CollaboratorTimeoutException(String collaborator, Duration timeout, Throwable cause) {
        super(collaborator + " call failed: " + cause.getMessage(), cause);
        this.collaborator = collaborator;
        this.timeout = timeout;
    }
}
