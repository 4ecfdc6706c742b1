package com.purchasingpower.recall.exception;

import lombok.Getter;

import java.util.List;

/**
 * A collaborator payload (extraction batch, session synthesis) failed
 * structural validation. Nothing from it is applied.
 */
@Getter
public class CollaboratorMalformedException extends KnowledgeGraphException {

    private final List<String> violations;

    public CollaboratorMalformedException(String message, List<String> violations) {
        super(violations.isEmpty() ? message : message + ": " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public CollaboratorMalformedException(String message, Throwable cause) {
        super(message + ": " + cause.getMessage(), cause);
        this.violations = List.of(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
    }
}
