package com.purchasingpower.recall.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Snapshot or journal I/O failed. The previously written snapshot stays
 * authoritative.
 */
@Getter
public class PersistenceFailureException extends KnowledgeGraphException {

    private final Path path;

    public PersistenceFailureException(String message, Path path, Throwable cause) {
        super(message + " (" + path + ")", cause);
        this.path = path;
    }
}
