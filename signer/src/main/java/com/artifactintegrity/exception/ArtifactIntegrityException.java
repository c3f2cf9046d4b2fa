package com.artifactintegrity.exception;

import java.nio.file.Path;

/**
 * Base exception for failures that abort a signing or verification run.
 *
 * Carries the artifact, key file or sidecar path involved so callers can report it.
 * Messages never contain key material.
 */
public abstract class ArtifactIntegrityException extends RuntimeException {

    private final Path path;

    protected ArtifactIntegrityException(String message, Path path) {
        super(message);
        this.path = path;
    }

    protected ArtifactIntegrityException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /**
     * @return the path involved in the failure, or null when no file was involved
     */
    public Path getPath() {
        return path;
    }
}
