package com.artifactintegrity.exception;

import java.nio.file.Path;

/**
 * An artifact, key file or sidecar could not be read or written.
 */
public class ArtifactIoException extends ArtifactIntegrityException {

    public ArtifactIoException(String message, Path path, Throwable cause) {
        super(message, path, cause);
    }

    public ArtifactIoException(String message, Path path) {
        super(message, path);
    }
}
