package com.artifactintegrity.exception;

import java.nio.file.Path;

/**
 * No usable key could be resolved from the requested key source.
 */
public class KeyUnavailableException extends ArtifactIntegrityException {

    public KeyUnavailableException(String message) {
        super(message, null);
    }

    public KeyUnavailableException(String message, Path keyFile) {
        super(message, keyFile);
    }

    public KeyUnavailableException(String message, Path keyFile, Throwable cause) {
        super(message, keyFile, cause);
    }
}
