package com.artifactintegrity.exception;

import java.nio.file.Path;

/**
 * A signature sidecar or tag value is malformed: missing fields, unsupported
 * format version, or hex of the wrong length.
 */
public class SignatureFormatException extends ArtifactIntegrityException {

    public SignatureFormatException(String message) {
        super(message, null);
    }

    public SignatureFormatException(String message, Path sidecar) {
        super(message, sidecar);
    }

    public SignatureFormatException(String message, Path sidecar, Throwable cause) {
        super(message, sidecar, cause);
    }
}
