package com.artifactintegrity.entity;

/**
 * Enum representing which bytes are fed into the keyed integrity tag
 */
public enum SigningProfile {
    /**
     * Tag is computed over the UTF-8 text of the artifact's SHA-256 hex digest
     */
    DIGEST_THEN_MAC,

    /**
     * Tag is computed over the raw bytes of the artifact
     */
    DIRECT_MAC
}
