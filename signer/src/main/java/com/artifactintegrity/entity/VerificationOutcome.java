package com.artifactintegrity.entity;

/**
 * Enum representing the result of comparing a recomputed tag with a stored one
 */
public enum VerificationOutcome {
    /**
     * Recomputed tag equals the stored tag
     */
    MATCH,

    /**
     * Artifact bytes, key or stored tag differ from what was signed
     */
    TAMPER
}
