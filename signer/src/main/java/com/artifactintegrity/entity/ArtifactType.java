package com.artifactintegrity.entity;

/**
 * Enum representing the kinds of artifacts that can be signed.
 *
 * Each artifact type carries exactly one signing profile. Signer and verifier
 * look the profile up from the type, so both sides always agree on the message form.
 */
public enum ArtifactType {
    /**
     * Application package, potentially large, tagged over its streamed digest
     */
    PACKAGE(SigningProfile.DIGEST_THEN_MAC),

    /**
     * Structured configuration file, tagged over its raw bytes
     */
    CONFIGURATION(SigningProfile.DIRECT_MAC);

    private final SigningProfile profile;

    ArtifactType(SigningProfile profile) {
        this.profile = profile;
    }

    public SigningProfile getProfile() {
        return profile;
    }

    /**
     * Resolve a type from its command-line name ("package" or "config").
     */
    public static ArtifactType fromCliName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Artifact type is required");
        }
        switch (name.trim().toLowerCase()) {
            case "package":
            case "apk":
                return PACKAGE;
            case "config":
            case "configuration":
                return CONFIGURATION;
            default:
                throw new IllegalArgumentException("Unknown artifact type: " + name);
        }
    }
}
