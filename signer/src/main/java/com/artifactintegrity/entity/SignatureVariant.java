package com.artifactintegrity.entity;

import java.nio.file.Path;

/**
 * Enum representing the persisted forms of an integrity tag
 */
public enum SignatureVariant {
    /**
     * File contains only the lowercase hex tag
     */
    BARE(".sig"),

    /**
     * File contains a JSON record with the tag, digest and signing metadata
     */
    STRUCTURED(".sig.json");

    private final String defaultExtension;

    SignatureVariant(String defaultExtension) {
        this.defaultExtension = defaultExtension;
    }

    public String getDefaultExtension() {
        return defaultExtension;
    }

    /**
     * Infer the variant from a sidecar path: {@code *.json} is structured, anything else bare.
     */
    public static SignatureVariant forPath(Path path) {
        Path fileName = path.getFileName();
        if (fileName != null && fileName.toString().toLowerCase().endsWith(".json")) {
            return STRUCTURED;
        }
        return BARE;
    }
}
