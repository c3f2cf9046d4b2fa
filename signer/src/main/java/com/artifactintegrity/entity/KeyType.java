package com.artifactintegrity.entity;

/**
 * Enum representing where the key material for a tag came from.
 * The label is what gets written to the {@code key_type} field of a structured sidecar.
 */
public enum KeyType {
    LITERAL("literal"),
    ENVIRONMENT("environment"),
    FILE("file"),
    DEVICE_BOUND_SIMULATION("device-bound-simulation"),
    SOFTWARE("software"),
    HARDWARE_BACKED("hardware-backed");

    private final String label;

    KeyType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
