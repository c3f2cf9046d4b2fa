package com.artifactintegrity.dto;

import org.bouncycastle.util.encoders.Hex;

import java.util.Objects;

/**
 * Lowercase hex HMAC-SHA256 tag.
 *
 * {@link #equals(Object)} is a plain string comparison meant for tests and collections;
 * verification must go through {@code ArtifactVerificationService}, which compares in constant time.
 */
public final class IntegrityTag {

    private final String hex;

    private IntegrityTag(String hex) {
        this.hex = hex;
    }

    /**
     * @throws com.artifactintegrity.exception.SignatureFormatException if not 64 hex characters
     */
    public static IntegrityTag of(String hex) {
        return new IntegrityTag(HexValues.requireSha256Hex(hex, "Integrity tag"));
    }

    public static IntegrityTag fromBytes(byte[] macBytes) {
        return of(Hex.toHexString(macBytes));
    }

    public String getHex() {
        return hex;
    }

    public byte[] toBytes() {
        return Hex.decode(hex);
    }

    public String preview() {
        return hex.substring(0, 16) + "...";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return hex.equals(((IntegrityTag) o).hex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hex);
    }

    @Override
    public String toString() {
        return hex;
    }
}
