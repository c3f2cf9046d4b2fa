package com.artifactintegrity.dto;

import org.bouncycastle.util.encoders.Hex;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Lowercase hex SHA-256 digest of an artifact's full byte stream.
 */
public final class ArtifactDigest {

    private final String hex;

    private ArtifactDigest(String hex) {
        this.hex = hex;
    }

    /**
     * Wrap an existing hex digest, e.g. one read back from a sidecar.
     *
     * @throws com.artifactintegrity.exception.SignatureFormatException if not 64 hex characters
     */
    public static ArtifactDigest of(String hex) {
        return new ArtifactDigest(HexValues.requireSha256Hex(hex, "Artifact digest"));
    }

    public static ArtifactDigest fromBytes(byte[] digestBytes) {
        return of(Hex.toHexString(digestBytes));
    }

    public String getHex() {
        return hex;
    }

    /**
     * The message fed to the tag engine under the digest-then-MAC profile:
     * the UTF-8 bytes of the hex text, not the raw 32 digest bytes.
     */
    public byte[] toMessageBytes() {
        return hex.getBytes(StandardCharsets.UTF_8);
    }

    public byte[] toBytes() {
        return Hex.decode(hex);
    }

    /**
     * First 16 hex characters, for log lines.
     */
    public String preview() {
        return hex.substring(0, 16) + "...";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return hex.equals(((ArtifactDigest) o).hex);
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
