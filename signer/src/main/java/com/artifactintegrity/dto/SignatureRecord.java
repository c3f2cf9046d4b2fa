package com.artifactintegrity.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Structured signature sidecar.
 *
 * JSON field names are fixed for compatibility with existing verifiers:
 * <pre>
 * {
 *   "apk_file": "app-release.apk",
 *   "apk_path": "/builds/app-release.apk",
 *   "apk_hash": "&lt;64 hex&gt;",
 *   "hmac_signature": "&lt;64 hex&gt;",
 *   "key_type": "software",
 *   "timestamp": 1700000000,
 *   "algorithm": "HMAC-SHA256",
 *   "hash_algorithm": "SHA-256",
 *   "version": "1.0.0"
 * }
 * </pre>
 * Fields are kept as strings so that a malformed file can be parsed and then rejected
 * with a precise message by {@code SignatureArtifactService}.
 */
@JsonPropertyOrder({"apk_file", "apk_path", "apk_hash", "hmac_signature", "key_type",
    "timestamp", "algorithm", "hash_algorithm", "version"})
public class SignatureRecord {

    public static final String FORMAT_VERSION = "1.0.0";
    public static final String ALGORITHM = "HMAC-SHA256";
    public static final String HASH_ALGORITHM = "SHA-256";

    private final String artifactName;
    private final String artifactAbsolutePath;
    private final String digest;
    private final String tag;
    private final String keyProfile;
    private final Long createdAtUnixSeconds;
    private final String algorithm;
    private final String hashAlgorithm;
    private final String formatVersion;

    @JsonCreator
    public SignatureRecord(@JsonProperty("apk_file") String artifactName,
                           @JsonProperty("apk_path") String artifactAbsolutePath,
                           @JsonProperty("apk_hash") String digest,
                           @JsonProperty("hmac_signature") String tag,
                           @JsonProperty("key_type") String keyProfile,
                           @JsonProperty("timestamp") Long createdAtUnixSeconds,
                           @JsonProperty("algorithm") String algorithm,
                           @JsonProperty("hash_algorithm") String hashAlgorithm,
                           @JsonProperty("version") String formatVersion) {
        this.artifactName = artifactName;
        this.artifactAbsolutePath = artifactAbsolutePath;
        this.digest = digest;
        this.tag = tag;
        this.keyProfile = keyProfile;
        this.createdAtUnixSeconds = createdAtUnixSeconds;
        this.algorithm = algorithm;
        this.hashAlgorithm = hashAlgorithm;
        this.formatVersion = formatVersion;
    }

    /**
     * Build a current-version record for a freshly computed tag.
     */
    public static SignatureRecord create(String artifactName, String artifactAbsolutePath,
                                         ArtifactDigest digest, IntegrityTag tag,
                                         String keyProfile, long createdAtUnixSeconds) {
        return new SignatureRecord(artifactName, artifactAbsolutePath, digest.getHex(), tag.getHex(),
            keyProfile, createdAtUnixSeconds, ALGORITHM, HASH_ALGORITHM, FORMAT_VERSION);
    }

    @JsonProperty("apk_file")
    public String getArtifactName() { return artifactName; }

    @JsonProperty("apk_path")
    public String getArtifactAbsolutePath() { return artifactAbsolutePath; }

    @JsonProperty("apk_hash")
    public String getDigest() { return digest; }

    @JsonProperty("hmac_signature")
    public String getTag() { return tag; }

    @JsonProperty("key_type")
    public String getKeyProfile() { return keyProfile; }

    @JsonProperty("timestamp")
    public Long getCreatedAtUnixSeconds() { return createdAtUnixSeconds; }

    @JsonProperty("algorithm")
    public String getAlgorithm() { return algorithm; }

    @JsonProperty("hash_algorithm")
    public String getHashAlgorithm() { return hashAlgorithm; }

    @JsonProperty("version")
    public String getFormatVersion() { return formatVersion; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SignatureRecord that = (SignatureRecord) o;
        return Objects.equals(artifactName, that.artifactName)
            && Objects.equals(artifactAbsolutePath, that.artifactAbsolutePath)
            && Objects.equals(digest, that.digest)
            && Objects.equals(tag, that.tag)
            && Objects.equals(keyProfile, that.keyProfile)
            && Objects.equals(createdAtUnixSeconds, that.createdAtUnixSeconds)
            && Objects.equals(algorithm, that.algorithm)
            && Objects.equals(hashAlgorithm, that.hashAlgorithm)
            && Objects.equals(formatVersion, that.formatVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(artifactName, artifactAbsolutePath, digest, tag, keyProfile,
            createdAtUnixSeconds, algorithm, hashAlgorithm, formatVersion);
    }

    @Override
    public String toString() {
        return "SignatureRecord{" +
            "artifactName='" + artifactName + '\'' +
            ", digest='" + digest + '\'' +
            ", tag='" + tag + '\'' +
            ", keyProfile='" + keyProfile + '\'' +
            ", createdAtUnixSeconds=" + createdAtUnixSeconds +
            ", formatVersion='" + formatVersion + '\'' +
            '}';
    }
}
