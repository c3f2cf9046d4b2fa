package com.artifactintegrity.service;

import com.artifactintegrity.dto.ArtifactDigest;
import com.artifactintegrity.dto.IntegrityTag;
import com.artifactintegrity.dto.SignatureRecord;
import com.artifactintegrity.entity.SignatureVariant;
import com.artifactintegrity.exception.ArtifactIoException;
import com.artifactintegrity.exception.SignatureFormatException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Service for writing and reading signature sidecar files.
 *
 * Two variants:
 * - BARE: the 64 lowercase hex characters of the tag, no trailing newline
 * - STRUCTURED: a pretty-printed JSON {@link SignatureRecord} with format version
 *
 * Reading validates the content and raises {@link SignatureFormatException} for
 * missing fields, unsupported versions or hex of the wrong length.
 */
@Service
public class SignatureArtifactService {

    private static final Logger logger = LoggerFactory.getLogger(SignatureArtifactService.class);

    private static final String SUPPORTED_MAJOR_VERSION = "1";

    private final ObjectMapper objectMapper;

    public SignatureArtifactService() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        // Newer minor versions may add fields
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Write a sidecar for {@code record} in the requested variant, replacing any existing file.
     * The bare variant writes only the record's tag.
     */
    public void write(SignatureRecord record, Path destination, SignatureVariant variant) {
        if (record == null) {
            throw new IllegalArgumentException("Signature record is required");
        }
        if (variant == null) {
            throw new IllegalArgumentException("Signature variant is required");
        }
        switch (variant) {
            case BARE:
                writeBare(IntegrityTag.of(record.getTag()), destination);
                break;
            case STRUCTURED:
                writeStructured(record, destination);
                break;
            default:
                throw new IllegalStateException("Unhandled signature variant: " + variant);
        }
    }

    public void writeBare(IntegrityTag tag, Path destination) {
        if (tag == null) {
            throw new IllegalArgumentException("Integrity tag is required");
        }
        writeBytes(tag.getHex().getBytes(StandardCharsets.US_ASCII), destination);
        logger.debug("Wrote bare signature {} to {}", tag.preview(), destination);
    }

    public void writeStructured(SignatureRecord record, Path destination) {
        validateRecord(record, destination);
        writeBytes(toJson(record), destination);
        logger.debug("Wrote structured signature for {} to {}", record.getArtifactName(), destination);
    }

    /**
     * Serialize a record to the JSON sidecar form.
     */
    public byte[] toJson(SignatureRecord record) {
        try {
            return objectMapper.writeValueAsString(record).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize signature record", e);
        }
    }

    /**
     * Read a sidecar of the expected variant.
     *
     * @throws ArtifactIoException if the file cannot be read
     * @throws SignatureFormatException if the content is malformed
     */
    public StoredSignature read(Path source, SignatureVariant expectedVariant) {
        if (expectedVariant == null) {
            throw new IllegalArgumentException("Expected signature variant is required");
        }
        switch (expectedVariant) {
            case BARE:
                return StoredSignature.bare(readBare(source));
            case STRUCTURED:
                SignatureRecord record = readStructured(source);
                return StoredSignature.structured(IntegrityTag.of(record.getTag()), record);
            default:
                throw new IllegalStateException("Unhandled signature variant: " + expectedVariant);
        }
    }

    /**
     * Read a sidecar whose variant is not known in advance. Content starting with
     * {@code '{'} (after leading whitespace) is parsed as a structured record, anything
     * else as a bare tag.
     *
     * @throws ArtifactIoException if the file cannot be read
     * @throws SignatureFormatException if the content is malformed
     */
    public StoredSignature readDetected(Path source) {
        byte[] content = readBytes(source);
        if (detectVariant(content) == SignatureVariant.STRUCTURED) {
            SignatureRecord record = parseStructured(content, source);
            return StoredSignature.structured(IntegrityTag.of(record.getTag()), record);
        }
        return StoredSignature.bare(parseBare(content, source));
    }

    /**
     * Read a bare sidecar. Trailing whitespace is ignored and hex is normalized to lowercase.
     */
    public IntegrityTag readBare(Path source) {
        return parseBare(readBytes(source), source);
    }

    public SignatureRecord readStructured(Path source) {
        return parseStructured(readBytes(source), source);
    }

    /**
     * Default sidecar path next to the artifact: the artifact's extension is replaced by the
     * variant's extension ({@code app.apk -> app.sig}); a name without extension gets it appended.
     */
    public Path defaultDestination(Path artifact, SignatureVariant variant) {
        if (artifact == null || artifact.getFileName() == null) {
            throw new IllegalArgumentException("Artifact path is required");
        }
        String fileName = artifact.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        String baseName = lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
        return artifact.resolveSibling(baseName + variant.getDefaultExtension());
    }

    // ==================== Private Helper Methods ====================

    private static SignatureVariant detectVariant(byte[] content) {
        for (byte b : content) {
            if (b == '{') {
                return SignatureVariant.STRUCTURED;
            }
            if (!Character.isWhitespace(b)) {
                return SignatureVariant.BARE;
            }
        }
        return SignatureVariant.BARE;
    }

    private IntegrityTag parseBare(byte[] raw, Path source) {
        String content = new String(raw, StandardCharsets.US_ASCII).stripTrailing();
        if (content.isEmpty()) {
            throw new SignatureFormatException("Signature file is empty: " + source, source);
        }
        try {
            return IntegrityTag.of(content);
        } catch (SignatureFormatException e) {
            throw new SignatureFormatException("Invalid bare signature in " + source + ": " + e.getMessage(), source, e);
        }
    }

    private SignatureRecord parseStructured(byte[] content, Path source) {
        if (content.length == 0) {
            throw new SignatureFormatException("Signature file is empty: " + source, source);
        }
        SignatureRecord record;
        try {
            record = objectMapper.readValue(content, SignatureRecord.class);
        } catch (IOException e) {
            throw new SignatureFormatException("Signature file is not a valid signature record: " + source, source, e);
        }
        validateRecord(record, source);
        return record;
    }

    private void validateRecord(SignatureRecord record, Path source) {
        if (record == null) {
            throw new SignatureFormatException("Signature record is empty", source);
        }
        requireField(record.getArtifactName(), "apk_file", source);
        requireField(record.getArtifactAbsolutePath(), "apk_path", source);
        requireField(record.getKeyProfile(), "key_type", source);
        requireField(record.getAlgorithm(), "algorithm", source);
        requireField(record.getHashAlgorithm(), "hash_algorithm", source);
        requireField(record.getFormatVersion(), "version", source);
        if (record.getCreatedAtUnixSeconds() == null) {
            throw new SignatureFormatException("Signature record field 'timestamp' is missing", source);
        }

        String major = record.getFormatVersion().split("\\.", 2)[0];
        if (!SUPPORTED_MAJOR_VERSION.equals(major)) {
            throw new SignatureFormatException("Unsupported signature format version "
                + record.getFormatVersion(), source);
        }
        if (!SignatureRecord.ALGORITHM.equals(record.getAlgorithm())) {
            throw new SignatureFormatException("Unsupported signature algorithm " + record.getAlgorithm(), source);
        }
        if (!SignatureRecord.HASH_ALGORITHM.equals(record.getHashAlgorithm())) {
            throw new SignatureFormatException("Unsupported hash algorithm " + record.getHashAlgorithm(), source);
        }

        try {
            ArtifactDigest.of(record.getDigest());
            IntegrityTag.of(record.getTag());
        } catch (SignatureFormatException e) {
            throw new SignatureFormatException("Invalid signature record: " + e.getMessage(), source, e);
        }
    }

    private void requireField(String value, String fieldName, Path source) {
        if (value == null || value.trim().isEmpty()) {
            throw new SignatureFormatException("Signature record field '" + fieldName + "' is missing", source);
        }
    }

    private byte[] readBytes(Path source) {
        if (source == null) {
            throw new IllegalArgumentException("Signature path is required");
        }
        try {
            return Files.readAllBytes(source);
        } catch (NoSuchFileException e) {
            throw new ArtifactIoException("Signature file not found: " + source, source, e);
        } catch (IOException e) {
            throw new ArtifactIoException("Failed to read signature file " + source + ": " + e.getMessage(), source, e);
        }
    }

    private void writeBytes(byte[] content, Path destination) {
        if (destination == null) {
            throw new IllegalArgumentException("Destination path is required");
        }
        try {
            Files.write(destination, content);
        } catch (IOException e) {
            throw new ArtifactIoException("Failed to write signature file " + destination + ": " + e.getMessage(),
                destination, e);
        }
    }

    // ==================== Result Classes ====================

    /**
     * Parsed sidecar: always a tag, plus the full record for the structured variant.
     */
    public static class StoredSignature {
        private final SignatureVariant variant;
        private final IntegrityTag tag;
        private final SignatureRecord record;

        private StoredSignature(SignatureVariant variant, IntegrityTag tag, SignatureRecord record) {
            this.variant = variant;
            this.tag = tag;
            this.record = record;
        }

        public static StoredSignature bare(IntegrityTag tag) {
            return new StoredSignature(SignatureVariant.BARE, tag, null);
        }

        public static StoredSignature structured(IntegrityTag tag, SignatureRecord record) {
            return new StoredSignature(SignatureVariant.STRUCTURED, tag, record);
        }

        public SignatureVariant getVariant() { return variant; }
        public IntegrityTag getTag() { return tag; }
        public SignatureRecord getRecord() { return record; }
        public boolean hasRecord() { return record != null; }
    }
}
