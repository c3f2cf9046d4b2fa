package com.artifactintegrity.service;

import com.artifactintegrity.dto.ArtifactDigest;
import com.artifactintegrity.exception.ArtifactIoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Service for computing SHA-256 digests of artifacts.
 *
 * Artifacts are streamed in fixed-size chunks so memory use stays bounded by the
 * chunk size regardless of artifact size. The resulting digest does not depend on
 * the chunk size.
 */
@Service
public class ArtifactDigestService {

    private static final Logger logger = LoggerFactory.getLogger(ArtifactDigestService.class);

    public static final String HASH_ALGORITHM = "SHA-256";
    public static final int MIN_CHUNK_SIZE = 8 * 1024;
    public static final int MAX_CHUNK_SIZE = 64 * 1024;

    private final int chunkSize;

    @Autowired
    public ArtifactDigestService(@Value("${app.signing.chunk-size:8192}") int chunkSize) {
        if (chunkSize < MIN_CHUNK_SIZE || chunkSize > MAX_CHUNK_SIZE) {
            throw new IllegalArgumentException("Chunk size must be between " + MIN_CHUNK_SIZE
                + " and " + MAX_CHUNK_SIZE + " bytes, got " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * Digest a file on disk.
     *
     * @param artifact Path of the artifact to read to EOF
     * @return lowercase hex SHA-256 of the file contents
     * @throws ArtifactIoException if the file is missing or cannot be fully read
     */
    public ArtifactDigest digest(Path artifact) {
        if (artifact == null) {
            throw new IllegalArgumentException("Artifact path is required");
        }
        try (InputStream in = Files.newInputStream(artifact)) {
            ArtifactDigest digest = digestStream(in);
            logger.debug("Digested {} -> {}", artifact, digest.preview());
            return digest;
        } catch (NoSuchFileException e) {
            throw new ArtifactIoException("Artifact not found: " + artifact, artifact, e);
        } catch (IOException e) {
            throw new ArtifactIoException("Failed to read artifact " + artifact + ": " + e.getMessage(), artifact, e);
        }
    }

    /**
     * Digest an arbitrary byte source. The stream is read to EOF but not closed.
     *
     * @throws ArtifactIoException if the stream fails before EOF
     */
    public ArtifactDigest digest(InputStream source) {
        if (source == null) {
            throw new IllegalArgumentException("Byte source is required");
        }
        try {
            return digestStream(source);
        } catch (IOException e) {
            throw new ArtifactIoException("Failed to read byte source: " + e.getMessage(), null, e);
        }
    }

    /**
     * Digest bytes already in memory.
     */
    public ArtifactDigest digest(byte[] data) {
        if (data == null) {
            throw new IllegalArgumentException("Data is required");
        }
        return ArtifactDigest.fromBytes(newMessageDigest().digest(data));
    }

    private ArtifactDigest digestStream(InputStream in) throws IOException {
        MessageDigest messageDigest = newMessageDigest();
        byte[] buffer = new byte[chunkSize];
        int bytesRead;
        while ((bytesRead = in.read(buffer)) != -1) {
            messageDigest.update(buffer, 0, bytesRead);
        }
        return ArtifactDigest.fromBytes(messageDigest.digest());
    }

    private MessageDigest newMessageDigest() {
        try {
            return MessageDigest.getInstance(HASH_ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
