package com.artifactintegrity.service;

import com.artifactintegrity.dto.ArtifactDigest;
import com.artifactintegrity.dto.IntegrityTag;
import com.artifactintegrity.dto.KeyMaterial;
import com.artifactintegrity.entity.ArtifactType;
import com.artifactintegrity.entity.SigningProfile;
import com.artifactintegrity.exception.ArtifactIoException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;

/**
 * Service computing HMAC-SHA256 integrity tags.
 *
 * {@link #computeTag(byte[], KeyMaterial)} is profile-agnostic: it authenticates whatever
 * message it is given. {@link #prepareMessage(Path, ArtifactType)} builds that message
 * from an artifact according to the profile fixed by its {@link ArtifactType}:
 * - DIGEST_THEN_MAC: the UTF-8 text of the streamed SHA-256 hex digest
 * - DIRECT_MAC: the raw artifact bytes, read once in full
 */
@Service
public class IntegrityTagService {

    public static final String HMAC_ALGORITHM = "HmacSHA256";

    private final ArtifactDigestService digestService;

    @Autowired
    public IntegrityTagService(ArtifactDigestService digestService) {
        this.digestService = digestService;
    }

    /**
     * HMAC-SHA256(key, message), lowercase hex.
     */
    public IntegrityTag computeTag(byte[] message, KeyMaterial key) {
        if (message == null) {
            throw new IllegalArgumentException("Message is required");
        }
        if (key == null) {
            throw new IllegalArgumentException("Key material is required");
        }
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(key.toSecretKey(HMAC_ALGORITHM));
            return IntegrityTag.fromBytes(mac.doFinal(message));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 not available", e);
        }
    }

    /**
     * Digest-then-MAC over an already computed digest.
     */
    public IntegrityTag computeTag(ArtifactDigest digest, KeyMaterial key) {
        if (digest == null) {
            throw new IllegalArgumentException("Digest is required");
        }
        return computeTag(digest.toMessageBytes(), key);
    }

    /**
     * Build the message that gets tagged for an artifact of the given type.
     *
     * @throws ArtifactIoException if the artifact cannot be read
     */
    public ProfiledMessage prepareMessage(Path artifact, ArtifactType artifactType) {
        if (artifact == null) {
            throw new IllegalArgumentException("Artifact path is required");
        }
        if (artifactType == null) {
            throw new IllegalArgumentException("Artifact type is required");
        }
        SigningProfile profile = artifactType.getProfile();
        switch (profile) {
            case DIGEST_THEN_MAC: {
                ArtifactDigest digest = digestService.digest(artifact);
                return new ProfiledMessage(profile, digest, digest.toMessageBytes());
            }
            case DIRECT_MAC: {
                byte[] raw = readFully(artifact);
                return new ProfiledMessage(profile, digestService.digest(raw), raw);
            }
            default:
                throw new IllegalStateException("Unhandled signing profile: " + profile);
        }
    }

    private byte[] readFully(Path artifact) {
        try {
            return Files.readAllBytes(artifact);
        } catch (NoSuchFileException e) {
            throw new ArtifactIoException("Artifact not found: " + artifact, artifact, e);
        } catch (IOException e) {
            throw new ArtifactIoException("Failed to read artifact " + artifact + ": " + e.getMessage(), artifact, e);
        }
    }

    /**
     * Message prepared for tagging, together with the artifact digest recorded in sidecars.
     */
    public static class ProfiledMessage {
        private final SigningProfile profile;
        private final ArtifactDigest digest;
        private final byte[] message;

        public ProfiledMessage(SigningProfile profile, ArtifactDigest digest, byte[] message) {
            this.profile = profile;
            this.digest = digest;
            this.message = message;
        }

        public SigningProfile getProfile() { return profile; }
        public ArtifactDigest getDigest() { return digest; }
        public byte[] getMessage() { return message; }
    }
}
