package com.artifactintegrity.service;

import com.artifactintegrity.dto.ArtifactDigest;
import com.artifactintegrity.dto.IntegrityTag;
import com.artifactintegrity.dto.KeyMaterial;
import com.artifactintegrity.dto.KeySource;
import com.artifactintegrity.entity.ArtifactType;
import com.artifactintegrity.entity.SignatureVariant;
import com.artifactintegrity.entity.VerificationOutcome;
import org.bouncycastle.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Service for verifying artifacts against stored integrity tags.
 *
 * The tag is recomputed with the signing profile fixed by the artifact type and compared
 * with the stored tag in constant time. A mismatch is reported as
 * {@link VerificationOutcome#TAMPER}; only I/O, key and format problems raise exceptions.
 */
@Service
public class ArtifactVerificationService {

    private static final Logger logger = LoggerFactory.getLogger(ArtifactVerificationService.class);

    private final IntegrityTagService integrityTagService;
    private final KeyMaterialService keyMaterialService;
    private final SignatureArtifactService signatureArtifactService;

    @Autowired
    public ArtifactVerificationService(IntegrityTagService integrityTagService,
                                       KeyMaterialService keyMaterialService,
                                       SignatureArtifactService signatureArtifactService) {
        this.integrityTagService = integrityTagService;
        this.keyMaterialService = keyMaterialService;
        this.signatureArtifactService = signatureArtifactService;
    }

    /**
     * Recompute the tag over {@code message} and compare it with {@code expectedTag}.
     *
     * The message must be built with the same profile that was used when signing.
     *
     * @return MATCH when the tags are equal, TAMPER otherwise
     */
    public VerificationOutcome verify(byte[] message, KeyMaterial key, IntegrityTag expectedTag) {
        if (expectedTag == null) {
            throw new IllegalArgumentException("Expected tag is required");
        }
        IntegrityTag actualTag = integrityTagService.computeTag(message, key);
        return constantTimeEquals(actualTag.toBytes(), expectedTag.toBytes())
            ? VerificationOutcome.MATCH
            : VerificationOutcome.TAMPER;
    }

    /**
     * Verify an artifact file against its sidecar, resolving the key from {@code keySource}.
     * The sidecar variant is detected from its content. The key is destroyed before returning.
     */
    public VerificationResult verifyArtifact(Path artifact, ArtifactType artifactType,
                                             KeySource keySource, Path signatureFile) {
        return verifyArtifact(artifact, artifactType, keySource, signatureFile, null);
    }

    /**
     * Same as {@link #verifyArtifact(Path, ArtifactType, KeySource, Path)} with an explicit
     * sidecar variant; null detects it from the sidecar content.
     */
    public VerificationResult verifyArtifact(Path artifact, ArtifactType artifactType,
                                             KeySource keySource, Path signatureFile,
                                             SignatureVariant variant) {
        try (KeyMaterial key = keyMaterialService.deriveKey(keySource)) {
            return verifyArtifact(artifact, artifactType, key, signatureFile, variant);
        }
    }

    public VerificationResult verifyArtifact(Path artifact, ArtifactType artifactType,
                                             KeyMaterial key, Path signatureFile) {
        return verifyArtifact(artifact, artifactType, key, signatureFile, null);
    }

    /**
     * Verify an artifact file against its sidecar. For structured sidecars the stored digest
     * must also match the recomputed digest.
     *
     * @param variant Sidecar variant, or null to detect it from the sidecar content
     * @throws com.artifactintegrity.exception.ArtifactIoException if artifact or sidecar cannot be read
     * @throws com.artifactintegrity.exception.SignatureFormatException if the sidecar is malformed
     */
    public VerificationResult verifyArtifact(Path artifact, ArtifactType artifactType,
                                             KeyMaterial key, Path signatureFile,
                                             SignatureVariant variant) {
        if (signatureFile == null) {
            throw new IllegalArgumentException("Signature file is required");
        }
        SignatureArtifactService.StoredSignature stored = variant != null
            ? signatureArtifactService.read(signatureFile, variant)
            : signatureArtifactService.readDetected(signatureFile);

        IntegrityTagService.ProfiledMessage message = integrityTagService.prepareMessage(artifact, artifactType);
        String artifactName = artifact.getFileName() != null ? artifact.getFileName().toString() : artifact.toString();

        if (stored.hasRecord()) {
            ArtifactDigest storedDigest = ArtifactDigest.of(stored.getRecord().getDigest());
            if (!constantTimeEquals(storedDigest.toBytes(), message.getDigest().toBytes())) {
                logger.warn("Digest mismatch for {}: artifact content differs from signed content", artifactName);
                return VerificationResult.tamper(artifactName, message.getDigest(),
                    "Artifact digest does not match the signed digest");
            }
        }

        VerificationOutcome outcome = verify(message.getMessage(), key, stored.getTag());
        if (outcome == VerificationOutcome.MATCH) {
            logger.info("Verified {} ({} profile, digest {})", artifactName, message.getProfile(),
                message.getDigest().preview());
            return VerificationResult.match(artifactName, message.getDigest());
        }
        logger.warn("Integrity tag mismatch for {} ({} profile)", artifactName, message.getProfile());
        return VerificationResult.tamper(artifactName, message.getDigest(),
            "Integrity tag does not match; artifact or key differs from signing time");
    }

    private static boolean constantTimeEquals(byte[] expected, byte[] actual) {
        return expected.length == actual.length && Arrays.constantTimeAreEqual(expected, actual);
    }

    // ==================== Result Classes ====================

    public static class VerificationResult {
        private final VerificationOutcome outcome;
        private final String artifactName;
        private final ArtifactDigest recomputedDigest;
        private final String message;

        private VerificationResult(VerificationOutcome outcome, String artifactName,
                                   ArtifactDigest recomputedDigest, String message) {
            this.outcome = outcome;
            this.artifactName = artifactName;
            this.recomputedDigest = recomputedDigest;
            this.message = message;
        }

        public static VerificationResult match(String artifactName, ArtifactDigest digest) {
            return new VerificationResult(VerificationOutcome.MATCH, artifactName, digest,
                "Signature verification successful");
        }

        public static VerificationResult tamper(String artifactName, ArtifactDigest digest, String message) {
            return new VerificationResult(VerificationOutcome.TAMPER, artifactName, digest, message);
        }

        public VerificationOutcome getOutcome() { return outcome; }
        public String getArtifactName() { return artifactName; }
        public ArtifactDigest getRecomputedDigest() { return recomputedDigest; }
        public String getMessage() { return message; }
        public boolean isMatch() { return outcome == VerificationOutcome.MATCH; }
    }
}
