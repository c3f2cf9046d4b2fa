package com.artifactintegrity.service;

import com.artifactintegrity.dto.IntegrityTag;
import com.artifactintegrity.dto.KeyMaterial;
import com.artifactintegrity.dto.KeySource;
import com.artifactintegrity.dto.SignatureRecord;
import com.artifactintegrity.entity.ArtifactType;
import com.artifactintegrity.entity.SignatureVariant;
import com.artifactintegrity.exception.ArtifactIntegrityException;
import com.artifactintegrity.exception.ArtifactIoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Service for signing artifacts and writing their signature sidecars.
 *
 * One call signs one artifact: the key is resolved, the message is built with the
 * profile fixed by the artifact type, the tag is computed and the sidecar written.
 * The key is destroyed before the call returns, also on failure.
 */
@Service
public class ArtifactSigningService {

    private static final Logger logger = LoggerFactory.getLogger(ArtifactSigningService.class);

    private final KeyMaterialService keyMaterialService;
    private final IntegrityTagService integrityTagService;
    private final SignatureArtifactService signatureArtifactService;
    private final Clock clock;
    private final SignatureVariant defaultVariant;

    @Autowired
    public ArtifactSigningService(KeyMaterialService keyMaterialService,
                                  IntegrityTagService integrityTagService,
                                  SignatureArtifactService signatureArtifactService,
                                  Clock clock,
                                  @Value("${app.signing.default-variant:BARE}") SignatureVariant defaultVariant) {
        this.keyMaterialService = keyMaterialService;
        this.integrityTagService = integrityTagService;
        this.signatureArtifactService = signatureArtifactService;
        this.clock = clock;
        this.defaultVariant = defaultVariant;
    }

    /**
     * Sign an artifact and write its sidecar.
     *
     * @param artifact Artifact to sign
     * @param artifactType Type of the artifact, which fixes the signing profile
     * @param keySource Source of the signing key
     * @param destination Sidecar path, or null for the default path next to the artifact
     * @param variant Sidecar variant, or null to infer it from the destination
     *                (or use the configured default when the destination is null too)
     * @return SigningResult describing the written sidecar
     */
    public SigningResult sign(Path artifact, ArtifactType artifactType, KeySource keySource,
                              Path destination, SignatureVariant variant) {
        if (artifact == null) {
            throw new IllegalArgumentException("Artifact path is required");
        }
        if (artifactType == null) {
            throw new IllegalArgumentException("Artifact type is required");
        }

        SignatureVariant resolvedVariant = resolveVariant(destination, variant);
        Path resolvedDestination = resolveDestination(artifact, destination, resolvedVariant);
        if (samePath(artifact, resolvedDestination)) {
            throw new ArtifactIoException("Signature destination " + resolvedDestination
                + " would overwrite the artifact itself", resolvedDestination);
        }
        return signTo(artifact, artifactType, keySource, resolvedDestination, resolvedVariant);
    }

    private SigningResult signTo(Path artifact, ArtifactType artifactType, KeySource keySource,
                                 Path resolvedDestination, SignatureVariant resolvedVariant) {
        try (KeyMaterial key = keyMaterialService.deriveKey(keySource)) {
            IntegrityTagService.ProfiledMessage message = integrityTagService.prepareMessage(artifact, artifactType);
            IntegrityTag tag = integrityTagService.computeTag(message.getMessage(), key);

            SignatureRecord record = SignatureRecord.create(
                artifact.getFileName().toString(),
                artifact.toAbsolutePath().toString(),
                message.getDigest(),
                tag,
                key.getKeyType().getLabel(),
                clock.instant().getEpochSecond());

            signatureArtifactService.write(record, resolvedDestination, resolvedVariant);

            logger.info("Signed {} as {} ({} profile, {} key): tag {} -> {}",
                artifact.getFileName(), artifactType, message.getProfile(), key.getKeyType().getLabel(),
                tag.preview(), resolvedDestination);

            return new SigningResult(artifact, artifactType, record, tag, resolvedDestination, resolvedVariant);
        }
    }

    /**
     * Sign several artifacts of the same type independently. Each artifact gets its own
     * key resolution and default sidecar path; a failure is recorded and the batch continues.
     */
    public BatchSigningResult signBatch(List<Path> artifacts, ArtifactType artifactType,
                                        KeySource keySource, SignatureVariant variant) {
        List<SigningResult> successful = new ArrayList<>();
        List<FailedArtifact> failed = new ArrayList<>();

        SignatureVariant resolvedVariant = resolveVariant(null, variant);
        Set<Path> batchArtifacts = new HashSet<>();
        for (Path artifact : artifacts) {
            batchArtifacts.add(normalize(artifact));
        }
        Set<Path> claimedDestinations = new HashSet<>();

        for (Path artifact : artifacts) {
            try {
                Path destination = resolveDestination(artifact, null, resolvedVariant);
                Path normalized = normalize(destination);
                // Sidecars may not overwrite any artifact of the batch or another artifact's sidecar
                if (batchArtifacts.contains(normalized)) {
                    throw new ArtifactIoException("Signature destination " + destination
                        + " would overwrite an artifact of the batch", destination);
                }
                if (!claimedDestinations.add(normalized)) {
                    throw new ArtifactIoException("Signature destination " + destination
                        + " is already used by another artifact of the batch", destination);
                }
                successful.add(signTo(artifact, artifactType, keySource, destination, resolvedVariant));
            } catch (ArtifactIntegrityException e) {
                logger.error("Failed to sign {}: {}", artifact, e.getMessage());
                failed.add(new FailedArtifact(artifact, e));
            }
        }

        logger.info("Batch signing completed: {} successful, {} failed out of {} total",
            successful.size(), failed.size(), artifacts.size());

        return new BatchSigningResult(successful, failed);
    }

    private SignatureVariant resolveVariant(Path destination, SignatureVariant variant) {
        if (variant != null) {
            return variant;
        }
        return destination != null ? SignatureVariant.forPath(destination) : defaultVariant;
    }

    private Path resolveDestination(Path artifact, Path destination, SignatureVariant variant) {
        return destination != null ? destination : signatureArtifactService.defaultDestination(artifact, variant);
    }

    private static boolean samePath(Path first, Path second) {
        return normalize(first).equals(normalize(second));
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    // ==================== Result Classes ====================

    public static class SigningResult {
        private final Path artifact;
        private final ArtifactType artifactType;
        private final SignatureRecord record;
        private final IntegrityTag tag;
        private final Path destination;
        private final SignatureVariant variant;

        public SigningResult(Path artifact, ArtifactType artifactType, SignatureRecord record,
                             IntegrityTag tag, Path destination, SignatureVariant variant) {
            this.artifact = artifact;
            this.artifactType = artifactType;
            this.record = record;
            this.tag = tag;
            this.destination = destination;
            this.variant = variant;
        }

        public Path getArtifact() { return artifact; }
        public ArtifactType getArtifactType() { return artifactType; }
        public SignatureRecord getRecord() { return record; }
        public IntegrityTag getTag() { return tag; }
        public Path getDestination() { return destination; }
        public SignatureVariant getVariant() { return variant; }
    }

    public static class FailedArtifact {
        private final Path artifact;
        private final ArtifactIntegrityException error;

        public FailedArtifact(Path artifact, ArtifactIntegrityException error) {
            this.artifact = artifact;
            this.error = error;
        }

        public Path getArtifact() { return artifact; }
        public ArtifactIntegrityException getError() { return error; }
    }

    public static class BatchSigningResult {
        private final List<SigningResult> successfulResults;
        private final List<FailedArtifact> failedResults;

        public BatchSigningResult(List<SigningResult> successfulResults, List<FailedArtifact> failedResults) {
            this.successfulResults = Collections.unmodifiableList(successfulResults);
            this.failedResults = Collections.unmodifiableList(failedResults);
        }

        public List<SigningResult> getSuccessfulResults() { return successfulResults; }
        public List<FailedArtifact> getFailedResults() { return failedResults; }
        public int getTotalCount() { return successfulResults.size() + failedResults.size(); }
        public int getSuccessCount() { return successfulResults.size(); }
        public int getFailureCount() { return failedResults.size(); }
    }
}
