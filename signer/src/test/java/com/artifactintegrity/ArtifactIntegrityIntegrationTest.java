package com.artifactintegrity;

import com.artifactintegrity.cli.SigningCommandRunner;
import com.artifactintegrity.dto.KeySource;
import com.artifactintegrity.dto.SignatureRecord;
import com.artifactintegrity.entity.ArtifactType;
import com.artifactintegrity.entity.SignatureVariant;
import com.artifactintegrity.service.ArtifactDigestService;
import com.artifactintegrity.service.ArtifactSigningService;
import com.artifactintegrity.service.ArtifactVerificationService;
import com.artifactintegrity.service.SignatureArtifactService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the signer wired by Spring.
 * Checks configuration binding and a sign/verify round through the application context.
 */
@SpringBootTest
@ActiveProfiles("test")
class ArtifactIntegrityIntegrationTest {

    @Autowired
    private ArtifactDigestService digestService;

    @Autowired
    private ArtifactSigningService signingService;

    @Autowired
    private ArtifactVerificationService verificationService;

    @Autowired
    private SignatureArtifactService signatureArtifactService;

    @Autowired
    private SigningCommandRunner commandRunner;

    @TempDir
    Path tempDir;

    @Test
    void contextLoadsWithTestConfiguration() {
        assertEquals(16384, digestService.getChunkSize());
        // The runner executed at startup with no arguments
        assertEquals(SigningCommandRunner.EXIT_USAGE, commandRunner.getExitCode());
    }

    @Test
    void signsWithConfiguredDefaultVariantAndVerifies() throws Exception {
        Path apk = Files.writeString(tempDir.resolve("app-release.apk"), "hello world");

        ArtifactSigningService.SigningResult result =
            signingService.sign(apk, ArtifactType.PACKAGE, KeySource.literal("k1"), null, null);

        assertEquals(SignatureVariant.STRUCTURED, result.getVariant());
        assertEquals(tempDir.resolve("app-release.sig.json"), result.getDestination());
        SignatureRecord record = signatureArtifactService.readStructured(result.getDestination());
        assertEquals("6dd3cd92cfd8a2f5a6065204f83b9bc81a2df56674bf230138f5cdc0a560146d", record.getTag());

        assertTrue(verificationService.verifyArtifact(apk, ArtifactType.PACKAGE,
            KeySource.literal("k1"), result.getDestination()).isMatch());
        assertFalse(verificationService.verifyArtifact(apk, ArtifactType.PACKAGE,
            KeySource.literal("k0"), result.getDestination()).isMatch());
    }
}
