package com.artifactintegrity.service;

import com.artifactintegrity.dto.ArtifactDigest;
import com.artifactintegrity.dto.IntegrityTag;
import com.artifactintegrity.dto.KeyMaterial;
import com.artifactintegrity.dto.KeySource;
import com.artifactintegrity.dto.SignatureRecord;
import com.artifactintegrity.entity.ArtifactType;
import com.artifactintegrity.entity.KeyType;
import com.artifactintegrity.entity.SignatureVariant;
import com.artifactintegrity.entity.VerificationOutcome;
import com.artifactintegrity.exception.KeyUnavailableException;
import com.artifactintegrity.exception.SignatureFormatException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.Optional;

import static com.artifactintegrity.service.ReferenceVectors.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ArtifactVerificationService.
 * Tests tag comparison outcomes, profile isolation and sidecar-based verification.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ArtifactVerificationService Tests")
class ArtifactVerificationServiceTest {

    @Mock
    private KeyMaterialService.EnvironmentLookup environmentLookup;

    @TempDir
    Path tempDir;

    private ArtifactVerificationService verificationService;
    private SignatureArtifactService signatureArtifactService;
    private KeyMaterial k1;

    @BeforeEach
    void setUp() {
        IntegrityTagService tagService = new IntegrityTagService(new ArtifactDigestService(8192));
        KeyMaterialService keyMaterialService = new KeyMaterialService(environmentLookup, new SecureRandom(),
            Optional.empty(), "SecurityModule:HMAC");
        signatureArtifactService = new SignatureArtifactService();
        verificationService = new ArtifactVerificationService(tagService, keyMaterialService, signatureArtifactService);
        k1 = new KeyMaterial("k1".getBytes(StandardCharsets.UTF_8), KeyType.LITERAL);
    }

    @AfterEach
    void tearDown() {
        k1.destroy();
    }

    @Nested
    @DisplayName("Message Verification Tests")
    class MessageVerificationTests {

        @Test
        @DisplayName("Should return MATCH for the reference tag")
        void shouldMatchReferenceTag() {
            VerificationOutcome outcome = verificationService.verify(
                HELLO_WORLD, k1, IntegrityTag.of(DIRECT_MAC_K1));

            assertEquals(VerificationOutcome.MATCH, outcome);
        }

        @Test
        @DisplayName("Should return TAMPER when a message byte changes")
        void shouldReportTamperForModifiedMessage() {
            byte[] tampered = HELLO_WORLD.clone();
            tampered[tampered.length - 1] = 'D';

            assertEquals(VerificationOutcome.TAMPER,
                verificationService.verify(tampered, k1, IntegrityTag.of(DIRECT_MAC_K1)));
        }

        @Test
        @DisplayName("Should return TAMPER when verified with a different key")
        void shouldReportTamperForWrongKey() {
            KeyMaterial k0 = new KeyMaterial("k0".getBytes(StandardCharsets.UTF_8), KeyType.LITERAL);

            try {
                assertEquals(VerificationOutcome.TAMPER,
                    verificationService.verify(HELLO_WORLD, k0, IntegrityTag.of(DIRECT_MAC_K1)));
            } finally {
                k0.destroy();
            }
        }

        @Test
        @DisplayName("Should not verify a digest-then-MAC tag as a direct-MAC tag over the same bytes")
        void shouldIsolateProfiles() {
            IntegrityTag digestThenMacTag = IntegrityTag.of(DIGEST_THEN_MAC_K1);
            byte[] digestMessage = ArtifactDigest.of(HELLO_WORLD_SHA256).toMessageBytes();

            assertEquals(VerificationOutcome.MATCH, verificationService.verify(digestMessage, k1, digestThenMacTag));
            assertEquals(VerificationOutcome.TAMPER, verificationService.verify(HELLO_WORLD, k1, digestThenMacTag));
        }
    }

    @Nested
    @DisplayName("Sidecar Verification Tests")
    class SidecarVerificationTests {

        private Path writeArtifact(String name, byte[] content) throws Exception {
            return Files.write(tempDir.resolve(name), content);
        }

        @Test
        @DisplayName("Should verify a package against a bare sidecar")
        void shouldVerifyPackageWithBareSidecar() throws Exception {
            Path apk = writeArtifact("app-release.apk", HELLO_WORLD);
            Path sidecar = Files.writeString(tempDir.resolve("app-release.sig"), DIGEST_THEN_MAC_K1);

            ArtifactVerificationService.VerificationResult result =
                verificationService.verifyArtifact(apk, ArtifactType.PACKAGE, k1, sidecar);

            assertTrue(result.isMatch());
            assertEquals("app-release.apk", result.getArtifactName());
            assertEquals(HELLO_WORLD_SHA256, result.getRecomputedDigest().getHex());
        }

        @Test
        @DisplayName("Should report TAMPER when a config's sidecar is checked as a package")
        void shouldReportTamperForProfileMismatch() throws Exception {
            Path config = writeArtifact("security_config.json", HELLO_WORLD);
            Path sidecar = Files.writeString(tempDir.resolve("security_config.sig"), DIRECT_MAC_K1);

            assertTrue(verificationService.verifyArtifact(config, ArtifactType.CONFIGURATION, k1, sidecar).isMatch());
            assertEquals(VerificationOutcome.TAMPER,
                verificationService.verifyArtifact(config, ArtifactType.PACKAGE, k1, sidecar).getOutcome());
        }

        @Test
        @DisplayName("Should report TAMPER when the structured digest no longer matches the artifact")
        void shouldReportTamperForDigestMismatch() throws Exception {
            Path apk = writeArtifact("app-release.apk", "hello world!".getBytes(StandardCharsets.UTF_8));
            SignatureRecord record = SignatureRecord.create("app-release.apk", apk.toString(),
                ArtifactDigest.of(HELLO_WORLD_SHA256), IntegrityTag.of(DIGEST_THEN_MAC_K1), "literal", 1L);
            Path sidecar = tempDir.resolve("app-release.json");
            signatureArtifactService.writeStructured(record, sidecar);

            ArtifactVerificationService.VerificationResult result =
                verificationService.verifyArtifact(apk, ArtifactType.PACKAGE, k1, sidecar);

            assertEquals(VerificationOutcome.TAMPER, result.getOutcome());
            assertTrue(result.getMessage().contains("digest"));
        }

        @Test
        @DisplayName("Should detect a structured sidecar stored under a non-JSON name")
        void shouldDetectStructuredSidecarByContent() throws Exception {
            Path apk = writeArtifact("app-release.apk", HELLO_WORLD);
            SignatureRecord record = SignatureRecord.create("app-release.apk", apk.toString(),
                ArtifactDigest.of(HELLO_WORLD_SHA256), IntegrityTag.of(DIGEST_THEN_MAC_K1), "literal", 1L);
            Path sidecar = tempDir.resolve("app-release.sig");
            signatureArtifactService.writeStructured(record, sidecar);

            assertTrue(verificationService.verifyArtifact(apk, ArtifactType.PACKAGE, k1, sidecar).isMatch());
            assertTrue(verificationService.verifyArtifact(apk, ArtifactType.PACKAGE, k1, sidecar,
                SignatureVariant.STRUCTURED).isMatch());
            assertThrows(SignatureFormatException.class, () -> verificationService.verifyArtifact(
                apk, ArtifactType.PACKAGE, k1, sidecar, SignatureVariant.BARE));
        }

        @Test
        @DisplayName("Should resolve the key from its source and verify")
        void shouldVerifyWithKeySource() throws Exception {
            when(environmentLookup.get("CONFIG_HMAC_KEY")).thenReturn("k1");
            Path config = writeArtifact("security_config.json", HELLO_WORLD);
            Path sidecar = Files.writeString(tempDir.resolve("security_config.sig"), DIRECT_MAC_K1 + "\n");

            ArtifactVerificationService.VerificationResult result = verificationService.verifyArtifact(
                config, ArtifactType.CONFIGURATION, KeySource.environmentVariable("CONFIG_HMAC_KEY"), sidecar);

            assertTrue(result.isMatch());
        }

        @Test
        @DisplayName("Should propagate KeyUnavailableException for an empty environment key")
        void shouldPropagateKeyUnavailable() throws Exception {
            when(environmentLookup.get("CONFIG_HMAC_KEY")).thenReturn("");
            Path config = writeArtifact("security_config.json", HELLO_WORLD);
            Path sidecar = Files.writeString(tempDir.resolve("security_config.sig"), DIRECT_MAC_K1);

            assertThrows(KeyUnavailableException.class, () -> verificationService.verifyArtifact(
                config, ArtifactType.CONFIGURATION, KeySource.environmentVariable("CONFIG_HMAC_KEY"), sidecar));
        }

        @Test
        @DisplayName("Should raise SignatureFormatException for a malformed sidecar")
        void shouldFailForMalformedSidecar() throws Exception {
            Path config = writeArtifact("security_config.json", HELLO_WORLD);
            Path sidecar = Files.writeString(tempDir.resolve("security_config.sig"), "not-a-tag");

            SignatureFormatException e = assertThrows(SignatureFormatException.class,
                () -> verificationService.verifyArtifact(config, ArtifactType.CONFIGURATION, k1, sidecar));
            assertEquals(sidecar, e.getPath());
        }
    }
}
