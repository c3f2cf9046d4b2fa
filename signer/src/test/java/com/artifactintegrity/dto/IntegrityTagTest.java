package com.artifactintegrity.dto;

import com.artifactintegrity.exception.SignatureFormatException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IntegrityTag and ArtifactDigest Tests")
class IntegrityTagTest {

    private static final String TAG = "6dd3cd92cfd8a2f5a6065204f83b9bc81a2df56674bf230138f5cdc0a560146d";

    @Test
    @DisplayName("Should normalize uppercase hex")
    void shouldNormalizeUppercase() {
        assertEquals(IntegrityTag.of(TAG), IntegrityTag.of(TAG.toUpperCase()));
        assertEquals(TAG, IntegrityTag.of(TAG.toUpperCase()).getHex());
    }

    @Test
    @DisplayName("Should round trip through raw bytes")
    void shouldConvertBytes() {
        IntegrityTag tag = IntegrityTag.of(TAG);

        assertEquals(32, tag.toBytes().length);
        assertEquals(tag, IntegrityTag.fromBytes(tag.toBytes()));
    }

    @Test
    @DisplayName("Should reject values of the wrong length")
    void shouldRejectWrongLength() {
        SignatureFormatException e = assertThrows(SignatureFormatException.class,
            () -> IntegrityTag.of(TAG.substring(2)));

        assertThat(e.getMessage()).contains("64 hex characters, got 62");
    }

    @Test
    @DisplayName("Should reject non-hex characters")
    void shouldRejectNonHex() {
        String invalid = "g" + TAG.substring(1);

        SignatureFormatException e = assertThrows(SignatureFormatException.class, () -> ArtifactDigest.of(invalid));

        assertThat(e.getMessage()).startsWith("Artifact digest").contains("position 0");
    }

    @Test
    @DisplayName("Should feed the hex text, not raw bytes, as the digest message")
    void shouldUseHexTextAsMessage() {
        ArtifactDigest digest = ArtifactDigest.of(TAG);

        assertEquals(64, digest.toMessageBytes().length);
        assertEquals(32, digest.toBytes().length);
    }
}
