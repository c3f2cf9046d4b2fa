package com.artifactintegrity.dto;

import com.artifactintegrity.entity.KeyType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KeyMaterial Tests")
class KeyMaterialTest {

    private static final byte[] SECRET = "release-signing-secret".getBytes(StandardCharsets.UTF_8);

    @Test
    @DisplayName("Should reject empty key bytes")
    void shouldRejectEmptyKey() {
        assertThrows(IllegalArgumentException.class, () -> new KeyMaterial(new byte[0], KeyType.LITERAL));
        assertThrows(IllegalArgumentException.class, () -> new KeyMaterial(null, KeyType.LITERAL));
    }

    @Test
    @DisplayName("Should keep its own copy of the key bytes")
    void shouldCopyKeyBytes() {
        byte[] source = SECRET.clone();
        KeyMaterial key = new KeyMaterial(source, KeyType.LITERAL);

        source[0] = 0;

        SecretKey secretKey = key.toSecretKey("HmacSHA256");
        assertArrayEquals(SECRET, secretKey.getEncoded());
        assertEquals(SECRET.length, key.length());
    }

    @Test
    @DisplayName("Should not expose key bytes in toString or preview")
    void shouldNotExposeKeyBytes() {
        KeyMaterial key = new KeyMaterial(SECRET, KeyType.FILE);

        assertThat(key.toString()).doesNotContain("release-signing-secret").contains("file");
        assertThat(key.preview()).hasSize(11).endsWith("...");
        assertThat(key.preview()).doesNotStartWith("72656c65");
    }

    @Test
    @DisplayName("Should refuse use after destroy")
    void shouldRefuseUseAfterDestroy() {
        KeyMaterial key = new KeyMaterial(SECRET, KeyType.ENVIRONMENT);

        key.close();

        assertTrue(key.isDestroyed());
        assertThrows(IllegalStateException.class, () -> key.toSecretKey("HmacSHA256"));
        assertThrows(IllegalStateException.class, key::preview);
        assertThat(key.toString()).contains("destroyed");
    }
}
