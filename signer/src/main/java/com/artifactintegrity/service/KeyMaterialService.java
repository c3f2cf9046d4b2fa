package com.artifactintegrity.service;

import com.artifactintegrity.dto.KeyMaterial;
import com.artifactintegrity.dto.KeySource;
import com.artifactintegrity.entity.KeyType;
import com.artifactintegrity.exception.ArtifactIoException;
import com.artifactintegrity.exception.KeyUnavailableException;
import com.artifactintegrity.service.keystore.SecureKeyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Optional;

/**
 * Service resolving a {@link KeySource} into {@link KeyMaterial}.
 *
 * Supported sources:
 * - Literal string, UTF-8 encoded, used as-is
 * - Environment variable (empty counts as absent)
 * - Key file, trailing whitespace trimmed
 * - Identity-derived simulation of a device-bound key
 * - Freshly generated random key
 * - Alias in an external {@link SecureKeyStore}
 *
 * Every call returns a new {@link KeyMaterial} owned by the caller, who must close it.
 * Nothing is cached.
 */
@Service
public class KeyMaterialService {

    private static final Logger logger = LoggerFactory.getLogger(KeyMaterialService.class);

    public static final int GENERATED_KEY_LENGTH = 32;

    private final EnvironmentLookup environmentLookup;
    private final SecureRandom secureRandom;
    private final Optional<SecureKeyStore> secureKeyStore;
    private final String identityBindingSuffix;

    @Autowired
    public KeyMaterialService(EnvironmentLookup environmentLookup,
                              SecureRandom secureRandom,
                              Optional<SecureKeyStore> secureKeyStore,
                              @Value("${app.signing.identity-binding-suffix:SecurityModule:HMAC}") String identityBindingSuffix) {
        this.environmentLookup = environmentLookup;
        this.secureRandom = secureRandom;
        this.secureKeyStore = secureKeyStore;
        this.identityBindingSuffix = identityBindingSuffix;
    }

    /**
     * Resolve the key for one signing or verification run.
     *
     * @param source The single key source selected by the caller
     * @return new key material; the caller closes it when done
     * @throws KeyUnavailableException if the source yields no usable key
     * @throws ArtifactIoException if a key file exists but cannot be read
     */
    public KeyMaterial deriveKey(KeySource source) {
        if (source == null) {
            throw new KeyUnavailableException("No key source selected");
        }
        KeyMaterial keyMaterial;
        switch (source.getKeyType()) {
            case LITERAL:
                keyMaterial = fromLiteral((KeySource.Literal) source);
                break;
            case ENVIRONMENT:
                keyMaterial = fromEnvironment((KeySource.EnvironmentVariable) source);
                break;
            case FILE:
                keyMaterial = fromFile((KeySource.KeyFile) source);
                break;
            case DEVICE_BOUND_SIMULATION:
                keyMaterial = fromIdentity((KeySource.DerivedFromIdentity) source);
                break;
            case SOFTWARE:
                keyMaterial = generate();
                break;
            case HARDWARE_BACKED:
                keyMaterial = fromKeyStore((KeySource.KeyStoreAlias) source);
                break;
            default:
                throw new KeyUnavailableException("Unsupported key source: " + source.describe());
        }
        logger.debug("Resolved {} (fingerprint {})", source.describe(), keyMaterial.preview());
        return keyMaterial;
    }

    // ==================== Private Helper Methods ====================

    private KeyMaterial fromLiteral(KeySource.Literal source) {
        String value = source.getValue();
        if (value == null || value.isEmpty()) {
            throw new KeyUnavailableException("Literal key is empty");
        }
        return wipeAfterWrap(value.getBytes(StandardCharsets.UTF_8), KeyType.LITERAL);
    }

    private KeyMaterial fromEnvironment(KeySource.EnvironmentVariable source) {
        String name = source.getName();
        if (name == null || name.trim().isEmpty()) {
            throw new KeyUnavailableException("Environment variable name is required");
        }
        String value = environmentLookup.get(name);
        // An empty value must never become a zero-length key
        if (value == null || value.isEmpty()) {
            throw new KeyUnavailableException("Environment variable " + name + " is empty or not set");
        }
        return wipeAfterWrap(value.getBytes(StandardCharsets.UTF_8), KeyType.ENVIRONMENT);
    }

    private KeyMaterial fromFile(KeySource.KeyFile source) {
        Path path = source.getPath();
        if (path == null) {
            throw new KeyUnavailableException("Key file path is required");
        }
        byte[] raw;
        try {
            raw = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new KeyUnavailableException("Key file not found: " + path, path, e);
        } catch (IOException e) {
            throw new ArtifactIoException("Failed to read key file " + path + ": " + e.getMessage(), path, e);
        }
        int end = raw.length;
        while (end > 0 && isWhitespace(raw[end - 1])) {
            end--;
        }
        if (end == 0) {
            Arrays.fill(raw, (byte) 0);
            throw new KeyUnavailableException("Key file is empty: " + path, path);
        }
        byte[] trimmed = Arrays.copyOf(raw, end);
        Arrays.fill(raw, (byte) 0);
        return wipeAfterWrap(trimmed, KeyType.FILE);
    }

    /**
     * Simulated device-bound key. Reproducible by anyone who knows the device id and
     * package name, so it provides no secrecy; use a {@link SecureKeyStore} in production.
     */
    private KeyMaterial fromIdentity(KeySource.DerivedFromIdentity source) {
        String deviceId = source.getDeviceId();
        String packageName = source.getPackageName();
        if (deviceId == null || deviceId.trim().isEmpty()) {
            throw new KeyUnavailableException("Device id is required for an identity-derived key");
        }
        if (packageName == null || packageName.trim().isEmpty()) {
            throw new KeyUnavailableException("Package name is required for an identity-derived key");
        }
        logger.warn("Using simulated identity-bound key for {}; not suitable for production", packageName);
        String binding = deviceId + ":" + packageName + ":" + identityBindingSuffix;
        return wipeAfterWrap(sha256(binding.getBytes(StandardCharsets.UTF_8)), KeyType.DEVICE_BOUND_SIMULATION);
    }

    private KeyMaterial generate() {
        byte[] keyBytes = new byte[GENERATED_KEY_LENGTH];
        secureRandom.nextBytes(keyBytes);
        return wipeAfterWrap(keyBytes, KeyType.SOFTWARE);
    }

    private KeyMaterial fromKeyStore(KeySource.KeyStoreAlias source) {
        String alias = source.getAlias();
        if (alias == null || alias.trim().isEmpty()) {
            throw new KeyUnavailableException("Key store alias is required");
        }
        SecureKeyStore store = secureKeyStore.orElseThrow(() ->
            new KeyUnavailableException("No secure key store is configured for alias " + alias));
        KeyMaterial keyMaterial = store.getOrCreateKey(alias);
        if (keyMaterial == null) {
            throw new KeyUnavailableException("Secure key store returned no key for alias " + alias);
        }
        return keyMaterial;
    }

    private KeyMaterial wipeAfterWrap(byte[] keyBytes, KeyType keyType) {
        try {
            return new KeyMaterial(keyBytes, keyType);
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    private static boolean isWhitespace(byte b) {
        return b == ' ' || b == '\t' || b == '\n' || b == '\r' || b == 0x0b || b == '\f';
    }

    private static byte[] sha256(byte[] data) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Lookup of process environment variables, replaceable in tests.
     */
    @FunctionalInterface
    public interface EnvironmentLookup {
        String get(String name);
    }
}
