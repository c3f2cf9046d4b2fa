package com.artifactintegrity.dto;

import com.artifactintegrity.entity.KeyType;
import org.bouncycastle.util.encoders.Hex;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

/**
 * Shared secret used for one signing or verification run.
 *
 * Holds a private copy of the key bytes which is zeroed by {@link #destroy()}.
 * Never serialized; {@link #toString()} and {@link #preview()} expose no key bytes.
 * Instances belong to the invocation that derived them and are not cached or shared
 * between artifacts.
 */
public final class KeyMaterial implements AutoCloseable {

    private final byte[] keyBytes;
    private final KeyType keyType;
    private boolean destroyed;

    public KeyMaterial(byte[] keyBytes, KeyType keyType) {
        if (keyBytes == null || keyBytes.length == 0) {
            throw new IllegalArgumentException("Key material cannot be empty");
        }
        if (keyType == null) {
            throw new IllegalArgumentException("Key type is required");
        }
        this.keyBytes = keyBytes.clone();
        this.keyType = keyType;
    }

    public KeyType getKeyType() {
        return keyType;
    }

    public int length() {
        checkNotDestroyed();
        return keyBytes.length;
    }

    /**
     * Wrap the key for use with {@link javax.crypto.Mac}. {@link SecretKeySpec} keeps its own copy.
     */
    public SecretKey toSecretKey(String algorithm) {
        checkNotDestroyed();
        return new SecretKeySpec(keyBytes, algorithm);
    }

    /**
     * Short fingerprint for diagnostics: the first 8 hex characters of SHA-256(key).
     * Does not reveal any key byte.
     */
    public String preview() {
        checkNotDestroyed();
        try {
            byte[] fingerprint = MessageDigest.getInstance("SHA-256").digest(keyBytes);
            return Hex.toHexString(fingerprint, 0, 4) + "...";
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    /**
     * Zero the key bytes. Further use throws {@link IllegalStateException}.
     */
    public void destroy() {
        Arrays.fill(keyBytes, (byte) 0);
        destroyed = true;
    }

    @Override
    public void close() {
        destroy();
    }

    private void checkNotDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("Key material has been destroyed");
        }
    }

    @Override
    public String toString() {
        return "KeyMaterial{type=" + keyType.getLabel() + ", length=" + keyBytes.length
            + (destroyed ? ", destroyed" : "") + "}";
    }
}
