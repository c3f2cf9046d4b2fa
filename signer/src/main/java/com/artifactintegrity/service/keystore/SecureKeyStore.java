package com.artifactintegrity.service.keystore;

import com.artifactintegrity.dto.KeyMaterial;

/**
 * Custody of signing keys by a hardware-backed or OS-provided key store.
 *
 * No implementation ships with this module: deployments that hold keys in an HSM or
 * platform keystore register a bean of this type, and {@code KeySource.keyStoreAlias(..)}
 * then resolves through it.
 */
public interface SecureKeyStore {

    /**
     * Return the key stored under {@code alias}, creating it if the store supports that.
     *
     * @throws com.artifactintegrity.exception.KeyUnavailableException if the key cannot be provided
     */
    KeyMaterial getOrCreateKey(String alias);
}
