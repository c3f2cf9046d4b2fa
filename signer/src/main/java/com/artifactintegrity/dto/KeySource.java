package com.artifactintegrity.dto;

import com.artifactintegrity.entity.KeyType;

import java.nio.file.Path;

/**
 * Where the key for a signing or verification run comes from.
 *
 * Exactly one source is chosen per run; callers build it through the static factories.
 * The concrete subclass is identified by {@link #getKeyType()}.
 */
public abstract class KeySource {

    private final KeyType keyType;

    private KeySource(KeyType keyType) {
        this.keyType = keyType;
    }

    public KeyType getKeyType() {
        return keyType;
    }

    /**
     * Safe description for logs and error messages; never contains key bytes.
     */
    public abstract String describe();

    @Override
    public String toString() {
        return describe();
    }

    public static KeySource literal(String value) {
        return new Literal(value);
    }

    public static KeySource environmentVariable(String name) {
        return new EnvironmentVariable(name);
    }

    public static KeySource file(Path path) {
        return new KeyFile(path);
    }

    public static KeySource derivedFromIdentity(String deviceId, String packageName) {
        return new DerivedFromIdentity(deviceId, packageName);
    }

    public static KeySource generated() {
        return new Generated();
    }

    public static KeySource keyStoreAlias(String alias) {
        return new KeyStoreAlias(alias);
    }

    /**
     * UTF-8 bytes of the given string, used as-is. The caller owns key strength.
     */
    public static final class Literal extends KeySource {
        private final String value;

        private Literal(String value) {
            super(KeyType.LITERAL);
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        @Override
        public String describe() {
            return "literal key";
        }
    }

    public static final class EnvironmentVariable extends KeySource {
        private final String name;

        private EnvironmentVariable(String name) {
            super(KeyType.ENVIRONMENT);
            this.name = name;
        }

        public String getName() {
            return name;
        }

        @Override
        public String describe() {
            return "environment variable " + name;
        }
    }

    public static final class KeyFile extends KeySource {
        private final Path path;

        private KeyFile(Path path) {
            super(KeyType.FILE);
            this.path = path;
        }

        public Path getPath() {
            return path;
        }

        @Override
        public String describe() {
            return "key file " + path;
        }
    }

    /**
     * Simulated device-bound key: SHA-256 of {@code "<deviceId>:<packageName>:SecurityModule:HMAC"}.
     *
     * <p>NOT production strength. Anyone who knows both identifiers can rebuild the key.
     * Production deployments must use {@link KeyStoreAlias} backed by a hardware keystore.
     */
    public static final class DerivedFromIdentity extends KeySource {
        private final String deviceId;
        private final String packageName;

        private DerivedFromIdentity(String deviceId, String packageName) {
            super(KeyType.DEVICE_BOUND_SIMULATION);
            this.deviceId = deviceId;
            this.packageName = packageName;
        }

        public String getDeviceId() {
            return deviceId;
        }

        public String getPackageName() {
            return packageName;
        }

        @Override
        public String describe() {
            return "identity-derived key for " + packageName;
        }
    }

    /**
     * Fresh random key for this run only.
     */
    public static final class Generated extends KeySource {
        private Generated() {
            super(KeyType.SOFTWARE);
        }

        @Override
        public String describe() {
            return "generated key";
        }
    }

    /**
     * Key held by an external secure key store under the given alias.
     */
    public static final class KeyStoreAlias extends KeySource {
        private final String alias;

        private KeyStoreAlias(String alias) {
            super(KeyType.HARDWARE_BACKED);
            this.alias = alias;
        }

        public String getAlias() {
            return alias;
        }

        @Override
        public String describe() {
            return "key store alias " + alias;
        }
    }
}
