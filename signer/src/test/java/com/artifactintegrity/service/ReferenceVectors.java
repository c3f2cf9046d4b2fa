package com.artifactintegrity.service;

import java.nio.charset.StandardCharsets;

/**
 * Known-answer values computed independently with a standard HMAC/SHA-256 implementation.
 */
final class ReferenceVectors {

    static final byte[] HELLO_WORLD = "hello world".getBytes(StandardCharsets.UTF_8);

    static final String HELLO_WORLD_SHA256 =
        "b94d27b9934d3e08a52e52d7da7dabfac484efe37a5380ee9088f7ace2efcde9";

    /** HMAC-SHA256(key "k1", UTF-8 of HELLO_WORLD_SHA256) */
    static final String DIGEST_THEN_MAC_K1 =
        "6dd3cd92cfd8a2f5a6065204f83b9bc81a2df56674bf230138f5cdc0a560146d";

    /** HMAC-SHA256(key "k0", UTF-8 of HELLO_WORLD_SHA256) */
    static final String DIGEST_THEN_MAC_K0 =
        "5ad5a62646a560343334f25de13f3775ce337913e12c4f632a759d6bcada229b";

    /** HMAC-SHA256(key "k1", "hello world") */
    static final String DIRECT_MAC_K1 =
        "aa56fcfbb6994ca294eedce6510881ce28049cd226fa1046e2844ba51492c800";

    static final String EMPTY_SHA256 =
        "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855";

    static final String DEVICE_ID = "test_device_12345";
    static final String PACKAGE_NAME = "com.example.sample";

    /** SHA-256("test_device_12345:com.example.sample:SecurityModule:HMAC") */
    static final String IDENTITY_KEY_HEX =
        "9831061ee55fca872d706a297b46c7c322f22fe51cb5249116ec031486bb1464";

    /** HMAC-SHA256(identity key, "hello world") */
    static final String IDENTITY_DIRECT_MAC =
        "cde4d51a5b8998daf10eaa813392c4249163e09d1b5a0352caac007fab5953b7";

    private ReferenceVectors() {
    }
}
