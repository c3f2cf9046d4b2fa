package com.artifactintegrity.dto;

import com.artifactintegrity.exception.SignatureFormatException;

import java.util.Locale;

/**
 * Validation for the 64-character hex strings produced by SHA-256 and HMAC-SHA256.
 */
final class HexValues {

    static final int SHA256_HEX_LENGTH = 64;

    private HexValues() {
    }

    /**
     * Normalize to lowercase and check length and alphabet.
     *
     * @throws SignatureFormatException if the value is null, of the wrong length or not hex
     */
    static String requireSha256Hex(String value, String fieldName) {
        if (value == null) {
            throw new SignatureFormatException(fieldName + " is missing");
        }
        String normalized = value.toLowerCase(Locale.ROOT);
        if (normalized.length() != SHA256_HEX_LENGTH) {
            throw new SignatureFormatException(fieldName + " must be " + SHA256_HEX_LENGTH
                + " hex characters, got " + normalized.length());
        }
        for (int i = 0; i < normalized.length(); i++) {
            char c = normalized.charAt(i);
            boolean hex = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f');
            if (!hex) {
                throw new SignatureFormatException(fieldName + " contains a non-hex character at position " + i);
            }
        }
        return normalized;
    }
}
