package com.kestrel.vault.crypto;

import com.kestrel.vault.secret.SecretBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;

/**
 * The 256-bit root key-encryption key.
 *
 * Loaded from an operational secret, never from a user password. Handed out only as
 * short-lived {@link SecretBuffer} copies so callers can wipe them after one derivation.
 */
public final class RootKek {

    private static final Logger log = LoggerFactory.getLogger(RootKek.class);

    public static final int KEK_LENGTH = 32;

    private final byte[] key;
    private final String kekId;

    private RootKek(byte[] key) {
        this.key = key;
        this.kekId = computeKekId(key);
    }

    /**
     * Parses a 64-character hex or base64 encoded KEK.
     *
     * @param encoded  configured value
     * @param testMode permits the all-zero key
     * @throws KekException when missing, malformed, the wrong length, or all-zero outside test mode
     */
    public static RootKek parse(String encoded, boolean testMode) {
        if (encoded == null || encoded.isBlank()) {
            throw new KekException("Root KEK is not configured");
        }
        byte[] decoded = decode(encoded.trim());
        return of(decoded, testMode);
    }

    /**
     * Takes ownership of {@code key}; the caller's array is wiped on every path.
     */
    public static RootKek of(byte[] key, boolean testMode) {
        if (key == null || key.length != KEK_LENGTH) {
            SecretBuffer.wipe(key);
            throw new KekException("Root KEK must be exactly 32 bytes");
        }
        if (isAllZero(key)) {
            if (!testMode) {
                SecretBuffer.wipe(key);
                throw new KekException("All-zero root KEK is only permitted in test mode");
            }
            log.warn("Using an all-zero root KEK; test mode is enabled");
        }
        RootKek kek = new RootKek(Arrays.copyOf(key, key.length));
        SecretBuffer.wipe(key);
        return kek;
    }

    /**
     * A fresh copy of the KEK for one derivation; close it right after use.
     */
    public SecretBuffer copy() {
        return SecretBuffer.copyOf(key);
    }

    public String kekId() {
        return kekId;
    }

    @Override
    public String toString() {
        return "RootKek[kekId=" + kekId + "]";
    }

    private static byte[] decode(String encoded) {
        if (encoded.length() == KEK_LENGTH * 2 && encoded.chars().allMatch(RootKek::isHexDigit)) {
            return HexFormat.of().parseHex(encoded);
        }
        try {
            return Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new KekException("Root KEK must be hex or base64 encoded");
        }
    }

    private static String computeKekId(byte[] key) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(key);
            return HexFormat.of().formatHex(digest, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new KekException("SHA-256 unavailable", e);
        }
    }

    private static boolean isAllZero(byte[] key) {
        int acc = 0;
        for (byte b : key) {
            acc |= b;
        }
        return acc == 0;
    }

    private static boolean isHexDigit(int c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    /**
     * Root KEK configuration error. Raised at startup, never during a wallet operation.
     */
    public static class KekException extends RuntimeException {
        public KekException(String message) {
            super(message);
        }

        public KekException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
