package com.kestrel.vault.crypto;

import com.kestrel.vault.secret.SecretBuffer;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * PBKDF2-HMAC-SHA256 password verifier, encoded as {@code pbkdf2$<iterations>$<salt b64>$<hash b64>}.
 *
 * Gates decryption only. The derived hash is never used as a key.
 */
public class PasswordVerifier {

    private static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final String PREFIX = "pbkdf2";
    private static final int SALT_LENGTH = 16;
    private static final int HASH_BITS = 256;

    public static final int DEFAULT_ITERATIONS = 100_000;

    private final int iterations;
    private final SecureRandom secureRandom;

    public PasswordVerifier(int iterations, SecureRandom secureRandom) {
        if (iterations < 1) {
            throw new IllegalArgumentException("Iterations must be positive");
        }
        if (secureRandom == null) {
            throw new IllegalArgumentException("SecureRandom cannot be null");
        }
        this.iterations = iterations;
        this.secureRandom = secureRandom;
    }

    public PasswordVerifier() {
        this(DEFAULT_ITERATIONS, new SecureRandom());
    }

    public String create(String password) {
        byte[] salt = new byte[SALT_LENGTH];
        secureRandom.nextBytes(salt);
        byte[] hash = derive(password, salt, iterations);
        try {
            return PREFIX + "$" + iterations + "$"
                    + Base64.getEncoder().encodeToString(salt) + "$"
                    + Base64.getEncoder().encodeToString(hash);
        } finally {
            SecretBuffer.wipe(hash);
        }
    }

    /**
     * Constant-time comparison against an encoded verifier. Malformed verifiers never match.
     */
    public boolean matches(String password, String encoded) {
        if (password == null || encoded == null) {
            return false;
        }
        String[] parts = encoded.split("\\$");
        if (parts.length != 4 || !PREFIX.equals(parts[0])) {
            return false;
        }
        int storedIterations;
        byte[] salt;
        byte[] expected;
        try {
            storedIterations = Integer.parseInt(parts[1]);
            salt = Base64.getDecoder().decode(parts[2]);
            expected = Base64.getDecoder().decode(parts[3]);
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (storedIterations < 1) {
            return false;
        }
        byte[] actual = derive(password, salt, storedIterations);
        try {
            return MessageDigest.isEqual(actual, expected);
        } finally {
            SecretBuffer.wipe(actual);
        }
    }

    public int getIterations() {
        return iterations;
    }

    private static byte[] derive(String password, byte[] salt, int iterations) {
        PBEKeySpec spec = new PBEKeySpec(password.toCharArray(), salt, iterations, HASH_BITS);
        try {
            return SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("PBKDF2 unavailable", e);
        } finally {
            spec.clearPassword();
        }
    }
}
