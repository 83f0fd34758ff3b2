package com.kestrel.vault.secret;

import java.security.SecureRandom;
import java.util.Arrays;

/**
 * Owns a plaintext secret and overwrites it with zeros on {@link #close()}.
 *
 * Master keys, data-encryption keys, KEK copies and private keys are held in a SecretBuffer
 * inside try-with-resources so that every exit path releases the plaintext.
 * Not thread-safe: a buffer belongs to exactly one call stack.
 */
public final class SecretBuffer implements AutoCloseable {

    private final byte[] bytes;
    private boolean destroyed;

    private SecretBuffer(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Wraps the given array without copying. The caller gives up ownership.
     */
    public static SecretBuffer wrap(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("Secret bytes cannot be null");
        }
        return new SecretBuffer(bytes);
    }

    /**
     * Copies the given array. The caller keeps ownership of (and responsibility for) the source.
     */
    public static SecretBuffer copyOf(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("Secret bytes cannot be null");
        }
        return new SecretBuffer(Arrays.copyOf(bytes, bytes.length));
    }

    public static SecretBuffer allocate(int length) {
        if (length < 0) {
            throw new IllegalArgumentException("Length cannot be negative");
        }
        return new SecretBuffer(new byte[length]);
    }

    public static SecretBuffer random(int length, SecureRandom random) {
        if (random == null) {
            throw new IllegalArgumentException("SecureRandom cannot be null");
        }
        SecretBuffer buffer = allocate(length);
        random.nextBytes(buffer.bytes);
        return buffer;
    }

    /**
     * Direct view of the secret. The returned array is zeroed when this buffer closes.
     */
    public byte[] bytes() {
        ensureAlive();
        return bytes;
    }

    /**
     * Returns a fresh copy; the caller must wipe it.
     */
    public byte[] copy() {
        ensureAlive();
        return Arrays.copyOf(bytes, bytes.length);
    }

    public int length() {
        ensureAlive();
        return bytes.length;
    }

    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public void close() {
        if (!destroyed) {
            Arrays.fill(bytes, (byte) 0);
            destroyed = true;
        }
    }

    /**
     * Overwrites a loose secret array with zeros. Null-safe.
     */
    public static void wipe(byte[] secret) {
        if (secret != null) {
            Arrays.fill(secret, (byte) 0);
        }
    }

    @Override
    public String toString() {
        return destroyed ? "SecretBuffer[destroyed]" : "SecretBuffer[" + bytes.length + " bytes]";
    }

    private void ensureAlive() {
        if (destroyed) {
            throw new IllegalStateException("Secret buffer has been destroyed");
        }
    }
}
