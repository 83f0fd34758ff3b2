package com.kestrel.wallet.rotation;

import com.kestrel.vault.error.NotFoundException;
import com.kestrel.vault.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.List;

/**
 * Versioned key identities per logical label.
 *
 * Exactly one version per label is current and not retired. Rotation adds {@code N + 1}, retires
 * {@code N} and moves the pointer; retired versions stay queryable for checking older signatures
 * and ciphertexts. Usage counts only grow on the current version and only after a successful use.
 */
public class KeyRotationRegistry {

    private static final Logger log = LoggerFactory.getLogger(KeyRotationRegistry.class);
    private static final int KEY_ID_BYTES = 16;

    private final KeyRotationStore store;
    private final SecureRandom secureRandom;

    public KeyRotationRegistry(KeyRotationStore store, SecureRandom secureRandom) {
        if (store == null) {
            throw new IllegalArgumentException("Key rotation store cannot be null");
        }
        this.store = store;
        this.secureRandom = secureRandom != null ? secureRandom : new SecureRandom();
    }

    public KeyRotationRegistry(KeyRotationStore store) {
        this(store, new SecureRandom());
    }

    /**
     * Ensures the label exists, creating version 1 if needed.
     */
    public KeyVersionView register(String label) {
        requireLabel(label);
        if (store.register(label, newKeyId())) {
            log.info("Registered key label {} at version 1", label);
        }
        return current(label);
    }

    public RotationResult rotate(String label) {
        requireLabel(label);
        RotationResult result = store.rotate(label, newKeyId())
                .orElseThrow(() -> new NotFoundException("Key label not found: " + label));
        log.info("Rotated key label {} from v{} to v{}", label, result.oldVersion(), result.newVersion());
        return result;
    }

    /**
     * Counts one successful use of the label's current version.
     */
    public void recordUsage(String label) {
        KeyVersionView current = current(label);
        if (!store.incrementUsage(label, current.version())) {
            log.warn("Usage not recorded for {} v{}; version was rotated concurrently", label, current.version());
        }
    }

    public KeyVersionView current(String label) {
        requireLabel(label);
        return store.current(label)
                .orElseThrow(() -> new NotFoundException("Key label not found: " + label));
    }

    public KeyVersionView version(String label, int version) {
        requireLabel(label);
        return store.version(label, version)
                .orElseThrow(() -> new NotFoundException("Key version not found: " + label + " v" + version));
    }

    public List<KeyVersionView> versions(String label) {
        requireLabel(label);
        return store.versions(label);
    }

    /**
     * True once the current version has been used at least {@code usageThreshold} times.
     */
    public boolean needsRotation(String label, long usageThreshold) {
        if (usageThreshold < 1) {
            throw new ValidationException("Usage threshold must be at least 1");
        }
        return current(label).usageCount() >= usageThreshold;
    }

    public void purge(String label) {
        requireLabel(label);
        store.purge(label);
        log.info("Purged key label {}", label);
    }

    // ==================== Private Helper Methods ====================

    private String newKeyId() {
        byte[] id = new byte[KEY_ID_BYTES];
        secureRandom.nextBytes(id);
        return HexFormat.of().formatHex(id);
    }

    private static void requireLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new ValidationException("Key label cannot be null or blank");
        }
    }
}
