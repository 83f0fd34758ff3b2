package com.kestrel.wallet.rotation;

import java.util.List;
import java.util.Optional;

/**
 * Storage for labelled key versions and the label's current-version pointer.
 *
 * Implementations apply {@link #rotate} as a single unit: the new version, the retirement of the
 * old one and the pointer move become visible together or not at all.
 */
public interface KeyRotationStore {

    /**
     * Creates version 1 if the label is absent.
     *
     * @return true when the label was created by this call
     */
    boolean register(String label, String keyId);

    /**
     * @return empty when the label does not exist
     */
    Optional<RotationResult> rotate(String label, String newKeyId);

    Optional<KeyVersionView> current(String label);

    Optional<KeyVersionView> version(String label, int version);

    List<KeyVersionView> versions(String label);

    /**
     * Adds one use to the version if it exists and is not retired.
     */
    boolean incrementUsage(String label, int version);

    void purge(String label);
}
