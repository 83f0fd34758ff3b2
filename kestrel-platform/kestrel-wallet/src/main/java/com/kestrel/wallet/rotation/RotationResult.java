package com.kestrel.wallet.rotation;

/**
 * Outcome of one rotation: {@code oldVersion} is now retired, {@code newVersion} is current.
 */
public record RotationResult(String label, int oldVersion, int newVersion, String newKeyId) {

    public RotationResult {
        if (newVersion != oldVersion + 1) {
            throw new IllegalArgumentException("Rotation must advance by exactly one version");
        }
    }
}
