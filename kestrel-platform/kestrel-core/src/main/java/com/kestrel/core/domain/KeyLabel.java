package com.kestrel.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;

/**
 * Pointer from a logical key label to its current version.
 */
@Entity
@Table(name = "key_labels")
public class KeyLabel {

    @Id
    @Column(name = "label", length = 128)
    private String label;

    @Column(name = "current_version", nullable = false)
    private int currentVersion;

    @NotNull
    @Column(name = "current_id", nullable = false, length = 64)
    private String currentId;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected KeyLabel() {}

    public static KeyLabel create(String label, int version, String keyId) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Label cannot be null or blank");
        }
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("Key ID cannot be null or blank");
        }
        KeyLabel keyLabel = new KeyLabel();
        keyLabel.label = label;
        keyLabel.currentVersion = version;
        keyLabel.currentId = keyId;
        keyLabel.updatedAt = Instant.now();
        return keyLabel;
    }

    /**
     * Moves the pointer forward. Versions only increase.
     */
    public void advance(int version, String keyId) {
        if (version <= currentVersion) {
            throw new IllegalStateException("Key version must increase: " + currentVersion + " -> " + version);
        }
        this.currentVersion = version;
        this.currentId = keyId;
        this.updatedAt = Instant.now();
    }

    // Getters
    public String getLabel() { return label; }
    public int getCurrentVersion() { return currentVersion; }
    public String getCurrentId() { return currentId; }
    public Instant getUpdatedAt() { return updatedAt; }
}
