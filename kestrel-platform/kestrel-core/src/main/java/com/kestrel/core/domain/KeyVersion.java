package com.kestrel.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One version of a labelled key. Retired versions stay queryable but are never current again.
 */
@Entity
@Table(name = "key_versions")
@IdClass(KeyVersion.KeyVersionId.class)
public class KeyVersion {

    @Id
    @Column(name = "label", length = 128)
    private String label;

    @Id
    @Column(name = "version")
    private int version;

    @NotNull
    @Column(name = "key_id", nullable = false, length = 64)
    private String keyId;

    @Column(name = "retired", nullable = false)
    private boolean retired;

    @Column(name = "usage_count", nullable = false)
    private long usageCount;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected KeyVersion() {}

    public static KeyVersion create(String label, int version, String keyId) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Label cannot be null or blank");
        }
        if (version < 1) {
            throw new IllegalArgumentException("Version must be at least 1");
        }
        if (keyId == null || keyId.isBlank()) {
            throw new IllegalArgumentException("Key ID cannot be null or blank");
        }
        KeyVersion keyVersion = new KeyVersion();
        keyVersion.label = label;
        keyVersion.version = version;
        keyVersion.keyId = keyId;
        keyVersion.retired = false;
        keyVersion.usageCount = 0;
        keyVersion.createdAt = Instant.now();
        return keyVersion;
    }

    public void retire() {
        if (retired) {
            throw new IllegalStateException("Key version already retired: " + label + " v" + version);
        }
        this.retired = true;
    }

    public void recordUsage() {
        if (retired) {
            throw new IllegalStateException("Cannot record usage on retired version: " + label + " v" + version);
        }
        this.usageCount = Math.addExact(usageCount, 1);
    }

    // Getters
    public String getLabel() { return label; }
    public int getVersion() { return version; }
    public String getKeyId() { return keyId; }
    public boolean isRetired() { return retired; }
    public long getUsageCount() { return usageCount; }
    public Instant getCreatedAt() { return createdAt; }

    /**
     * Composite key (label, version).
     */
    public static class KeyVersionId implements Serializable {
        private String label;
        private int version;

        public KeyVersionId() {}

        public KeyVersionId(String label, int version) {
            this.label = label;
            this.version = version;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof KeyVersionId other)) return false;
            return version == other.version && Objects.equals(label, other.label);
        }

        @Override
        public int hashCode() {
            return Objects.hash(label, version);
        }
    }
}
