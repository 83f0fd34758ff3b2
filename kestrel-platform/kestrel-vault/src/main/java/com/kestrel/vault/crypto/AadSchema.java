package com.kestrel.vault.crypto;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Associated-data layouts, one per envelope schema version.
 *
 * v1 binds to the wallet name; v2 binds to a tagged form of the wallet id.
 * New envelopes always use {@link #LATEST}.
 */
public enum AadSchema {

    V1(1, "kestrel-master-key") {
        @Override
        public byte[] aad(WalletIdentity identity) {
            return identity.name().getBytes(StandardCharsets.UTF_8);
        }
    },

    V2(2, "kestrel-master-key-v2") {
        @Override
        public byte[] aad(WalletIdentity identity) {
            byte[] prefix = "KESTREL-AAD-V2".getBytes(StandardCharsets.US_ASCII);
            return ByteBuffer.allocate(prefix.length + 16)
                    .put(prefix)
                    .put(uuidBytes(identity.id()))
                    .array();
        }
    };

    public static final AadSchema LATEST = V2;

    private final int version;
    private final String infoLabel;

    AadSchema(int version, String infoLabel) {
        this.version = version;
        this.infoLabel = infoLabel;
    }

    public abstract byte[] aad(WalletIdentity identity);

    /**
     * HKDF info: the schema label followed by the associated data.
     */
    public byte[] info(WalletIdentity identity) {
        byte[] label = infoLabel.getBytes(StandardCharsets.US_ASCII);
        byte[] aad = aad(identity);
        return ByteBuffer.allocate(label.length + aad.length).put(label).put(aad).array();
    }

    public int version() {
        return version;
    }

    /**
     * @return the schema for {@code version}, or null when unknown
     */
    public static AadSchema forVersion(int version) {
        for (AadSchema schema : values()) {
            if (schema.version == version) {
                return schema;
            }
        }
        return null;
    }

    /**
     * @return the schema immediately before this one, or null for the oldest
     */
    public AadSchema previous() {
        return forVersion(version - 1);
    }

    static byte[] uuidBytes(UUID id) {
        return ByteBuffer.allocate(16)
                .putLong(id.getMostSignificantBits())
                .putLong(id.getLeastSignificantBits())
                .array();
    }
}
