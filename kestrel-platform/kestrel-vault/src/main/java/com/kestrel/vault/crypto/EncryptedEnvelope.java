package com.kestrel.vault.crypto;

import java.util.Arrays;
import java.util.Objects;

/**
 * Ciphertext of a master key plus everything needed to decrypt it except the root KEK.
 *
 * @param ciphertext    AEAD output including the 16-byte tag
 * @param salt          32-byte HKDF salt, unique per wallet
 * @param nonce         12-byte AEAD nonce, unique per encryption
 * @param schemaVersion selects the associated-data layout
 * @param kekId         hex prefix of SHA-256(root KEK), may be null for legacy records
 */
public record EncryptedEnvelope(
        byte[] ciphertext,
        byte[] salt,
        byte[] nonce,
        int schemaVersion,
        String kekId
) {

    public EncryptedEnvelope {
        if (ciphertext == null || ciphertext.length == 0) {
            throw new IllegalArgumentException("Ciphertext cannot be null or empty");
        }
        if (salt == null || salt.length == 0) {
            throw new IllegalArgumentException("Salt cannot be null or empty");
        }
        if (nonce == null || nonce.length == 0) {
            throw new IllegalArgumentException("Nonce cannot be null or empty");
        }
        ciphertext = ciphertext.clone();
        salt = salt.clone();
        nonce = nonce.clone();
    }

    @Override
    public byte[] ciphertext() { return ciphertext.clone(); }
    @Override
    public byte[] salt() { return salt.clone(); }
    @Override
    public byte[] nonce() { return nonce.clone(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EncryptedEnvelope other)) return false;
        return schemaVersion == other.schemaVersion
                && Arrays.equals(ciphertext, other.ciphertext)
                && Arrays.equals(salt, other.salt)
                && Arrays.equals(nonce, other.nonce)
                && Objects.equals(kekId, other.kekId);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(schemaVersion, kekId);
        result = 31 * result + Arrays.hashCode(ciphertext);
        result = 31 * result + Arrays.hashCode(salt);
        return 31 * result + Arrays.hashCode(nonce);
    }

    @Override
    public String toString() {
        return "EncryptedEnvelope[schemaVersion=" + schemaVersion + ", kekId=" + kekId
                + ", ciphertext=" + ciphertext.length + " bytes]";
    }
}
