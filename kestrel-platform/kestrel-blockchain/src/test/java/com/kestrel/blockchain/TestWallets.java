package com.kestrel.blockchain;

import com.kestrel.vault.crypto.EncryptedEnvelope;
import com.kestrel.vault.crypto.EnvelopeCrypto;
import com.kestrel.vault.crypto.PasswordVerifier;
import com.kestrel.vault.crypto.RootKek;
import com.kestrel.vault.crypto.WalletIdentity;
import com.kestrel.vault.record.WalletRecord;
import com.kestrel.vault.secret.SecretBuffer;
import com.kestrel.vault.security.PasswordPolicy;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.List;
import java.util.UUID;

/**
 * Wallet fixtures sealed under a throwaway KEK.
 */
public final class TestWallets {

    public static final String PASSWORD = "Str0ng!Pass";

    private TestWallets() {}

    public static EnvelopeCrypto envelopeCrypto() {
        SecureRandom random = new SecureRandom();
        byte[] kek = new byte[32];
        random.nextBytes(kek);
        return new EnvelopeCrypto(RootKek.of(kek, false), PasswordPolicy.defaults(),
                new PasswordVerifier(1_000, random), random);
    }

    /**
     * Envelope crypto that hands every decrypted key buffer to {@code issued} as well as the caller.
     */
    public static EnvelopeCrypto trackingEnvelopeCrypto(List<SecretBuffer> issued) {
        SecureRandom random = new SecureRandom();
        byte[] kek = new byte[32];
        random.nextBytes(kek);
        return new EnvelopeCrypto(RootKek.of(kek, false), PasswordPolicy.defaults(),
                new PasswordVerifier(1_000, random), random) {
            @Override
            public SecretBuffer decryptMasterKey(WalletRecord record, String password) {
                SecretBuffer key = super.decryptMasterKey(record, password);
                issued.add(key);
                return key;
            }
        };
    }

    /**
     * True while any tracked key buffer is still unwiped.
     */
    public static boolean anyLive(List<SecretBuffer> issued) {
        return issued.stream().anyMatch(key -> !key.isDestroyed());
    }

    public static byte[] keyOf(long value) {
        byte[] raw = BigInteger.valueOf(value).toByteArray();
        byte[] key = new byte[32];
        System.arraycopy(raw, 0, key, 32 - raw.length, raw.length);
        return key;
    }

    public static WalletRecord record(EnvelopeCrypto crypto, String name, byte[] key) {
        WalletIdentity identity = new WalletIdentity(UUID.randomUUID(), name);
        EncryptedEnvelope envelope;
        try (SecretBuffer masterKey = SecretBuffer.copyOf(key)) {
            envelope = crypto.encryptMasterKey(masterKey, identity, false);
        }
        return WalletRecord.create(identity.id(), name, false, envelope, crypto.createPasswordVerifier(PASSWORD));
    }
}
