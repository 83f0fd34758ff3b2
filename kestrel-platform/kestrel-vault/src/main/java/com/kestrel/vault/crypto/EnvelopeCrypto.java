package com.kestrel.vault.crypto;

import com.kestrel.vault.error.CryptoException;
import com.kestrel.vault.record.WalletRecord;
import com.kestrel.vault.secret.SecretBuffer;
import com.kestrel.vault.security.PasswordPolicy;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.spec.AlgorithmParameterSpec;

/**
 * Envelope encryption of wallet master keys.
 *
 * A per-wallet DEK is derived with HKDF-SHA256(salt, root KEK, schema info) and used once to
 * seal the master key with AES-256-GCM, or ChaCha20-Poly1305 for quantum-safe wallets. The
 * associated data binds the ciphertext to the wallet identity, so an envelope copied onto
 * another wallet does not open.
 *
 * Every decryption failure is reported as the same {@link CryptoException}; callers cannot tell a
 * wrong password from a damaged record.
 */
public class EnvelopeCrypto {

    private static final Logger log = LoggerFactory.getLogger(EnvelopeCrypto.class);

    private static final String AES_ALGORITHM = "AES/GCM/NoPadding";
    private static final String CHACHA_ALGORITHM = "ChaCha20-Poly1305";
    private static final int GCM_TAG_LENGTH = 128;
    private static final int NONCE_LENGTH = 12;
    private static final int SALT_LENGTH = 32;
    private static final int DEK_LENGTH = 32;

    private final RootKek rootKek;
    private final PasswordPolicy passwordPolicy;
    private final PasswordVerifier passwordVerifier;
    private final SecureRandom secureRandom;

    public EnvelopeCrypto(RootKek rootKek, PasswordPolicy passwordPolicy,
                          PasswordVerifier passwordVerifier, SecureRandom secureRandom) {
        if (rootKek == null) {
            throw new IllegalArgumentException("Root KEK cannot be null");
        }
        this.rootKek = rootKek;
        this.passwordPolicy = passwordPolicy != null ? passwordPolicy : PasswordPolicy.defaults();
        this.passwordVerifier = passwordVerifier != null ? passwordVerifier : new PasswordVerifier();
        this.secureRandom = secureRandom != null ? secureRandom : new SecureRandom();
    }

    public EnvelopeCrypto(RootKek rootKek) {
        this(rootKek, PasswordPolicy.defaults(), new PasswordVerifier(), new SecureRandom());
    }

    /**
     * Seals {@code masterKey} under the latest schema with a fresh salt and nonce.
     */
    public EncryptedEnvelope encryptMasterKey(SecretBuffer masterKey, WalletIdentity identity, boolean quantumSafe) {
        return encryptMasterKey(masterKey, identity, quantumSafe, AadSchema.LATEST);
    }

    /**
     * Seals under an explicit schema. Callers outside this package always write {@link AadSchema#LATEST};
     * older schemas are accepted on decryption only.
     */
    EncryptedEnvelope encryptMasterKey(SecretBuffer masterKey, WalletIdentity identity,
                                       boolean quantumSafe, AadSchema schema) {
        if (masterKey == null || identity == null || schema == null) {
            throw new IllegalArgumentException("Master key, identity and schema cannot be null");
        }
        byte[] salt = randomBytes(SALT_LENGTH);
        byte[] nonce = randomBytes(NONCE_LENGTH);
        byte[] aad = schema.aad(identity);

        try (SecretBuffer dek = deriveDek(salt, schema.info(identity))) {
            Cipher cipher = initCipher(Cipher.ENCRYPT_MODE, dek, nonce, quantumSafe);
            cipher.updateAAD(aad);
            byte[] ciphertext = cipher.doFinal(masterKey.bytes());
            return new EncryptedEnvelope(ciphertext, salt, nonce, schema.version(), rootKek.kekId());
        } catch (GeneralSecurityException e) {
            throw new CryptoException("Encryption failed", e);
        }
    }

    /**
     * Checks the password and opens the record's envelope.
     *
     * @throws com.kestrel.vault.error.ValidationException when the password violates the policy
     * @throws CryptoException on verifier mismatch or any decryption failure
     */
    public SecretBuffer decryptMasterKey(WalletRecord record, String password) {
        if (record == null) {
            throw new IllegalArgumentException("Wallet record cannot be null");
        }
        passwordPolicy.validate(password);
        if (record.hasPasswordVerifier() && !passwordVerifier.matches(password, record.passwordVerifier())) {
            log.debug("Password verifier mismatch for wallet {}", record.name());
            throw CryptoException.decryptionFailed();
        }
        return decrypt(record.envelope(), record.identity(), record.quantumSafe());
    }

    /**
     * Opens an envelope under its declared schema, retrying once with the previous schema.
     */
    public SecretBuffer decrypt(EncryptedEnvelope envelope, WalletIdentity identity, boolean quantumSafe) {
        if (envelope == null || identity == null) {
            throw CryptoException.decryptionFailed();
        }
        if (envelope.kekId() != null && !envelope.kekId().equals(rootKek.kekId())) {
            log.warn("Envelope for wallet {} was sealed under a different root KEK", identity.name());
            throw CryptoException.decryptionFailed();
        }
        AadSchema declared = AadSchema.forVersion(envelope.schemaVersion());
        if (declared == null) {
            throw CryptoException.decryptionFailed();
        }

        byte[] plaintext = tryOpen(envelope, identity, quantumSafe, declared);
        if (plaintext == null && declared.previous() != null) {
            log.debug("Retrying wallet {} with schema v{}", identity.name(), declared.previous().version());
            plaintext = tryOpen(envelope, identity, quantumSafe, declared.previous());
        }
        if (plaintext == null) {
            throw CryptoException.decryptionFailed();
        }
        return SecretBuffer.wrap(plaintext);
    }

    /**
     * Re-seals the record's master key under the latest schema with fresh salt and nonce.
     */
    public EncryptedEnvelope reencrypt(WalletRecord record) {
        try (SecretBuffer masterKey = decrypt(record.envelope(), record.identity(), record.quantumSafe())) {
            return encryptMasterKey(masterKey, record.identity(), record.quantumSafe());
        }
    }

    public String createPasswordVerifier(String password) {
        passwordPolicy.validate(password);
        return passwordVerifier.create(password);
    }

    public String kekId() {
        return rootKek.kekId();
    }

    public PasswordPolicy getPasswordPolicy() {
        return passwordPolicy;
    }

    // ==================== Private Helper Methods ====================

    private byte[] tryOpen(EncryptedEnvelope envelope, WalletIdentity identity, boolean quantumSafe, AadSchema schema) {
        try (SecretBuffer dek = deriveDek(envelope.salt(), schema.info(identity))) {
            Cipher cipher = initCipher(Cipher.DECRYPT_MODE, dek, envelope.nonce(), quantumSafe);
            cipher.updateAAD(schema.aad(identity));
            return cipher.doFinal(envelope.ciphertext());
        } catch (GeneralSecurityException e) {
            log.debug("Envelope did not open under schema v{}: {}", schema.version(), e.getClass().getSimpleName());
            return null;
        }
    }

    private SecretBuffer deriveDek(byte[] salt, byte[] info) {
        SecretBuffer dek = SecretBuffer.allocate(DEK_LENGTH);
        try (SecretBuffer kek = rootKek.copy()) {
            HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
            hkdf.init(new HKDFParameters(kek.bytes(), salt, info));
            hkdf.generateBytes(dek.bytes(), 0, DEK_LENGTH);
            return dek;
        } catch (RuntimeException e) {
            dek.close();
            throw e;
        }
    }

    private Cipher initCipher(int mode, SecretBuffer dek, byte[] nonce, boolean quantumSafe)
            throws GeneralSecurityException {
        Cipher cipher;
        SecretKeySpec keySpec;
        AlgorithmParameterSpec params;
        if (quantumSafe) {
            cipher = Cipher.getInstance(CHACHA_ALGORITHM);
            keySpec = new SecretKeySpec(dek.bytes(), "ChaCha20");
            params = new IvParameterSpec(nonce);
        } else {
            cipher = Cipher.getInstance(AES_ALGORITHM);
            keySpec = new SecretKeySpec(dek.bytes(), "AES");
            params = new GCMParameterSpec(GCM_TAG_LENGTH, nonce);
        }
        cipher.init(mode, keySpec, params);
        return cipher;
    }

    private byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        secureRandom.nextBytes(bytes);
        return bytes;
    }
}
