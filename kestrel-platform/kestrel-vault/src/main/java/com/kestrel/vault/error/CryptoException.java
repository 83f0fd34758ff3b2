package com.kestrel.vault.error;

/**
 * Decryption or signing failure.
 *
 * Decryption failures always use {@link #DECRYPTION_FAILED}; a wrong password and a corrupted
 * ciphertext are indistinguishable to the caller.
 */
public class CryptoException extends WalletException {

    public static final String DECRYPTION_FAILED = "Decryption failed";

    public CryptoException(String message) {
        super(ErrorKind.CRYPTO, message, false);
    }

    public CryptoException(String message, Throwable cause) {
        super(ErrorKind.CRYPTO, message, false, cause);
    }

    public static CryptoException decryptionFailed() {
        return new CryptoException(DECRYPTION_FAILED);
    }
}
