package com.kestrel.vault.error;

/**
 * Sequence counter exhausted for an address. Fatal for that address; never retried.
 */
public class NonceOverflowException extends WalletException {

    public NonceOverflowException(String message) {
        super(ErrorKind.NONCE_OVERFLOW, message, false);
    }

    public NonceOverflowException(String message, Throwable cause) {
        super(ErrorKind.NONCE_OVERFLOW, message, false, cause);
    }
}
