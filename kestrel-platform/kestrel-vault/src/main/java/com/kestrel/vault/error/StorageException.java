package com.kestrel.vault.error;

/**
 * Wallet or nonce storage failure. Retryable only when the store reported a transient condition.
 */
public class StorageException extends WalletException {

    public StorageException(String message, boolean retryable, Throwable cause) {
        super(ErrorKind.STORAGE, message, retryable, cause);
    }
}
