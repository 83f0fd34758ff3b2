package com.kestrel.vault.error;

/**
 * Classification of failures that cross the wallet boundary.
 */
public enum ErrorKind {
    NOT_FOUND,
    VALIDATION,
    CRYPTO,
    NETWORK,
    INSUFFICIENT_FUNDS,
    NONCE_OVERFLOW,
    STORAGE,
    INTERNAL
}
