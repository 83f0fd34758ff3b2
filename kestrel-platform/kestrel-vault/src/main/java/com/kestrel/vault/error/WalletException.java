package com.kestrel.vault.error;

import com.kestrel.vault.security.ErrorSanitizer;

/**
 * Base class of every failure raised by the custody engine.
 *
 * Messages are passed through {@link ErrorSanitizer} on construction, so a message can be
 * logged or returned to a caller without leaking key material, mnemonics, tokens or paths.
 */
public class WalletException extends RuntimeException {

    private final ErrorKind kind;
    private final boolean retryable;

    protected WalletException(ErrorKind kind, String message, boolean retryable) {
        super(ErrorSanitizer.sanitize(message));
        this.kind = kind;
        this.retryable = retryable;
    }

    protected WalletException(ErrorKind kind, String message, boolean retryable, Throwable cause) {
        super(ErrorSanitizer.sanitize(message), cause);
        this.kind = kind;
        this.retryable = retryable;
    }

    public ErrorKind getKind() { return kind; }
    public boolean isRetryable() { return retryable; }
}
