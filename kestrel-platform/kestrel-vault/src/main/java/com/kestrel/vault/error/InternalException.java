package com.kestrel.vault.error;

/**
 * Unexpected failure with no more specific kind. The message names the operation only.
 */
public class InternalException extends WalletException {

    public InternalException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL, message, false, cause);
    }
}
