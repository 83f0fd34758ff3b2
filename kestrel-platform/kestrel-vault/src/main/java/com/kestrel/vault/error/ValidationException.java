package com.kestrel.vault.error;

/**
 * Malformed input: address, amount, network tag, threshold, mnemonic shape, password or name.
 * Always raised before any cryptographic or network work starts.
 */
public class ValidationException extends WalletException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message, false);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, false, cause);
    }
}
