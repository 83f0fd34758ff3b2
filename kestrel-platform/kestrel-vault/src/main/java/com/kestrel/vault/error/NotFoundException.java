package com.kestrel.vault.error;

public class NotFoundException extends WalletException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message, false);
    }
}
