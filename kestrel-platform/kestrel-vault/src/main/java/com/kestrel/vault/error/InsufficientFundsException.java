package com.kestrel.vault.error;

public class InsufficientFundsException extends WalletException {

    private final long available;
    private final long required;

    public InsufficientFundsException(String message) {
        this(message, -1, -1);
    }

    public InsufficientFundsException(String message, long available, long required) {
        super(ErrorKind.INSUFFICIENT_FUNDS, message, false);
        this.available = available;
        this.required = required;
    }

    /** Available amount in base units, or -1 when unknown. */
    public long getAvailable() { return available; }
    /** Required amount (target plus fee) in base units, or -1 when unknown. */
    public long getRequired() { return required; }
}
