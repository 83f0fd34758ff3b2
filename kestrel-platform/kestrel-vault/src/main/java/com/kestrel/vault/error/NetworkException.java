package com.kestrel.vault.error;

/**
 * RPC, broadcast or indexer failure. Retryable; never leaves wallet state half-written.
 */
public class NetworkException extends WalletException {

    public NetworkException(String message) {
        super(ErrorKind.NETWORK, message, true);
    }

    public NetworkException(String message, Throwable cause) {
        super(ErrorKind.NETWORK, message, true, cause);
    }
}
