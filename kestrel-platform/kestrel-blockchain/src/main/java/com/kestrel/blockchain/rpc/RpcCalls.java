package com.kestrel.blockchain.rpc;

import com.kestrel.vault.error.NetworkException;
import com.kestrel.vault.error.WalletException;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Waits on network futures with a bounded timeout.
 *
 * Timeouts and transport failures become retryable {@link NetworkException}s; wallet errors
 * raised inside the future pass through unchanged.
 */
public final class RpcCalls {

    private RpcCalls() {}

    public static <T> T await(CompletableFuture<T> future, Duration timeout, String operation) {
        try {
            return future.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof WalletException walletException) {
                throw walletException;
            }
            if (cause instanceof TimeoutException) {
                throw new NetworkException(operation + " timed out after " + timeout.toMillis() + " ms", cause);
            }
            throw new NetworkException(operation + " failed: " + cause.getClass().getSimpleName(), cause);
        }
    }
}
