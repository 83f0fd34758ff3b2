package com.kestrel.blockchain.ethereum;

import com.kestrel.vault.error.NetworkException;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;

import java.math.BigInteger;
import java.util.concurrent.CompletableFuture;

/**
 * {@link EthereumRpc} over a web3j client.
 */
public class Web3jEthereumRpc implements EthereumRpc {

    private final Web3j web3j;

    public Web3jEthereumRpc(Web3j web3j) {
        if (web3j == null) {
            throw new IllegalArgumentException("Web3j client cannot be null");
        }
        this.web3j = web3j;
    }

    @Override
    public CompletableFuture<BigInteger> getTransactionCount(String address) {
        return web3j.ethGetTransactionCount(address, DefaultBlockParameterName.PENDING).sendAsync()
                .thenApply(response -> checked(response, "eth_getTransactionCount").getTransactionCount());
    }

    @Override
    public CompletableFuture<BigInteger> getGasPrice() {
        return web3j.ethGasPrice().sendAsync()
                .thenApply(response -> checked(response, "eth_gasPrice").getGasPrice());
    }

    @Override
    public CompletableFuture<BigInteger> getBalance(String address) {
        return web3j.ethGetBalance(address, DefaultBlockParameterName.LATEST).sendAsync()
                .thenApply(response -> checked(response, "eth_getBalance").getBalance());
    }

    @Override
    public CompletableFuture<String> sendRawTransaction(String signedTransactionHex) {
        return web3j.ethSendRawTransaction(signedTransactionHex).sendAsync()
                .thenApply(response -> checked(response, "eth_sendRawTransaction").getTransactionHash());
    }

    public void shutdown() {
        web3j.shutdown();
    }

    private static <R extends Response<?>> R checked(R response, String method) {
        if (response.hasError()) {
            throw new NetworkException(method + " rejected: " + response.getError().getMessage());
        }
        return response;
    }
}
