package com.kestrel.blockchain.ethereum;

import java.math.BigInteger;
import java.util.concurrent.CompletableFuture;

/**
 * JSON-RPC calls the signer needs from one Ethereum-family node.
 */
public interface EthereumRpc {

    /**
     * Account nonce including pending transactions.
     */
    CompletableFuture<BigInteger> getTransactionCount(String address);

    CompletableFuture<BigInteger> getGasPrice();

    CompletableFuture<BigInteger> getBalance(String address);

    /**
     * Broadcasts a signed, RLP-encoded transaction and returns its hash.
     */
    CompletableFuture<String> sendRawTransaction(String signedTransactionHex);
}
