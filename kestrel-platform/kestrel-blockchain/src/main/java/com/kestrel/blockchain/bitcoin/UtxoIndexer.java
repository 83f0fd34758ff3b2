package com.kestrel.blockchain.bitcoin;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * External UTXO index and transaction relay.
 */
public interface UtxoIndexer {

    /**
     * Confirmed unspent outputs of a P2PKH address.
     */
    CompletableFuture<List<Utxo>> confirmedUtxos(String address);

    /**
     * Relays a hex-encoded transaction and returns the txid reported by the relay.
     */
    CompletableFuture<String> broadcast(String rawTransactionHex);
}
