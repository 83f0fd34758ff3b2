package com.kestrel.blockchain.bitcoin;

/**
 * A fully signed transaction ready for relay.
 */
public record SignedBitcoinTransaction(
        String from,
        String to,
        String rawTransaction,
        String txid,
        CoinSelection selection
) {}
