package com.kestrel.blockchain.bitcoin;

/**
 * An unspent output owned by the sending address.
 *
 * @param txid  transaction id in display (big-endian hex) order
 * @param vout  output index
 * @param value amount in satoshis
 */
public record Utxo(String txid, int vout, long value) {

    public Utxo {
        if (txid == null || !txid.matches("^[0-9a-fA-F]{64}$")) {
            throw new IllegalArgumentException("UTXO txid must be 64 hex characters");
        }
        if (vout < 0) {
            throw new IllegalArgumentException("UTXO output index cannot be negative");
        }
        if (value <= 0) {
            throw new IllegalArgumentException("UTXO value must be positive");
        }
    }
}
