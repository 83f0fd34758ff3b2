package com.kestrel.blockchain.bitcoin;

@FunctionalInterface
public interface FeeRateSource {

    /** Current fee rate in satoshis per byte. */
    long satoshisPerByte();
}
