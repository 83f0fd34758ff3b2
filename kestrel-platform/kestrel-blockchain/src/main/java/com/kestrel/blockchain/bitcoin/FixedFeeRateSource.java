package com.kestrel.blockchain.bitcoin;

public class FixedFeeRateSource implements FeeRateSource {

    public static final long DEFAULT_SAT_PER_BYTE = 10;

    private final long rate;

    public FixedFeeRateSource(long rate) {
        if (rate < 1) {
            throw new IllegalArgumentException("Fee rate must be at least 1 sat/byte");
        }
        this.rate = rate;
    }

    @Override
    public long satoshisPerByte() {
        return rate;
    }
}
