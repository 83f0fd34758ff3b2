package com.kestrel.blockchain.bitcoin;

import java.util.List;

/**
 * Inputs chosen for a payment.
 *
 * @param selected inputs, largest first
 * @param total    sum of selected inputs
 * @param fee      fee in satoshis, including any change dropped as dust
 * @param change   change output value, zero when no change output is created
 */
public record CoinSelection(List<Utxo> selected, long total, long target, long fee, long change) {

    public CoinSelection {
        selected = List.copyOf(selected);
    }

    public boolean hasChange() {
        return change > 0;
    }
}
