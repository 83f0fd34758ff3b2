package com.kestrel.blockchain.bitcoin;

import com.kestrel.vault.error.InsufficientFundsException;
import com.kestrel.vault.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Greedy largest-first coin selection for legacy P2PKH spends.
 *
 * Size is estimated as {@code 10 + 148 * inputs + 34 * outputs} bytes with two outputs
 * (recipient and change), recomputed after every input added.
 */
public class UtxoSelector {

    private static final Logger log = LoggerFactory.getLogger(UtxoSelector.class);

    public static final long DUST_THRESHOLD = 546;
    static final int BASE_SIZE = 10;
    static final int INPUT_SIZE = 148;
    static final int OUTPUT_SIZE = 34;
    static final int OUTPUT_COUNT = 2;

    public CoinSelection select(List<Utxo> utxos, long target, long feeRate) {
        if (target <= 0) {
            throw new ValidationException("Target amount must be positive");
        }
        if (feeRate < 1) {
            throw new ValidationException("Fee rate must be at least 1 sat/byte");
        }
        if (utxos == null || utxos.isEmpty()) {
            throw new InsufficientFundsException("No spendable outputs", 0, target);
        }

        List<Utxo> sorted = new ArrayList<>(utxos);
        sorted.sort(Comparator.comparingLong(Utxo::value).reversed());

        List<Utxo> selected = new ArrayList<>();
        long total = 0;
        long fee = 0;
        for (Utxo utxo : sorted) {
            selected.add(utxo);
            total = Math.addExact(total, utxo.value());
            fee = Math.multiplyExact(estimateSize(selected.size()), feeRate);
            if (total >= Math.addExact(target, fee)) {
                long change = total - target - fee;
                if (change < DUST_THRESHOLD) {
                    fee += change;
                    change = 0;
                }
                log.debug("Selected {} of {} inputs, total {} fee {} change {}",
                        selected.size(), sorted.size(), total, fee, change);
                return new CoinSelection(selected, total, target, fee, change);
            }
        }
        throw new InsufficientFundsException(
                "Insufficient balance: have " + total + " sat, need " + (target + fee) + " sat",
                total, target + fee);
    }

    public static long estimateSize(int inputCount) {
        return BASE_SIZE + (long) INPUT_SIZE * inputCount + (long) OUTPUT_SIZE * OUTPUT_COUNT;
    }
}
