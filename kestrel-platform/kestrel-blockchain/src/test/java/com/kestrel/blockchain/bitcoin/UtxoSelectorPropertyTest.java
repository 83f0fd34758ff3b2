package com.kestrel.blockchain.bitcoin;

import com.kestrel.vault.error.InsufficientFundsException;
import com.kestrel.vault.error.ValidationException;
import net.jqwik.api.*;
import net.jqwik.api.constraints.LongRange;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class UtxoSelectorPropertyTest {

    private final UtxoSelector selector = new UtxoSelector();

    // ==================== Worked examples ====================

    @Test
    void largestUtxoAloneCoversTarget() {
        List<Utxo> utxos = List.of(utxo(1, 500_000), utxo(2, 100_000));

        CoinSelection selection = selector.select(utxos, 300_000, 10);

        assertThat(selection.selected()).extracting(Utxo::value).containsExactly(500_000L);
        assertThat(selection.fee()).isEqualTo(2_260);
        assertThat(selection.change()).isEqualTo(197_740).isPositive();
    }

    @Test
    void tinyBalanceIsInsufficient() {
        assertThatThrownBy(() -> selector.select(List.of(utxo(1, 10_000)), 100_000_000, 10))
                .isInstanceOf(InsufficientFundsException.class)
                .satisfies(e -> {
                    InsufficientFundsException ife = (InsufficientFundsException) e;
                    assertThat(ife.getAvailable()).isEqualTo(10_000);
                    assertThat(ife.getRequired()).isGreaterThan(100_000_000);
                });
    }

    @Test
    void emptyUtxoSetIsInsufficient() {
        assertThatThrownBy(() -> selector.select(List.of(), 1_000, 10))
                .isInstanceOf(InsufficientFundsException.class);
    }

    @Test
    void dustChangeIsAddedToFee() {
        // one input: size 226, fee 2260; leaves 500 sat which is below dust
        CoinSelection selection = selector.select(List.of(utxo(1, 102_760)), 100_000, 10);

        assertThat(selection.change()).isZero();
        assertThat(selection.hasChange()).isFalse();
        assertThat(selection.fee()).isEqualTo(2_760);
    }

    @Test
    void feeIsRecomputedForEachAddedInput() {
        List<Utxo> utxos = List.of(utxo(1, 50_000), utxo(2, 50_000), utxo(3, 50_000));

        CoinSelection selection = selector.select(utxos, 100_000, 10);

        // two inputs give 100_000 which cannot pay the 3_740 fee; a third is required
        assertThat(selection.selected()).hasSize(3);
        assertThat(selection.fee()).isEqualTo(UtxoSelector.estimateSize(3) * 10);
    }

    @Test
    void rejectsNonPositiveTargetAndRate() {
        assertThatThrownBy(() -> selector.select(List.of(utxo(1, 1_000)), 0, 10))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> selector.select(List.of(utxo(1, 1_000)), 100, 0))
                .isInstanceOf(ValidationException.class);
    }

    // ==================== Properties ====================

    @Property(tries = 200)
    void selectionBalances(@ForAll("utxoSets") List<Utxo> utxos,
                           @ForAll @LongRange(min = 1_000, max = 2_000_000) long target,
                           @ForAll @LongRange(min = 1, max = 50) long feeRate) {
        try {
            CoinSelection selection = selector.select(utxos, target, feeRate);

            long selectedSum = selection.selected().stream().mapToLong(Utxo::value).sum();
            assertThat(selectedSum).isEqualTo(selection.total());
            assertThat(selection.total()).isEqualTo(target + selection.fee() + selection.change());
            assertThat(selection.fee()).isGreaterThanOrEqualTo(UtxoSelector.estimateSize(selection.selected().size()) * feeRate);
            assertThat(selection.change() == 0 || selection.change() >= UtxoSelector.DUST_THRESHOLD).isTrue();
        } catch (InsufficientFundsException e) {
            long all = utxos.stream().mapToLong(Utxo::value).sum();
            assertThat(all).isLessThan(target + UtxoSelector.estimateSize(utxos.size()) * feeRate);
        }
    }

    @Property(tries = 100)
    void selectedInputsAreTheLargest(@ForAll("utxoSets") List<Utxo> utxos,
                                     @ForAll @LongRange(min = 1_000, max = 500_000) long target) {
        try {
            CoinSelection selection = selector.select(utxos, target, 5);
            long smallestSelected = selection.selected().stream().mapToLong(Utxo::value).min().orElseThrow();
            List<Utxo> unselected = new ArrayList<>(utxos);
            unselected.removeAll(selection.selected());
            assertThat(unselected).allMatch(u -> u.value() <= smallestSelected);
        } catch (InsufficientFundsException e) {
            assertThat(e.isRetryable()).isFalse();
        }
    }

    // ==================== Helpers and providers ====================

    private static Utxo utxo(int seed, long value) {
        return new Utxo(String.format("%064x", seed), 0, value);
    }

    @Provide
    Arbitrary<List<Utxo>> utxoSets() {
        return Arbitraries.longs().between(1_000, 1_000_000).list().ofMinSize(1).ofMaxSize(12)
                .map(values -> {
                    List<Utxo> utxos = new ArrayList<>();
                    for (int i = 0; i < values.size(); i++) {
                        utxos.add(utxo(i + 1, values.get(i)));
                    }
                    return utxos;
                });
    }
}
