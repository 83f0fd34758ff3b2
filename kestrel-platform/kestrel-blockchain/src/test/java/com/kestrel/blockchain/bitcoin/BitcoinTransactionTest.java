package com.kestrel.blockchain.bitcoin;

import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.params.MainNetParams;
import org.junit.jupiter.api.Test;

import java.util.HexFormat;

import static org.assertj.core.api.Assertions.*;

class BitcoinTransactionTest {

    private static final String PREV_TXID = "0437cd7f8525ceed2324359c2d0ba26006d92d856a9c20fa0241106ee5a597c9";
    private static final byte[] SCRIPT = BitcoinScripts.p2pkh(new byte[20]);

    @Test
    void serializesLegacyLayout() {
        BitcoinTransaction tx = new BitcoinTransaction();
        tx.addInput(PREV_TXID, 1);
        tx.addOutput(1_000, SCRIPT);

        String hex = tx.toHex();

        String reversedPrev = HexFormat.of().formatHex(Sha256Hash.wrap(PREV_TXID).getReversedBytes());
        assertThat(hex).startsWith("02000000" + "01" + reversedPrev + "01000000" + "00" + "ffffffff");
        assertThat(hex).endsWith("00000000");
        assertThat(hex).contains("e803000000000000" + "19" + "76a914");
    }

    @Test
    void bitcoinjParsesTheSameTransaction() {
        BitcoinTransaction tx = new BitcoinTransaction();
        tx.addInput(PREV_TXID, 3);
        tx.addOutput(25_000, SCRIPT);
        tx.addOutput(7_500, SCRIPT);

        Transaction parsed = new Transaction(MainNetParams.get(), tx.serialize());

        assertThat(parsed.getVersion()).isEqualTo(2);
        assertThat(parsed.getLockTime()).isZero();
        assertThat(parsed.getInputs()).hasSize(1);
        assertThat(parsed.getInput(0).getOutpoint().getHash().toString()).isEqualTo(PREV_TXID);
        assertThat(parsed.getInput(0).getOutpoint().getIndex()).isEqualTo(3);
        assertThat(parsed.getInput(0).getSequenceNumber()).isEqualTo(BitcoinTransaction.SEQUENCE_FINAL);
        assertThat(parsed.getOutput(0).getValue().value).isEqualTo(25_000);
        assertThat(parsed.getOutput(1).getValue().value).isEqualTo(7_500);
        assertThat(parsed.getTxId().toString()).isEqualTo(tx.txid());
    }

    @Test
    void signatureHashMatchesBitcoinj() {
        BitcoinTransaction tx = new BitcoinTransaction();
        tx.addInput(PREV_TXID, 0);
        tx.addInput(PREV_TXID, 1);
        tx.addOutput(10_000, SCRIPT);

        Transaction parsed = new Transaction(MainNetParams.get(), tx.serialize());

        for (int i = 0; i < 2; i++) {
            Sha256Hash expected = parsed.hashForSignature(i, SCRIPT, Transaction.SigHash.ALL, false);
            assertThat(tx.signatureHash(i, SCRIPT, BitcoinScripts.SIGHASH_ALL)).isEqualTo(expected);
        }
    }

    @Test
    void preimageBlanksOtherInputsAndAppendsSighashType() {
        BitcoinTransaction tx = new BitcoinTransaction();
        tx.addInput(PREV_TXID, 0).setScriptSig(new byte[] {1, 2, 3});
        tx.addOutput(10_000, SCRIPT);

        byte[] preimage = tx.signaturePreimage(0, SCRIPT, BitcoinScripts.SIGHASH_ALL);

        String hex = HexFormat.of().formatHex(preimage);
        assertThat(hex).endsWith("00000000" + "01000000");
        assertThat(hex).doesNotContain("03010203");
        assertThatThrownBy(() -> tx.signaturePreimage(1, SCRIPT, BitcoinScripts.SIGHASH_ALL))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsMalformedInputsAndOutputs() {
        BitcoinTransaction tx = new BitcoinTransaction();

        assertThatThrownBy(() -> tx.addInput("abcd", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tx.addOutput(0, SCRIPT)).isInstanceOf(IllegalArgumentException.class);
    }
}
