package com.kestrel.blockchain.bitcoin;

import com.kestrel.blockchain.TestWallets;
import com.kestrel.blockchain.service.BlockchainConfig;
import com.kestrel.vault.address.AddressDeriver;
import com.kestrel.vault.address.Network;
import com.kestrel.vault.crypto.EnvelopeCrypto;
import com.kestrel.vault.error.CryptoException;
import com.kestrel.vault.error.InsufficientFundsException;
import com.kestrel.vault.error.ValidationException;
import com.kestrel.vault.record.WalletRecord;
import com.kestrel.vault.secret.SecretBuffer;
import org.bitcoinj.core.Transaction;
import org.bitcoinj.params.MainNetParams;
import org.bitcoinj.script.Script;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

class BitcoinSignerTest {

    private static final String SENDER = "1BgGZ9tcN4rm9KBzDn7KprQz87SZ26SAMH";

    private final List<SecretBuffer> issuedKeys = new CopyOnWriteArrayList<>();
    private EnvelopeCrypto crypto;
    private FakeIndexer indexer;
    private BitcoinSigner signer;
    private WalletRecord wallet;
    private String recipient;

    @BeforeEach
    void setUp() {
        crypto = TestWallets.trackingEnvelopeCrypto(issuedKeys);
        indexer = new FakeIndexer(issuedKeys);
        BlockchainConfig config = new BlockchainConfig();
        config.setFeeRateSatPerByte(10);
        signer = new BitcoinSigner(crypto, new AddressDeriver(), indexer, new UtxoSelector(), null, config);
        wallet = TestWallets.record(crypto, "btc-wallet", TestWallets.keyOf(1));
        try (SecretBuffer other = SecretBuffer.wrap(TestWallets.keyOf(2))) {
            recipient = new AddressDeriver().deriveAddress(other, Network.BTC);
        }
    }

    @Test
    void signsEveryInputSoThatBitcoinjAcceptsTheSpend() {
        indexer.utxos = List.of(
                new Utxo(String.format("%064x", 1), 0, 500_000),
                new Utxo(String.format("%064x", 2), 1, 100_000));

        String txid = signer.signAndSendBitcoin(wallet, TestWallets.PASSWORD, recipient, "0.003");

        assertThat(txid).isEqualTo("relayed");
        assertThat(indexer.queriedAddresses).containsExactly(SENDER);
        assertThat(indexer.broadcasts).hasSize(1);

        Transaction tx = new Transaction(MainNetParams.get(), HexFormat.of().parseHex(indexer.broadcasts.get(0)));
        assertThat(tx.getInputs()).hasSize(1);
        assertThat(tx.getOutputs()).hasSize(2);
        assertThat(tx.getOutput(0).getValue().value).isEqualTo(300_000);
        assertThat(tx.getOutput(1).getValue().value).isEqualTo(197_740);

        Script senderScript = new Script(BitcoinScripts.outputScriptFor(SENDER, Network.BTC));
        assertThat(tx.getOutput(1).getScriptPubKey()).isEqualTo(senderScript);
        assertThatCode(() -> tx.getInput(0).getScriptSig()
                .correctlySpends(tx, 0, null, null, senderScript, Script.ALL_VERIFY_FLAGS))
                .doesNotThrowAnyException();
    }

    @Test
    void keyIsWipedBeforeTheIndexerIsQueried() {
        indexer.utxos = List.of(new Utxo(String.format("%064x", 3), 0, 80_000));

        signer.signAndSendBitcoin(wallet, TestWallets.PASSWORD, recipient, "0.0005");

        assertThat(indexer.broadcasts).hasSize(1);
        assertThat(indexer.callsWithLiveKey).isZero();
        assertThat(issuedKeys).isNotEmpty().allMatch(SecretBuffer::isDestroyed);
    }

    @Test
    void senderFromAnotherWalletIsRejectedBeforeBroadcast() {
        indexer.utxos = List.of(new Utxo(String.format("%064x", 4), 0, 80_000));

        assertThatThrownBy(() -> signer.signAndSendBitcoin(wallet, TestWallets.PASSWORD, recipient, SENDER, "0.0005"))
                .isInstanceOf(ValidationException.class);
        assertThat(indexer.broadcasts).isEmpty();
    }

    @Test
    void recipientOutputBelowDustLimitIsRejected() {
        indexer.utxos = List.of(new Utxo(String.format("%064x", 5), 0, 80_000));

        assertThatThrownBy(() -> signer.signAndSendBitcoin(wallet, TestWallets.PASSWORD, recipient, "0.00000545"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("dust");
        assertThat(indexer.queriedAddresses).isEmpty();
        assertThat(BitcoinSigner.validatePayment(recipient, "0.00000546", Network.BTC))
                .isEqualTo(UtxoSelector.DUST_THRESHOLD);

        try (SecretBuffer key = SecretBuffer.wrap(TestWallets.keyOf(1))) {
            assertThatThrownBy(() -> signer.buildSigned(key, indexer.utxos, recipient, 100, 10))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Test
    void multipleInputsAllVerify() {
        List<Utxo> utxos = List.of(
                new Utxo(String.format("%064x", 7), 0, 40_000),
                new Utxo(String.format("%064x", 8), 3, 40_000),
                new Utxo(String.format("%064x", 9), 1, 40_000));

        SignedBitcoinTransaction signed;
        try (SecretBuffer key = SecretBuffer.wrap(TestWallets.keyOf(1))) {
            signed = signer.buildSigned(key, utxos, recipient, 100_000, 10);
        }

        Transaction tx = new Transaction(MainNetParams.get(), HexFormat.of().parseHex(signed.rawTransaction()));
        assertThat(signed.from()).isEqualTo(SENDER);
        assertThat(tx.getTxId().toString()).isEqualTo(signed.txid());
        Script senderScript = new Script(BitcoinScripts.outputScriptFor(SENDER, Network.BTC));
        for (int i = 0; i < tx.getInputs().size(); i++) {
            int index = i;
            assertThatCode(() -> tx.getInput(index).getScriptSig()
                    .correctlySpends(tx, index, null, null, senderScript, Script.ALL_VERIFY_FLAGS))
                    .doesNotThrowAnyException();
        }
    }

    @Test
    void noConfirmedOutputsIsInsufficientFunds() {
        assertThatThrownBy(() -> signer.signAndSendBitcoin(wallet, TestWallets.PASSWORD, recipient, "0.001"))
                .isInstanceOf(InsufficientFundsException.class);
        assertThat(indexer.broadcasts).isEmpty();
    }

    @Test
    void invalidRecipientFailsBeforeAnyNetworkCall() {
        assertThatThrownBy(() -> signer.signAndSendBitcoin(wallet, TestWallets.PASSWORD, "1NotAnAddress", "0.001"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> signer.signAndSendBitcoin(wallet, TestWallets.PASSWORD, recipient, "0.000000001"))
                .isInstanceOf(ValidationException.class);
        assertThat(indexer.queriedAddresses).isEmpty();
    }

    @Test
    void wrongPasswordFailsBeforeAnyNetworkCall() {
        assertThatThrownBy(() -> signer.signAndSendBitcoin(wallet, "Wr0ng!Pass", recipient, "0.001"))
                .isInstanceOf(CryptoException.class)
                .hasMessage(CryptoException.DECRYPTION_FAILED);
        assertThat(indexer.queriedAddresses).isEmpty();
    }

    @Test
    void convertsBitcoinAmountsToSatoshis() {
        assertThat(BitcoinSigner.toSatoshis("0.003")).isEqualTo(300_000);
        assertThat(BitcoinSigner.toSatoshis("1")).isEqualTo(100_000_000);
        assertThat(BitcoinSigner.toSatoshis("0.00000001")).isEqualTo(1);
        assertThatThrownBy(() -> BitcoinSigner.toSatoshis("-1")).isInstanceOf(ValidationException.class);
    }

    private static final class FakeIndexer implements UtxoIndexer {
        private final List<SecretBuffer> issuedKeys;
        private List<Utxo> utxos = List.of();
        private final List<String> queriedAddresses = new ArrayList<>();
        private final List<String> broadcasts = new ArrayList<>();
        private int callsWithLiveKey;

        private FakeIndexer(List<SecretBuffer> issuedKeys) {
            this.issuedKeys = issuedKeys;
        }

        @Override
        public CompletableFuture<List<Utxo>> confirmedUtxos(String address) {
            if (TestWallets.anyLive(issuedKeys)) {
                callsWithLiveKey++;
            }
            queriedAddresses.add(address);
            return CompletableFuture.completedFuture(utxos);
        }

        @Override
        public CompletableFuture<String> broadcast(String rawTransactionHex) {
            if (TestWallets.anyLive(issuedKeys)) {
                callsWithLiveKey++;
            }
            broadcasts.add(rawTransactionHex);
            return CompletableFuture.completedFuture("relayed");
        }
    }
}
