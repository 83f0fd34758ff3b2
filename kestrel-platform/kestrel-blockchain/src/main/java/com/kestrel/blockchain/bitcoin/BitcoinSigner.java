package com.kestrel.blockchain.bitcoin;

import com.kestrel.blockchain.rpc.RpcCalls;
import com.kestrel.blockchain.service.BlockchainConfig;
import com.kestrel.vault.address.AddressDeriver;
import com.kestrel.vault.address.AddressValidator;
import com.kestrel.vault.address.Network;
import com.kestrel.vault.crypto.EnvelopeCrypto;
import com.kestrel.vault.error.InsufficientFundsException;
import com.kestrel.vault.error.ValidationException;
import com.kestrel.vault.record.WalletRecord;
import com.kestrel.vault.secret.SecretBuffer;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Sha256Hash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * Builds, legacy-signs and relays P2PKH payments.
 */
public class BitcoinSigner {

    private static final Logger log = LoggerFactory.getLogger(BitcoinSigner.class);

    private final EnvelopeCrypto envelopeCrypto;
    private final AddressDeriver addressDeriver;
    private final UtxoIndexer indexer;
    private final UtxoSelector selector;
    private final FeeRateSource feeRateSource;
    private final Network network;
    private final Duration rpcTimeout;

    public BitcoinSigner(EnvelopeCrypto envelopeCrypto, AddressDeriver addressDeriver, UtxoIndexer indexer,
                         UtxoSelector selector, FeeRateSource feeRateSource, BlockchainConfig config) {
        if (envelopeCrypto == null || indexer == null || config == null) {
            throw new IllegalArgumentException("Envelope crypto, indexer and config cannot be null");
        }
        this.envelopeCrypto = envelopeCrypto;
        this.addressDeriver = addressDeriver != null ? addressDeriver : new AddressDeriver();
        this.indexer = indexer;
        this.selector = selector != null ? selector : new UtxoSelector();
        this.feeRateSource = feeRateSource != null
                ? feeRateSource
                : new FixedFeeRateSource(config.getFeeRateSatPerByte());
        this.network = Network.fromTag(config.getBitcoinNetwork());
        if (!network.isBitcoin()) {
            throw new IllegalArgumentException("Configured Bitcoin network is not a Bitcoin network: " + network);
        }
        this.rpcTimeout = config.getRpcTimeout();
    }

    /**
     * Pays {@code amountBtc} to {@code to} from the wallet's P2PKH address.
     *
     * @return the txid reported by the relay
     */
    public String signAndSendBitcoin(WalletRecord record, String password, String to, String amountBtc) {
        validatePayment(to, amountBtc, network);
        String from;
        try (SecretBuffer masterKey = envelopeCrypto.decryptMasterKey(record, password)) {
            from = addressDeriver.deriveAddress(masterKey, network);
        }
        return signAndSendBitcoin(record, password, from, to, amountBtc);
    }

    /**
     * Pays from a sender address the caller already derived.
     *
     * Confirmed outputs and the fee rate are fetched before the key is decrypted; the key is
     * zeroed as soon as every input is signed.
     *
     * @throws ValidationException when {@code from} is not the wallet's address
     */
    public String signAndSendBitcoin(WalletRecord record, String password, String from, String to,
                                     String amountBtc) {
        long amount = validatePayment(to, amountBtc, network);
        AddressValidator.validateBitcoinAddress(from, network);
        List<Utxo> utxos = RpcCalls.await(indexer.confirmedUtxos(from), rpcTimeout, "UTXO query");
        if (utxos.isEmpty()) {
            throw new InsufficientFundsException("No confirmed outputs for sender", 0, amount);
        }
        long feeRate = feeRateSource.satoshisPerByte();

        SignedBitcoinTransaction signed;
        try (SecretBuffer masterKey = envelopeCrypto.decryptMasterKey(record, password)) {
            signed = buildSigned(masterKey, utxos, to, amount, feeRate);
        }
        if (!signed.from().equals(from)) {
            throw new ValidationException("Sender address does not belong to wallet " + record.name());
        }

        String txid = RpcCalls.await(indexer.broadcast(signed.rawTransaction()), rpcTimeout, "Broadcast");
        log.info("Broadcast {} payment from wallet {} with {} inputs, fee {} sat, tx {}",
                network.tag(), record.name(), signed.selection().selected().size(), signed.selection().fee(), txid);
        return txid != null && !txid.isBlank() ? txid : signed.txid();
    }

    /**
     * Offline: selects coins, builds the transaction and signs every input.
     */
    public SignedBitcoinTransaction buildSigned(SecretBuffer masterKey, List<Utxo> utxos, String to,
                                                long amountSatoshis, long feeRate) {
        if (amountSatoshis < UtxoSelector.DUST_THRESHOLD) {
            throw new ValidationException("Amount is below the " + UtxoSelector.DUST_THRESHOLD + " sat dust limit");
        }
        byte[] recipientScript = BitcoinScripts.outputScriptFor(to, network);
        CoinSelection selection = selector.select(utxos, amountSatoshis, feeRate);

        ECKey key = ECKey.fromPrivate(AddressDeriver.toPrivateKey(masterKey.bytes()), true);
        byte[] publicKey = addressDeriver.compressedPublicKey(masterKey);
        byte[] senderScript = BitcoinScripts.p2pkhForPublicKey(publicKey);
        String from = addressDeriver.deriveAddress(masterKey, network);

        BitcoinTransaction transaction = new BitcoinTransaction();
        for (Utxo utxo : selection.selected()) {
            transaction.addInput(utxo.txid(), utxo.vout());
        }
        transaction.addOutput(amountSatoshis, recipientScript);
        if (selection.hasChange()) {
            transaction.addOutput(selection.change(), senderScript);
        }

        for (int i = 0; i < transaction.getInputs().size(); i++) {
            Sha256Hash sighash = transaction.signatureHash(i, senderScript, BitcoinScripts.SIGHASH_ALL);
            byte[] der = key.sign(sighash).encodeToDER();
            transaction.getInputs().get(i)
                    .setScriptSig(BitcoinScripts.p2pkhScriptSig(der, BitcoinScripts.SIGHASH_ALL, publicKey));
        }

        return new SignedBitcoinTransaction(from, to, transaction.toHex(), transaction.txid(), selection);
    }

    public Network getNetwork() {
        return network;
    }

    /**
     * Checks recipient and amount for a payment on {@code network}.
     *
     * @return the amount in satoshis, at least the dust limit
     */
    public static long validatePayment(String to, String amountBtc, Network network) {
        if (network == null || !network.isBitcoin()) {
            throw new ValidationException("Not a Bitcoin network: " + network);
        }
        AddressValidator.validateBitcoinAddress(to, network);
        long amount = toSatoshis(amountBtc);
        if (amount < UtxoSelector.DUST_THRESHOLD) {
            throw new ValidationException("Amount is below the " + UtxoSelector.DUST_THRESHOLD + " sat dust limit");
        }
        return amount;
    }

    /**
     * Strict decimal BTC amount (max 8 places) to satoshis.
     */
    public static long toSatoshis(String amountBtc) {
        BigDecimal btc = AddressValidator.validateAmount(amountBtc, AddressValidator.BITCOIN_DECIMALS);
        try {
            return btc.movePointRight(8).longValueExact();
        } catch (ArithmeticException e) {
            throw new ValidationException("Amount out of range", e);
        }
    }
}
