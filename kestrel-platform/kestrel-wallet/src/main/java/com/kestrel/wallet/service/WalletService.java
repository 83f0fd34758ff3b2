package com.kestrel.wallet.service;

import com.kestrel.blockchain.bitcoin.BitcoinSigner;
import com.kestrel.blockchain.ethereum.EthereumSigner;
import com.kestrel.vault.address.AddressDeriver;
import com.kestrel.vault.address.Network;
import com.kestrel.vault.crypto.EncryptedEnvelope;
import com.kestrel.vault.crypto.EnvelopeCrypto;
import com.kestrel.vault.crypto.WalletIdentity;
import com.kestrel.vault.error.NetworkException;
import com.kestrel.vault.error.NonceOverflowException;
import com.kestrel.vault.error.ValidationException;
import com.kestrel.vault.error.WalletException;
import com.kestrel.vault.mnemonic.MnemonicService;
import com.kestrel.vault.record.WalletRecord;
import com.kestrel.vault.secret.SecretBuffer;
import com.kestrel.wallet.multisig.MultisigCoordinator;
import com.kestrel.wallet.multisig.MultisigSignature;
import com.kestrel.wallet.nonce.NonceLedger;
import com.kestrel.wallet.rotation.KeyRotationRegistry;
import com.kestrel.wallet.rotation.KeyVersionView;
import com.kestrel.wallet.rotation.RotationResult;
import com.kestrel.wallet.store.WalletStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Entry point of the custody engine: wallet lifecycle, address lookup, sends and key rotation.
 *
 * Sends run in a fixed order: input validation, record lookup under the store's read lock,
 * sender derivation with no lock held, chain reads, persisted sequence reservation, then the
 * network signer, which decrypts only after its own chain reads, and finally usage accounting on
 * the wallet's signing-key label. Plaintext keys live only inside try-with-resources blocks.
 *
 * Every public operation raises {@link WalletException} subtypes only; anything else is
 * translated at this boundary by {@link WalletErrorTranslator}.
 */
public class WalletService {

    private static final Logger log = LoggerFactory.getLogger(WalletService.class);

    private static final Pattern WALLET_NAME = Pattern.compile("^[A-Za-z0-9_-]{1,64}$");

    private final WalletStore store;
    private final EnvelopeCrypto envelopeCrypto;
    private final MnemonicService mnemonicService;
    private final AddressDeriver addressDeriver;
    private final EthereumSigner ethereumSigner;
    private final BitcoinSigner bitcoinSigner;
    private final NonceLedger nonceLedger;
    private final KeyRotationRegistry rotationRegistry;
    private final MultisigCoordinator multisigCoordinator;
    private final Settings settings;
    private final WalletErrorTranslator errorTranslator = new WalletErrorTranslator();

    public WalletService(WalletStore store, EnvelopeCrypto envelopeCrypto, MnemonicService mnemonicService,
                         AddressDeriver addressDeriver, EthereumSigner ethereumSigner, BitcoinSigner bitcoinSigner,
                         NonceLedger nonceLedger, KeyRotationRegistry rotationRegistry,
                         MultisigCoordinator multisigCoordinator, Settings settings) {
        this.store = store;
        this.envelopeCrypto = envelopeCrypto;
        this.mnemonicService = mnemonicService;
        this.addressDeriver = addressDeriver;
        this.ethereumSigner = ethereumSigner;
        this.bitcoinSigner = bitcoinSigner;
        this.nonceLedger = nonceLedger;
        this.rotationRegistry = rotationRegistry;
        this.multisigCoordinator = multisigCoordinator;
        this.settings = settings != null ? settings : Settings.defaults();
    }

    // ==================== Lifecycle ====================

    /**
     * Creates a wallet from a fresh 24-word mnemonic.
     *
     * @return the mnemonic; it is not stored and cannot be retrieved again
     */
    public String createWallet(String name, String password, boolean quantumSafe) {
        return translated("createWallet", () -> {
            validateName(name);
            requireAbsent(name);
            String verifier = envelopeCrypto.createPasswordVerifier(password);

            String mnemonic = mnemonicService.generate();
            storeNewWallet(name, mnemonic, quantumSafe, verifier);
            log.info("Created wallet {} (quantumSafe={})", name, quantumSafe);
            return mnemonic;
        });
    }

    /**
     * Restores a wallet without a password verifier; any policy-conforming password then opens it.
     */
    public void restoreWallet(String name, String mnemonic) {
        restoreWallet(name, mnemonic, null);
    }

    public void restoreWallet(String name, String mnemonic, String password) {
        translatedRun("restoreWallet", () -> {
            validateName(name);
            mnemonicService.validate(mnemonic);
            requireAbsent(name);
            String verifier = password != null ? envelopeCrypto.createPasswordVerifier(password) : null;

            storeNewWallet(name, mnemonic, false, verifier);
            log.info("Restored wallet {}", name);
        });
    }

    /**
     * Removes the wallet and purges the nonce entries of every address stored with its record.
     */
    public void deleteWallet(String name) {
        translatedRun("deleteWallet", () -> {
            validateName(name);
            WalletRecord removed = store.remove(name);
            nonceLedger.purge(removed.addresses());
            rotationRegistry.purge(signingLabel(name));
            log.info("Deleted wallet {}", name);
        });
    }

    public List<WalletSummary> listWallets() {
        return translated("listWallets", () -> store.list().stream()
                .map(r -> new WalletSummary(r.id(), r.name(), r.createdAt(), r.updatedAt(),
                        r.quantumSafe(), r.supportedNetworks()))
                .toList());
    }

    /**
     * Re-seals the wallet's master key under the latest envelope schema with fresh salt and nonce.
     */
    public void reencryptWallet(String name) {
        translatedRun("reencryptWallet", () -> {
            validateName(name);
            WalletRecord record = store.get(name);
            EncryptedEnvelope envelope = envelopeCrypto.reencrypt(record);
            store.replace(record.withEnvelope(envelope));
            log.info("Re-encrypted wallet {} under schema v{}", name, envelope.schemaVersion());
        });
    }

    // ==================== Addresses and sends ====================

    public String getAddress(String name, Network network, String password) {
        return translated("getAddress", () -> {
            validateName(name);
            requireNetwork(network);
            WalletRecord record = store.get(name);
            requireSupported(record, network);
            return deriveAddress(record, network, password);
        });
    }

    /**
     * Signs and broadcasts a native transfer.
     *
     * On Ethereum-family networks the reserved sequence is the transaction nonce, floored at the
     * node's pending transaction count. A broadcast that fails after reservation leaves that
     * sequence skipped.
     *
     * @return transaction hash (Ethereum family) or txid (Bitcoin)
     */
    public String sendTransaction(String name, String to, String amount, Network network, String password) {
        return translated("sendTransaction", () -> {
            validateName(name);
            requireNetwork(network);
            if (network.isEthereum()) {
                EthereumSigner.validateTransfer(to, amount, network);
            } else {
                if (network != bitcoinSigner.getNetwork()) {
                    throw new ValidationException("Bitcoin sends are configured for "
                            + bitcoinSigner.getNetwork().tag());
                }
                BitcoinSigner.validatePayment(to, amount, network);
            }

            WalletRecord record = store.get(name);
            requireSupported(record, network);
            String from = deriveAddress(record, network, password);

            long sequence;
            String txHash;
            try {
                if (network.isEthereum()) {
                    sequence = nonceLedger.reserve(network, from, chainNonce(from, network));
                    txHash = ethereumSigner.signAndSend(record, password, from, to, amount, network,
                            BigInteger.valueOf(sequence));
                } else {
                    sequence = nonceLedger.reserve(network, from);
                    txHash = bitcoinSigner.signAndSendBitcoin(record, password, from, to, amount);
                }
            } catch (NetworkException e) {
                log.warn("Send from wallet {} on {} failed at the network layer; retryable",
                        name, network.tag());
                throw e;
            }
            nonceLedger.markUsed(network, from, sequence);

            String label = signingLabel(name);
            rotationRegistry.register(label);
            rotationRegistry.recordUsage(label);
            if (settings.rotationUsageThreshold() > 0
                    && rotationRegistry.needsRotation(label, settings.rotationUsageThreshold())) {
                log.warn("Signing key of wallet {} reached {} uses; rotation advised", name,
                        settings.rotationUsageThreshold());
            }
            log.info("Sent {} from wallet {} sequence {} tx {}", network.tag(), name, sequence, txHash);
            return txHash;
        });
    }

    public String sendMultiSig(String name, String to, String amount, List<MultisigSignature> signatures,
                               int threshold) {
        return translated("sendMultiSig", () -> {
            validateName(name);
            store.get(name);
            return multisigCoordinator.assemble(name, to, amount, settings.multisigNetwork(), signatures,
                    threshold);
        });
    }

    // ==================== Key rotation ====================

    public RotationResult rotateSigningKey(String name) {
        return translated("rotateSigningKey", () -> {
            validateName(name);
            store.get(name);
            String label = signingLabel(name);
            rotationRegistry.register(label);
            return rotationRegistry.rotate(label);
        });
    }

    public KeyVersionView currentSigningKey(String name) {
        return translated("currentSigningKey", () -> {
            validateName(name);
            store.get(name);
            return rotationRegistry.register(signingLabel(name));
        });
    }

    public List<KeyVersionView> signingKeyVersions(String name) {
        return translated("signingKeyVersions", () -> {
            validateName(name);
            store.get(name);
            return rotationRegistry.versions(signingLabel(name));
        });
    }

    // ==================== Private Helper Methods ====================

    private <T> T translated(String operation, Supplier<T> body) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            throw errorTranslator.translate(operation, e);
        }
    }

    private void translatedRun(String operation, Runnable body) {
        try {
            body.run();
        } catch (RuntimeException e) {
            throw errorTranslator.translate(operation, e);
        }
    }

    private void storeNewWallet(String name, String mnemonic, boolean quantumSafe, String verifier) {
        WalletIdentity identity = new WalletIdentity(UUID.randomUUID(), name);
        EncryptedEnvelope envelope;
        Set<String> addresses = new HashSet<>();
        try (SecretBuffer masterKey = mnemonicService.deriveMasterKey(mnemonic)) {
            envelope = envelopeCrypto.encryptMasterKey(masterKey, identity, quantumSafe);
            for (Network network : EnumSet.allOf(Network.class)) {
                addresses.add(addressDeriver.deriveAddress(masterKey, network));
            }
        }
        WalletRecord record = WalletRecord.create(identity.id(), name, quantumSafe, envelope, verifier)
                .withAddresses(addresses);
        store.insert(record);
        rotationRegistry.register(signingLabel(name));
    }

    private String deriveAddress(WalletRecord record, Network network, String password) {
        try (SecretBuffer masterKey = envelopeCrypto.decryptMasterKey(record, password)) {
            return addressDeriver.deriveAddress(masterKey, network);
        }
    }

    private long chainNonce(String from, Network network) {
        BigInteger pending = ethereumSigner.pendingNonce(from, network);
        if (pending.signum() < 0 || pending.bitLength() > 63) {
            throw new NonceOverflowException("Chain nonce out of range for " + network.tag());
        }
        return pending.longValue();
    }

    private void requireAbsent(String name) {
        if (store.contains(name)) {
            throw new ValidationException("Wallet already exists: " + name);
        }
    }

    private static void validateName(String name) {
        if (name == null || !WALLET_NAME.matcher(name).matches()) {
            throw new ValidationException("Wallet name must be 1-64 characters of letters, digits, '_' or '-'");
        }
    }

    private static void requireNetwork(Network network) {
        if (network == null) {
            throw new ValidationException("Network cannot be null");
        }
    }

    private static void requireSupported(WalletRecord record, Network network) {
        if (!record.supports(network)) {
            throw new ValidationException("Wallet " + record.name() + " does not support " + network.tag());
        }
    }

    static String signingLabel(String name) {
        return "wallet/" + name + "/signing";
    }

    /**
     * Service tunables.
     *
     * @param multisigNetwork        network multisig transfers are validated against
     * @param rotationUsageThreshold uses before a rotation warning is logged; 0 disables it
     */
    public record Settings(Network multisigNetwork, long rotationUsageThreshold) {

        public Settings {
            multisigNetwork = multisigNetwork != null ? multisigNetwork : Network.ETH;
        }

        public static Settings defaults() {
            return new Settings(Network.ETH, 0);
        }
    }
}
