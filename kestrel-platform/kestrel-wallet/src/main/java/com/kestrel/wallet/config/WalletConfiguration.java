package com.kestrel.wallet.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kestrel.blockchain.bitcoin.BitcoinSigner;
import com.kestrel.blockchain.bitcoin.EsploraUtxoIndexer;
import com.kestrel.blockchain.bitcoin.FeeRateSource;
import com.kestrel.blockchain.bitcoin.FixedFeeRateSource;
import com.kestrel.blockchain.bitcoin.UtxoIndexer;
import com.kestrel.blockchain.bitcoin.UtxoSelector;
import com.kestrel.blockchain.ethereum.EthereumRpcProvider;
import com.kestrel.blockchain.ethereum.EthereumSigner;
import com.kestrel.blockchain.ethereum.LocalTransactionSigningHook;
import com.kestrel.blockchain.ethereum.TransactionSigningHook;
import com.kestrel.blockchain.ethereum.Web3jEthereumRpcProvider;
import com.kestrel.blockchain.service.BlockchainConfig;
import com.kestrel.core.repository.KeyLabelRepository;
import com.kestrel.core.repository.KeyVersionRepository;
import com.kestrel.core.repository.WalletRepository;
import com.kestrel.vault.address.AddressDeriver;
import com.kestrel.vault.address.Network;
import com.kestrel.vault.crypto.EnvelopeCrypto;
import com.kestrel.vault.crypto.PasswordVerifier;
import com.kestrel.vault.crypto.RootKek;
import com.kestrel.vault.mnemonic.MnemonicService;
import com.kestrel.vault.security.PasswordPolicy;
import com.kestrel.wallet.multisig.MultisigBroadcaster;
import com.kestrel.wallet.multisig.MultisigCoordinator;
import com.kestrel.wallet.multisig.QueuedMultisigBroadcaster;
import com.kestrel.wallet.nonce.InMemoryNonceStore;
import com.kestrel.wallet.nonce.JdbcNonceStore;
import com.kestrel.wallet.nonce.LocalNonceTracker;
import com.kestrel.wallet.nonce.NonceLedger;
import com.kestrel.wallet.nonce.NonceStore;
import com.kestrel.wallet.rotation.InMemoryKeyRotationStore;
import com.kestrel.wallet.rotation.JpaKeyRotationStore;
import com.kestrel.wallet.rotation.KeyRotationRegistry;
import com.kestrel.wallet.rotation.KeyRotationStore;
import com.kestrel.wallet.service.WalletService;
import com.kestrel.wallet.store.InMemoryWalletStorage;
import com.kestrel.wallet.store.JpaWalletStorage;
import com.kestrel.wallet.store.WalletDocumentCodec;
import com.kestrel.wallet.store.WalletStorage;
import com.kestrel.wallet.store.WalletStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.net.http.HttpClient;
import java.security.SecureRandom;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the custody engine. Storage-backed collaborators switch on {@code kestrel.wallet.storage}.
 */
@Configuration
public class WalletConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WalletConfiguration.class);

    // ==================== Vault ====================

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    @Bean
    public RootKek rootKek(VaultProperties properties) {
        RootKek kek = RootKek.parse(properties.getRootKek(), properties.isTestMode());
        log.info("Loaded root KEK {}", kek.kekId());
        return kek;
    }

    @Bean
    public PasswordPolicy passwordPolicy(VaultProperties properties) {
        return switch (properties.getPasswordPolicy().toLowerCase(Locale.ROOT)) {
            case "strict" -> PasswordPolicy.strict();
            case "lenient" -> PasswordPolicy.lenient();
            default -> PasswordPolicy.defaults();
        };
    }

    @Bean
    public EnvelopeCrypto envelopeCrypto(RootKek rootKek, PasswordPolicy passwordPolicy,
                                         VaultProperties properties, SecureRandom secureRandom) {
        return new EnvelopeCrypto(rootKek, passwordPolicy,
                new PasswordVerifier(properties.getPbkdf2Iterations(), secureRandom), secureRandom);
    }

    @Bean
    public AddressDeriver addressDeriver() {
        return new AddressDeriver();
    }

    @Bean
    public MnemonicService mnemonicService(SecureRandom secureRandom) {
        return new MnemonicService(secureRandom);
    }

    // ==================== Blockchain ====================

    @Bean(destroyMethod = "shutdown")
    public ExecutorService rpcExecutor(BlockchainConfig config) {
        return Executors.newFixedThreadPool(Math.max(1, config.getRpcThreads()));
    }

    @Bean
    public HttpClient indexerHttpClient(ExecutorService rpcExecutor, BlockchainConfig config) {
        return HttpClient.newBuilder()
                .executor(rpcExecutor)
                .connectTimeout(config.getRpcTimeout())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public EthereumRpcProvider ethereumRpcProvider(BlockchainConfig config) {
        return new Web3jEthereumRpcProvider(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public TransactionSigningHook transactionSigningHook() {
        return new LocalTransactionSigningHook();
    }

    @Bean
    public EthereumSigner ethereumSigner(EnvelopeCrypto envelopeCrypto, AddressDeriver addressDeriver,
                                         EthereumRpcProvider rpcProvider, TransactionSigningHook signingHook,
                                         BlockchainConfig config) {
        return new EthereumSigner(envelopeCrypto, addressDeriver, rpcProvider, signingHook, config);
    }

    @Bean
    @ConditionalOnMissingBean
    public UtxoIndexer utxoIndexer(BlockchainConfig config, HttpClient indexerHttpClient, ObjectMapper objectMapper) {
        Network network = Network.fromTag(config.getBitcoinNetwork());
        return new EsploraUtxoIndexer(config.resolveIndexerUrl(network), indexerHttpClient, objectMapper,
                config.getRpcTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public FeeRateSource feeRateSource(BlockchainConfig config) {
        return new FixedFeeRateSource(config.getFeeRateSatPerByte());
    }

    @Bean
    public BitcoinSigner bitcoinSigner(EnvelopeCrypto envelopeCrypto, AddressDeriver addressDeriver,
                                       UtxoIndexer utxoIndexer, FeeRateSource feeRateSource,
                                       BlockchainConfig config) {
        return new BitcoinSigner(envelopeCrypto, addressDeriver, utxoIndexer, new UtxoSelector(),
                feeRateSource, config);
    }

    // ==================== Storage ====================

    @Bean
    @ConditionalOnProperty(prefix = "kestrel.wallet", name = "storage", havingValue = "sql")
    public WalletStorage jpaWalletStorage(WalletRepository repository, ObjectMapper objectMapper) {
        return new JpaWalletStorage(repository, new WalletDocumentCodec(objectMapper));
    }

    @Bean
    @ConditionalOnProperty(prefix = "kestrel.wallet", name = "storage", havingValue = "memory", matchIfMissing = true)
    public WalletStorage inMemoryWalletStorage() {
        return new InMemoryWalletStorage();
    }

    @Bean
    @ConditionalOnProperty(prefix = "kestrel.wallet", name = "storage", havingValue = "sql")
    public NonceStore jdbcNonceStore(NamedParameterJdbcTemplate jdbc, TransactionTemplate transactions) {
        return new JdbcNonceStore(jdbc, transactions);
    }

    @Bean
    @ConditionalOnProperty(prefix = "kestrel.wallet", name = "storage", havingValue = "memory", matchIfMissing = true)
    public NonceStore inMemoryNonceStore() {
        return new InMemoryNonceStore();
    }

    @Bean
    @ConditionalOnProperty(prefix = "kestrel.wallet", name = "storage", havingValue = "sql")
    public KeyRotationStore jpaKeyRotationStore(KeyLabelRepository labels, KeyVersionRepository versions) {
        return new JpaKeyRotationStore(labels, versions);
    }

    @Bean
    @ConditionalOnProperty(prefix = "kestrel.wallet", name = "storage", havingValue = "memory", matchIfMissing = true)
    public KeyRotationStore inMemoryKeyRotationStore() {
        return new InMemoryKeyRotationStore();
    }

    // ==================== Wallet ====================

    @Bean
    public WalletStore walletStore(WalletStorage storage) {
        WalletStore store = new WalletStore(storage);
        store.loadAll();
        return store;
    }

    @Bean
    public NonceLedger nonceLedger(NonceStore nonceStore) {
        return new NonceLedger(new LocalNonceTracker(), nonceStore);
    }

    @Bean
    public KeyRotationRegistry keyRotationRegistry(KeyRotationStore store, SecureRandom secureRandom) {
        return new KeyRotationRegistry(store, secureRandom);
    }

    @Bean
    @ConditionalOnMissingBean
    public MultisigBroadcaster multisigBroadcaster() {
        return new QueuedMultisigBroadcaster();
    }

    @Bean
    public MultisigCoordinator multisigCoordinator(WalletProperties properties, MultisigBroadcaster broadcaster) {
        return new MultisigCoordinator(properties.getMultisigSignerSetSize(), broadcaster);
    }

    @Bean
    public WalletService walletService(WalletStore store, EnvelopeCrypto envelopeCrypto,
                                       MnemonicService mnemonicService, AddressDeriver addressDeriver,
                                       EthereumSigner ethereumSigner, BitcoinSigner bitcoinSigner,
                                       NonceLedger nonceLedger, KeyRotationRegistry rotationRegistry,
                                       MultisigCoordinator multisigCoordinator,
                                       WalletProperties walletProperties) {
        return new WalletService(store, envelopeCrypto, mnemonicService, addressDeriver, ethereumSigner,
                bitcoinSigner, nonceLedger, rotationRegistry, multisigCoordinator,
                new WalletService.Settings(Network.fromTag(walletProperties.getMultisigNetwork()),
                        walletProperties.getRotationUsageThreshold()));
    }
}
