package com.kestrel.blockchain.ethereum;

import com.kestrel.blockchain.rpc.RpcCalls;
import com.kestrel.blockchain.service.BlockchainConfig;
import com.kestrel.vault.address.AddressDeriver;
import com.kestrel.vault.address.AddressValidator;
import com.kestrel.vault.address.Network;
import com.kestrel.vault.crypto.EnvelopeCrypto;
import com.kestrel.vault.error.CryptoException;
import com.kestrel.vault.error.ValidationException;
import com.kestrel.vault.record.WalletRecord;
import com.kestrel.vault.secret.SecretBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.utils.Convert;
import org.web3j.utils.Numeric;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;

/**
 * Builds, signs and broadcasts native-asset transfers on Ethereum-family networks.
 */
public class EthereumSigner {

    private static final Logger log = LoggerFactory.getLogger(EthereumSigner.class);

    private final EnvelopeCrypto envelopeCrypto;
    private final AddressDeriver addressDeriver;
    private final EthereumRpcProvider rpcProvider;
    private final TransactionSigningHook signingHook;
    private final BigInteger gasLimit;
    private final Duration rpcTimeout;

    public EthereumSigner(EnvelopeCrypto envelopeCrypto, AddressDeriver addressDeriver,
                          EthereumRpcProvider rpcProvider, TransactionSigningHook signingHook,
                          BlockchainConfig config) {
        if (envelopeCrypto == null || rpcProvider == null || config == null) {
            throw new IllegalArgumentException("Envelope crypto, RPC provider and config cannot be null");
        }
        this.envelopeCrypto = envelopeCrypto;
        this.addressDeriver = addressDeriver != null ? addressDeriver : new AddressDeriver();
        this.rpcProvider = rpcProvider;
        this.signingHook = signingHook != null ? signingHook : new LocalTransactionSigningHook();
        this.gasLimit = BigInteger.valueOf(config.getGasLimit());
        this.rpcTimeout = config.getRpcTimeout();
    }

    /**
     * Sends {@code amount} (decimal ether units) from the wallet to {@code to} using the chain's
     * pending transaction count as the nonce.
     *
     * @return the transaction hash reported by the node
     */
    public String signAndSend(WalletRecord record, String password, String to, String amount, Network network) {
        validateTransfer(to, amount, network);
        String from = senderAddress(record, password, network);
        return signAndSend(record, password, from, to, amount, network, pendingNonce(from, network));
    }

    /**
     * Sends with a caller-chosen nonce from a sender address the caller already derived.
     *
     * Recipient and amount are validated before any decryption or RPC call. Gas price is fetched
     * before the key is decrypted; the key is zeroed as soon as signing finishes.
     *
     * @throws ValidationException when {@code from} is not the wallet's address on {@code network}
     */
    public String signAndSend(WalletRecord record, String password, String from, String to, String amount,
                              Network network, BigInteger nonce) {
        BigInteger valueWei = validateTransfer(to, amount, network);
        AddressValidator.validateEthereumAddress(from);
        EthereumRpc rpc = rpcProvider.forNetwork(network);
        BigInteger gasPrice = RpcCalls.await(rpc.getGasPrice(), rpcTimeout, "eth_gasPrice");

        SignedEthereumTransaction signed;
        try (SecretBuffer masterKey = envelopeCrypto.decryptMasterKey(record, password)) {
            signed = sign(masterKey, to, valueWei, network, nonce, gasPrice);
        }
        if (!signed.from().equalsIgnoreCase(from)) {
            throw new ValidationException("Sender address does not belong to wallet " + record.name());
        }

        String txHash = RpcCalls.await(rpc.sendRawTransaction(signed.rawTransaction()), rpcTimeout,
                "eth_sendRawTransaction");
        log.info("Broadcast {} transfer from wallet {} nonce {} tx {}",
                network.tag(), record.name(), signed.nonce(), txHash);
        return txHash != null ? txHash : signed.transactionHash();
    }

    /**
     * Pending transaction count of {@code address}, the next nonce the node expects.
     */
    public BigInteger pendingNonce(String address, Network network) {
        if (network == null || !network.isEthereum()) {
            throw new ValidationException("Not an Ethereum network: " + network);
        }
        AddressValidator.validateEthereumAddress(address);
        return RpcCalls.await(rpcProvider.forNetwork(network).getTransactionCount(address), rpcTimeout,
                "eth_getTransactionCount");
    }

    /**
     * Offline signing: builds a 21000-gas transfer and signs it with the EIP-155 chain id.
     */
    public SignedEthereumTransaction sign(SecretBuffer masterKey, String to, BigInteger valueWei, Network network,
                                          BigInteger nonce, BigInteger gasPrice) {
        if (network == null || !network.isEthereum()) {
            throw new ValidationException("Not an Ethereum network: " + network);
        }
        AddressValidator.validateEthereumAddress(to);
        if (valueWei == null || valueWei.signum() <= 0) {
            throw new ValidationException("Amount must be positive");
        }
        if (nonce == null || nonce.signum() < 0 || gasPrice == null || gasPrice.signum() < 0) {
            throw new ValidationException("Nonce and gas price must be non-negative");
        }

        String from = addressDeriver.deriveAddress(masterKey, network);
        RawTransaction transaction = RawTransaction.createEtherTransaction(nonce, gasPrice, gasLimit, to, valueWei);
        byte[] encoded;
        try {
            encoded = signingHook.sign(transaction, network.chainId(), masterKey);
        } catch (ValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CryptoException("Transaction signing failed", e);
        }
        String raw = Numeric.toHexString(encoded);
        String hash = Numeric.toHexString(Hash.sha3(encoded));
        log.debug("Signed {} transfer nonce {} from {}", network.tag(), nonce, from);
        return new SignedEthereumTransaction(from, to, valueWei, nonce, gasPrice, network.chainId(), raw, hash);
    }

    /**
     * Balance in wei at the latest block.
     */
    public BigInteger getBalance(String address, Network network) {
        if (network == null || !network.isEthereum()) {
            throw new ValidationException("Not an Ethereum network: " + network);
        }
        AddressValidator.validateEthereumAddress(address);
        return RpcCalls.await(rpcProvider.forNetwork(network).getBalance(address), rpcTimeout, "eth_getBalance");
    }

    private String senderAddress(WalletRecord record, String password, Network network) {
        try (SecretBuffer masterKey = envelopeCrypto.decryptMasterKey(record, password)) {
            return addressDeriver.deriveAddress(masterKey, network);
        }
    }

    /**
     * Checks recipient and amount and converts the amount to wei.
     */
    public static BigInteger validateTransfer(String to, String amount, Network network) {
        if (network == null || !network.isEthereum()) {
            throw new ValidationException("Not an Ethereum network: " + network);
        }
        AddressValidator.validateEthereumAddress(to);
        BigDecimal ether = AddressValidator.validateAmount(amount, AddressValidator.ETHEREUM_DECIMALS);
        return Convert.toWei(ether, Convert.Unit.ETHER).toBigIntegerExact();
    }
}
