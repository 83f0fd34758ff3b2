package com.kestrel.blockchain.ethereum;

import com.kestrel.blockchain.service.BlockchainConfig;
import com.kestrel.vault.address.Network;
import com.kestrel.vault.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One web3j client per configured endpoint, created lazily.
 */
public class Web3jEthereumRpcProvider implements EthereumRpcProvider, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Web3jEthereumRpcProvider.class);

    private final BlockchainConfig config;
    private final Map<String, Web3jEthereumRpc> clients = new ConcurrentHashMap<>();

    public Web3jEthereumRpcProvider(BlockchainConfig config) {
        this.config = config;
    }

    @Override
    public EthereumRpc forNetwork(Network network) {
        if (network == null || !network.isEthereum()) {
            throw new ValidationException("Not an Ethereum network: " + network);
        }
        String endpoint = config.resolveEndpoint(network);
        return clients.computeIfAbsent(endpoint, url -> {
            log.info("Connecting {} RPC client", network.tag());
            return new Web3jEthereumRpc(Web3j.build(new HttpService(url)));
        });
    }

    @Override
    public void close() {
        clients.values().forEach(Web3jEthereumRpc::shutdown);
        clients.clear();
    }
}
