package com.kestrel.blockchain.ethereum;

import com.kestrel.vault.address.Network;

/**
 * Resolves the RPC client for a network.
 */
@FunctionalInterface
public interface EthereumRpcProvider {

    EthereumRpc forNetwork(Network network);
}
