package com.kestrel.blockchain.ethereum;

import java.math.BigInteger;

/**
 * A signed transfer ready for broadcast.
 *
 * @param rawTransaction 0x-prefixed RLP encoding
 * @param transactionHash Keccak-256 of the encoding
 */
public record SignedEthereumTransaction(
        String from,
        String to,
        BigInteger valueWei,
        BigInteger nonce,
        BigInteger gasPrice,
        long chainId,
        String rawTransaction,
        String transactionHash
) {}
