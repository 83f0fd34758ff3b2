package com.kestrel.blockchain.ethereum;

import com.kestrel.vault.secret.SecretBuffer;
import org.web3j.crypto.RawTransaction;

/**
 * Produces the signed, RLP-encoded bytes of a transaction.
 *
 * The default implementation signs locally with the decrypted key; an HSM-backed
 * implementation may ignore {@code privateKey} and sign remotely.
 */
@FunctionalInterface
public interface TransactionSigningHook {

    byte[] sign(RawTransaction transaction, long chainId, SecretBuffer privateKey);
}
