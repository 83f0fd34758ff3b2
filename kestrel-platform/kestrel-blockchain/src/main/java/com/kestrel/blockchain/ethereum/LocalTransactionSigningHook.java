package com.kestrel.blockchain.ethereum;

import com.kestrel.vault.address.AddressDeriver;
import com.kestrel.vault.secret.SecretBuffer;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;

/**
 * EIP-155 signing with a web3j local signer.
 */
public class LocalTransactionSigningHook implements TransactionSigningHook {

    @Override
    public byte[] sign(RawTransaction transaction, long chainId, SecretBuffer privateKey) {
        Credentials credentials = Credentials.create(ECKeyPair.create(AddressDeriver.toPrivateKey(privateKey.bytes())));
        return TransactionEncoder.signMessage(transaction, chainId, credentials);
    }
}
