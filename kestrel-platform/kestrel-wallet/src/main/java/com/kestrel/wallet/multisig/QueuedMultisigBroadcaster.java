package com.kestrel.wallet.multisig;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;

/**
 * Default broadcaster: assigns {@code 0x + Keccak-256(canonical payload)} and logs the
 * transaction as queued for the executing contract.
 */
public class QueuedMultisigBroadcaster implements MultisigBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(QueuedMultisigBroadcaster.class);

    @Override
    public String broadcast(MultisigTransaction transaction) {
        byte[] payload = transaction.canonicalPayload().getBytes(StandardCharsets.UTF_8);
        String id = Numeric.toHexString(Hash.sha3(payload));
        log.info("Queued multisig transaction {} for wallet {} on {} with {}/{} approvals",
                id, transaction.walletName(), transaction.network().tag(),
                transaction.signatures().size(), transaction.threshold());
        return id;
    }
}
