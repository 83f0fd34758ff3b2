package com.kestrel.wallet.multisig;

/**
 * Hands an approved multisig transaction to whatever executes it and returns its id.
 */
@FunctionalInterface
public interface MultisigBroadcaster {

    String broadcast(MultisigTransaction transaction);
}
