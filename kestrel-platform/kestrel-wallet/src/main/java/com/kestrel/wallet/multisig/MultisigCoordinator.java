package com.kestrel.wallet.multisig;

import com.kestrel.vault.address.AddressValidator;
import com.kestrel.vault.address.Network;
import com.kestrel.vault.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks threshold approvals for a transfer and hands the result to a {@link MultisigBroadcaster}.
 *
 * The threshold must lie in {@code 1..signerSetSize}. Recipient and amount are checked whatever the
 * approval count, and every failure is a {@link ValidationException}.
 */
public class MultisigCoordinator {

    private static final Logger log = LoggerFactory.getLogger(MultisigCoordinator.class);

    private final int signerSetSize;
    private final MultisigBroadcaster broadcaster;

    public MultisigCoordinator(int signerSetSize, MultisigBroadcaster broadcaster) {
        if (signerSetSize < 1) {
            throw new IllegalArgumentException("Signer set size must be at least 1");
        }
        this.signerSetSize = signerSetSize;
        this.broadcaster = broadcaster != null ? broadcaster : new QueuedMultisigBroadcaster();
    }

    public String assemble(String walletName, String to, String amount, Network network,
                           List<MultisigSignature> signatures, int threshold) {
        if (threshold < 1) {
            throw new ValidationException("Threshold must be at least 1");
        }
        if (threshold > signerSetSize) {
            throw new ValidationException("Threshold " + threshold + " exceeds signer set size " + signerSetSize);
        }
        AddressValidator.validateAddress(to, network);
        BigDecimal value = AddressValidator.validateAmount(amount, network);

        List<MultisigSignature> approvals = signatures == null ? List.of() : signatures;
        if (approvals.size() < threshold) {
            throw new ValidationException("Insufficient signatures: got " + approvals.size() + ", need " + threshold);
        }
        if (approvals.size() > signerSetSize) {
            throw new ValidationException("More signatures than signers: " + approvals.size());
        }
        Set<String> signers = new HashSet<>();
        for (MultisigSignature approval : approvals) {
            if (approval == null) {
                throw new ValidationException("Signature cannot be null");
            }
            if (!signers.add(approval.signerId())) {
                throw new ValidationException("Duplicate signature from signer: " + approval.signerId());
            }
        }

        MultisigTransaction transaction = new MultisigTransaction(walletName, to, value, network,
                threshold, approvals, Instant.now());
        String id = broadcaster.broadcast(transaction);
        log.debug("Multisig transaction {} assembled with threshold {}", id, threshold);
        return id;
    }
}
