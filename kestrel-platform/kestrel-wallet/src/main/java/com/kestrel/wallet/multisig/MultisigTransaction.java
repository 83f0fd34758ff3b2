package com.kestrel.wallet.multisig;

import com.kestrel.vault.address.Network;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * A threshold transfer whose approvals have been checked.
 */
public record MultisigTransaction(
        String walletName,
        String to,
        BigDecimal amount,
        Network network,
        int threshold,
        List<MultisigSignature> signatures,
        Instant createdAt
) {

    public MultisigTransaction {
        signatures = List.copyOf(signatures);
    }

    public boolean isComplete() {
        return signatures.size() >= threshold;
    }

    /**
     * Stable text form: fields in fixed order, signatures sorted by signer id.
     */
    public String canonicalPayload() {
        StringBuilder payload = new StringBuilder()
                .append(walletName).append('|')
                .append(network.tag()).append('|')
                .append(to.toLowerCase(Locale.ROOT)).append('|')
                .append(amount.stripTrailingZeros().toPlainString()).append('|')
                .append(threshold);
        signatures.stream()
                .sorted((a, b) -> a.signerId().compareTo(b.signerId()))
                .forEach(s -> payload.append('|').append(s.signerId()).append(':').append(s.signature().toLowerCase(Locale.ROOT)));
        return payload.toString();
    }
}
