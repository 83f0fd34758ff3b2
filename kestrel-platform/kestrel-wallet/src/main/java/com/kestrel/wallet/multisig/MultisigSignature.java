package com.kestrel.wallet.multisig;

import com.kestrel.vault.error.ValidationException;

import java.util.regex.Pattern;

/**
 * One co-signer's approval: signer id plus a hex-encoded signature.
 */
public record MultisigSignature(String signerId, String signature) {

    private static final Pattern HEX = Pattern.compile("^(0x)?[0-9a-fA-F]+$");

    public MultisigSignature {
        if (signerId == null || signerId.isBlank()) {
            throw new ValidationException("Signer ID cannot be null or blank");
        }
        if (signature == null || !HEX.matcher(signature).matches()) {
            throw new ValidationException("Signature must be hex encoded");
        }
    }
}
