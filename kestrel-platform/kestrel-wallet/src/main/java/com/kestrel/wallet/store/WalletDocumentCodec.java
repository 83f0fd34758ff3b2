package com.kestrel.wallet.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kestrel.vault.address.Network;
import com.kestrel.vault.crypto.EncryptedEnvelope;
import com.kestrel.vault.error.CryptoException;
import com.kestrel.vault.record.WalletRecord;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * JSON form of the {@code encrypted_data} column.
 *
 * Byte fields are written as base64 by Jackson. The document carries ciphertext and
 * non-secret metadata only; documents written without {@code addresses} decode to an empty set.
 */
public class WalletDocumentCodec {

    private final ObjectMapper objectMapper;

    public WalletDocumentCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
    }

    public String encode(WalletRecord record) {
        EncryptedEnvelope envelope = record.envelope();
        WalletDocument document = new WalletDocument(
                envelope.ciphertext(),
                envelope.salt(),
                envelope.nonce(),
                envelope.schemaVersion(),
                envelope.kekId(),
                record.passwordVerifier(),
                record.supportedNetworks().stream().map(Network::tag).sorted().toList(),
                record.multisigThreshold(),
                record.addresses().stream().sorted().toList());
        try {
            return objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Wallet document could not be written", e);
        }
    }

    /**
     * Rebuilds a record from a stored row. A document that does not parse is a damaged record.
     */
    public WalletRecord decode(UUID id, String name, boolean quantumSafe, Instant createdAt,
                               Instant updatedAt, String json) {
        WalletDocument document;
        try {
            document = objectMapper.readValue(json, WalletDocument.class);
        } catch (JsonProcessingException e) {
            throw new CryptoException("Stored wallet record is unreadable", e);
        }
        Set<Network> networks = EnumSet.noneOf(Network.class);
        if (document.networks() != null) {
            document.networks().forEach(tag -> networks.add(Network.fromTag(tag)));
        }
        EncryptedEnvelope envelope = new EncryptedEnvelope(document.ciphertext(), document.salt(),
                document.nonce(), document.schemaVersion(), document.kekId());
        Set<String> addresses = document.addresses() != null ? Set.copyOf(document.addresses()) : Set.of();
        return new WalletRecord(id, name, createdAt, updatedAt, quantumSafe,
                Math.max(1, document.multisigThreshold()), networks, envelope, document.passwordVerifier(),
                addresses);
    }

    record WalletDocument(
            byte[] ciphertext,
            byte[] salt,
            byte[] nonce,
            int schemaVersion,
            String kekId,
            String passwordVerifier,
            List<String> networks,
            int multisigThreshold,
            List<String> addresses
    ) {}
}
