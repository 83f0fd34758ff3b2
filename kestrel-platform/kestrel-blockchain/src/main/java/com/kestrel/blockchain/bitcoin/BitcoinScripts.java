package com.kestrel.blockchain.bitcoin;

import com.kestrel.vault.address.Network;
import com.kestrel.vault.error.ValidationException;
import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.Base58;
import org.bitcoinj.core.Utils;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Standard output scripts and the legacy P2PKH unlocking script.
 */
public final class BitcoinScripts {

    static final int OP_DUP = 0x76;
    static final int OP_HASH160 = 0xa9;
    static final int OP_EQUALVERIFY = 0x88;
    static final int OP_EQUAL = 0x87;
    static final int OP_CHECKSIG = 0xac;

    public static final int SIGHASH_ALL = 0x01;

    private BitcoinScripts() {}

    /**
     * {@code OP_DUP OP_HASH160 <20> OP_EQUALVERIFY OP_CHECKSIG}
     */
    public static byte[] p2pkh(byte[] pubKeyHash) {
        requireHash160(pubKeyHash);
        byte[] script = new byte[25];
        script[0] = (byte) OP_DUP;
        script[1] = (byte) OP_HASH160;
        script[2] = 20;
        System.arraycopy(pubKeyHash, 0, script, 3, 20);
        script[23] = (byte) OP_EQUALVERIFY;
        script[24] = (byte) OP_CHECKSIG;
        return script;
    }

    /**
     * {@code OP_HASH160 <20> OP_EQUAL}
     */
    public static byte[] p2sh(byte[] scriptHash) {
        requireHash160(scriptHash);
        byte[] script = new byte[23];
        script[0] = (byte) OP_HASH160;
        script[1] = 20;
        System.arraycopy(scriptHash, 0, script, 2, 20);
        script[22] = (byte) OP_EQUAL;
        return script;
    }

    public static byte[] p2pkhForPublicKey(byte[] compressedPublicKey) {
        return p2pkh(Utils.sha256hash160(compressedPublicKey));
    }

    /**
     * Output script paying a Base58Check address of {@code network}.
     */
    public static byte[] outputScriptFor(String address, Network network) {
        byte[] decoded;
        try {
            decoded = Base58.decodeChecked(address);
        } catch (AddressFormatException e) {
            throw new ValidationException("Invalid Bitcoin address", e);
        }
        if (decoded.length != 21) {
            throw new ValidationException("Invalid Bitcoin address length");
        }
        int version = decoded[0] & 0xff;
        byte[] hash = Arrays.copyOfRange(decoded, 1, 21);
        if (version == network.p2pkhVersion()) {
            return p2pkh(hash);
        }
        if (version == network.p2shVersion()) {
            return p2sh(hash);
        }
        throw new ValidationException("Bitcoin address does not belong to network " + network.tag());
    }

    /**
     * {@code push(DER || sighashType) push(publicKey)}
     */
    public static byte[] p2pkhScriptSig(byte[] derSignature, int sighashType, byte[] publicKey) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        pushData(out, concat(derSignature, (byte) sighashType));
        pushData(out, publicKey);
        return out.toByteArray();
    }

    private static void pushData(ByteArrayOutputStream out, byte[] data) {
        if (data.length >= 0x4c) {
            throw new IllegalArgumentException("Push data too long for a direct push: " + data.length);
        }
        out.write(data.length);
        out.writeBytes(data);
    }

    private static byte[] concat(byte[] data, byte trailer) {
        byte[] result = Arrays.copyOf(data, data.length + 1);
        result[data.length] = trailer;
        return result;
    }

    private static void requireHash160(byte[] hash) {
        if (hash == null || hash.length != 20) {
            throw new IllegalArgumentException("Hash160 must be 20 bytes");
        }
    }
}
