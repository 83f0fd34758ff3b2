package com.kestrel.blockchain.bitcoin;

import org.bitcoinj.core.Sha256Hash;
import org.bitcoinj.core.VarInt;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;

/**
 * Minimal legacy (non-segwit) transaction: wire serialization, signature preimage and txid.
 */
public class BitcoinTransaction {

    public static final int VERSION = 2;
    public static final long SEQUENCE_FINAL = 0xffffffffL;

    private final int version;
    private final long lockTime;
    private final List<Input> inputs = new ArrayList<>();
    private final List<Output> outputs = new ArrayList<>();

    public BitcoinTransaction() {
        this(VERSION, 0);
    }

    public BitcoinTransaction(int version, long lockTime) {
        this.version = version;
        this.lockTime = lockTime;
    }

    public Input addInput(String prevTxid, int prevIndex) {
        Input input = new Input(prevTxid, prevIndex);
        inputs.add(input);
        return input;
    }

    public void addOutput(long value, byte[] scriptPubKey) {
        if (value <= 0) {
            throw new IllegalArgumentException("Output value must be positive");
        }
        outputs.add(new Output(value, scriptPubKey.clone()));
    }

    /**
     * Standard wire encoding.
     */
    public byte[] serialize() {
        return serialize(-1, null, -1);
    }

    public String toHex() {
        return HexFormat.of().formatHex(serialize());
    }

    /**
     * Legacy signature preimage: every scriptSig emptied except input {@code index}, which carries
     * {@code scriptCode}, followed by the 4-byte little-endian sighash type.
     */
    public byte[] signaturePreimage(int index, byte[] scriptCode, int sighashType) {
        if (index < 0 || index >= inputs.size()) {
            throw new IllegalArgumentException("Input index out of range: " + index);
        }
        return serialize(index, scriptCode, sighashType);
    }

    public Sha256Hash signatureHash(int index, byte[] scriptCode, int sighashType) {
        return Sha256Hash.twiceOf(signaturePreimage(index, scriptCode, sighashType));
    }

    /**
     * Double SHA-256 of the serialization, rendered byte-reversed.
     */
    public String txid() {
        return HexFormat.of().formatHex(Sha256Hash.twiceOf(serialize()).getReversedBytes());
    }

    public List<Input> getInputs() { return Collections.unmodifiableList(inputs); }
    public List<Output> getOutputs() { return Collections.unmodifiableList(outputs); }
    public int getVersion() { return version; }
    public long getLockTime() { return lockTime; }

    private byte[] serialize(int signingIndex, byte[] scriptCode, int sighashType) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeUint32(out, version);
        out.writeBytes(new VarInt(inputs.size()).encode());
        for (int i = 0; i < inputs.size(); i++) {
            Input input = inputs.get(i);
            out.writeBytes(input.outpointBytes());
            byte[] script;
            if (signingIndex < 0) {
                script = input.scriptSig;
            } else {
                script = i == signingIndex ? scriptCode : new byte[0];
            }
            out.writeBytes(new VarInt(script.length).encode());
            out.writeBytes(script);
            writeUint32(out, SEQUENCE_FINAL);
        }
        out.writeBytes(new VarInt(outputs.size()).encode());
        for (Output output : outputs) {
            out.writeBytes(ByteBuffer.allocate(8).order(ByteOrder.LITTLE_ENDIAN).putLong(output.value()).array());
            out.writeBytes(new VarInt(output.scriptPubKey().length).encode());
            out.writeBytes(output.scriptPubKey());
        }
        writeUint32(out, lockTime);
        if (signingIndex >= 0) {
            writeUint32(out, sighashType);
        }
        return out.toByteArray();
    }

    private static void writeUint32(ByteArrayOutputStream out, long value) {
        out.writeBytes(ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt((int) value).array());
    }

    /**
     * Spent outpoint plus its unlocking script.
     */
    public static final class Input {
        private final byte[] prevTxidLe;
        private final int prevIndex;
        private byte[] scriptSig = new byte[0];

        private Input(String prevTxid, int prevIndex) {
            if (prevTxid == null || prevTxid.length() != 64) {
                throw new IllegalArgumentException("Previous txid must be 64 hex characters");
            }
            byte[] txid = HexFormat.of().parseHex(prevTxid);
            for (int i = 0; i < txid.length / 2; i++) {
                byte tmp = txid[i];
                txid[i] = txid[txid.length - 1 - i];
                txid[txid.length - 1 - i] = tmp;
            }
            this.prevTxidLe = txid;
            this.prevIndex = prevIndex;
        }

        public void setScriptSig(byte[] scriptSig) {
            this.scriptSig = scriptSig.clone();
        }

        public byte[] getScriptSig() { return scriptSig.clone(); }
        public int getPrevIndex() { return prevIndex; }

        private byte[] outpointBytes() {
            return ByteBuffer.allocate(36).order(ByteOrder.LITTLE_ENDIAN)
                    .put(prevTxidLe)
                    .putInt(prevIndex)
                    .array();
        }
    }

    public record Output(long value, byte[] scriptPubKey) {}
}
