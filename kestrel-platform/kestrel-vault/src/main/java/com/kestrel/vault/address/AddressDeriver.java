package com.kestrel.vault.address;

import com.kestrel.vault.error.ValidationException;
import com.kestrel.vault.secret.SecretBuffer;
import org.bitcoinj.core.Base58;
import org.bitcoinj.core.ECKey;
import org.bitcoinj.core.Utils;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

import java.math.BigInteger;

/**
 * Turns a 32-byte master key into a network address.
 *
 * One account-level key per network: the master key is used directly as the secp256k1
 * private key. Pure and side-effect free; the caller owns and wipes the key buffer.
 */
public class AddressDeriver {

    public static final int KEY_LENGTH = 32;

    /**
     * Derives the address of {@code masterKey} on {@code network}.
     *
     * @throws ValidationException when the key is not a valid secp256k1 scalar
     */
    public String deriveAddress(SecretBuffer masterKey, Network network) {
        if (masterKey == null) {
            throw new ValidationException("Master key cannot be null");
        }
        if (network == null) {
            throw new ValidationException("Network cannot be null");
        }
        BigInteger privateKey = toPrivateKey(masterKey.bytes());
        return network.isEthereum()
                ? ethereumAddress(privateKey)
                : bitcoinAddress(privateKey, network);
    }

    /**
     * Tag-based variant; unknown tags raise {@link ValidationException}.
     */
    public String deriveAddress(SecretBuffer masterKey, String networkTag) {
        return deriveAddress(masterKey, Network.fromTag(networkTag));
    }

    /**
     * Compressed SEC1 public key (33 bytes) for the given key.
     */
    public byte[] compressedPublicKey(SecretBuffer masterKey) {
        BigInteger privateKey = toPrivateKey(masterKey.bytes());
        return ECKey.publicKeyFromPrivate(privateKey, true);
    }

    /**
     * Validates the scalar range: exactly 32 bytes, non-zero, below the curve order.
     * Short or long keys are rejected rather than padded.
     */
    public static BigInteger toPrivateKey(byte[] key) {
        if (key == null || key.length != KEY_LENGTH) {
            throw new ValidationException("Master key must be exactly 32 bytes");
        }
        BigInteger value = new BigInteger(1, key);
        if (value.signum() == 0 || value.compareTo(ECKey.CURVE.getN()) >= 0) {
            throw new ValidationException("Master key is not a valid secp256k1 private key");
        }
        return value;
    }

    private String ethereumAddress(BigInteger privateKey) {
        BigInteger publicKey = Sign.publicKeyFromPrivate(privateKey);
        return Keys.toChecksumAddress(Keys.getAddress(publicKey));
    }

    private String bitcoinAddress(BigInteger privateKey, Network network) {
        byte[] publicKey = ECKey.publicKeyFromPrivate(privateKey, true);
        byte[] hash160 = Utils.sha256hash160(publicKey);
        return Base58.encodeChecked(network.p2pkhVersion(), hash160);
    }
}
