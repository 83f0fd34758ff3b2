package com.kestrel.vault.address;

import com.kestrel.vault.error.ValidationException;
import org.bitcoinj.core.AddressFormatException;
import org.bitcoinj.core.Base58;
import org.web3j.crypto.Keys;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Recipient and amount checks performed before any decryption or network call.
 */
public final class AddressValidator {

    public static final int ETHEREUM_DECIMALS = 18;
    public static final int BITCOIN_DECIMALS = 8;

    private static final Pattern ETHEREUM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    private static final Pattern DECIMAL_AMOUNT = Pattern.compile("^\\d+(\\.\\d+)?$");

    private AddressValidator() {}

    /**
     * Validates a recipient for the given network.
     */
    public static void validateAddress(String address, Network network) {
        if (network == null) {
            throw new ValidationException("Network cannot be null");
        }
        if (network.isEthereum()) {
            validateEthereumAddress(address);
        } else {
            validateBitcoinAddress(address, network);
        }
    }

    /**
     * EIP-55: all-lowercase and all-uppercase bodies are accepted, mixed case must match the checksum.
     */
    public static void validateEthereumAddress(String address) {
        if (address == null || !ETHEREUM_ADDRESS.matcher(address).matches()) {
            throw new ValidationException("Invalid Ethereum address format");
        }
        String body = address.substring(2);
        boolean uniformCase = body.equals(body.toLowerCase(Locale.ROOT)) || body.equals(body.toUpperCase(Locale.ROOT));
        if (!uniformCase && !Keys.toChecksumAddress(address).equals(address)) {
            throw new ValidationException("Invalid Ethereum address checksum");
        }
    }

    /**
     * Base58Check with a P2PKH or P2SH version byte belonging to {@code network}.
     */
    public static void validateBitcoinAddress(String address, Network network) {
        if (address == null || address.isBlank()) {
            throw new ValidationException("Bitcoin address cannot be null or blank");
        }
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
        if (version != network.p2pkhVersion() && version != network.p2shVersion()) {
            throw new ValidationException("Bitcoin address does not belong to network " + network.tag());
        }
    }

    /**
     * Strict positive decimal with at most {@code maxDecimals} fractional digits.
     * No sign, exponent, grouping or surrounding whitespace.
     */
    public static BigDecimal validateAmount(String amount, int maxDecimals) {
        if (amount == null || !DECIMAL_AMOUNT.matcher(amount).matches()) {
            throw new ValidationException("Invalid amount format");
        }
        BigDecimal value = new BigDecimal(amount);
        int dot = amount.indexOf('.');
        int decimals = dot < 0 ? 0 : amount.length() - dot - 1;
        if (decimals > maxDecimals) {
            throw new ValidationException("Amount exceeds " + maxDecimals + " decimal places");
        }
        if (value.signum() <= 0) {
            throw new ValidationException("Amount must be positive");
        }
        return value;
    }

    public static BigDecimal validateAmount(String amount, Network network) {
        return validateAmount(amount, network.isEthereum() ? ETHEREUM_DECIMALS : BITCOIN_DECIMALS);
    }
}
