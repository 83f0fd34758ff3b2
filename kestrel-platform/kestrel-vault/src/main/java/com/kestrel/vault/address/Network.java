package com.kestrel.vault.address;

import com.kestrel.vault.error.ValidationException;

import java.util.Locale;

/**
 * Supported networks and their fixed parameters.
 */
public enum Network {

    ETH("eth", Family.ETHEREUM, 1L, -1, "https://eth.llamarpc.com"),
    SEPOLIA("sepolia", Family.ETHEREUM, 11_155_111L, -1, "https://rpc.sepolia.org"),
    POLYGON("polygon", Family.ETHEREUM, 137L, -1, "https://polygon-rpc.com"),
    BSC("bsc", Family.ETHEREUM, 56L, -1, "https://bsc-dataseed.binance.org"),
    BTC("btc", Family.BITCOIN, -1L, 0x00, "https://blockstream.info/api"),
    BTC_TESTNET("btc-testnet", Family.BITCOIN, -1L, 0x6f, "https://blockstream.info/testnet/api");

    public enum Family {
        ETHEREUM,
        BITCOIN
    }

    private final String tag;
    private final Family family;
    private final long chainId;
    private final int p2pkhVersion;
    private final String defaultEndpoint;

    Network(String tag, Family family, long chainId, int p2pkhVersion, String defaultEndpoint) {
        this.tag = tag;
        this.family = family;
        this.chainId = chainId;
        this.p2pkhVersion = p2pkhVersion;
        this.defaultEndpoint = defaultEndpoint;
    }

    /**
     * Resolves a network tag ("eth", "ethereum", "sepolia", "polygon", "bsc", "btc", "bitcoin",
     * "btc-testnet"), case-insensitively.
     *
     * @throws ValidationException for unknown or blank tags
     */
    public static Network fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new ValidationException("Network cannot be null or blank");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "ethereum" -> normalized = "eth";
            case "bitcoin" -> normalized = "btc";
            case "matic" -> normalized = "polygon";
            default -> { }
        }
        for (Network network : values()) {
            if (network.tag.equals(normalized)) {
                return network;
            }
        }
        throw new ValidationException("Unsupported network: " + tag);
    }

    public boolean isEthereum() { return family == Family.ETHEREUM; }
    public boolean isBitcoin() { return family == Family.BITCOIN; }

    /** P2SH version byte for Bitcoin networks. */
    public int p2shVersion() {
        return this == BTC ? 0x05 : 0xc4;
    }

    public String tag() { return tag; }
    public Family family() { return family; }
    /** EIP-155 chain id; -1 for Bitcoin networks. */
    public long chainId() { return chainId; }
    /** Base58Check P2PKH version byte; -1 for Ethereum networks. */
    public int p2pkhVersion() { return p2pkhVersion; }
    /** JSON-RPC endpoint for Ethereum networks, Esplora base URL for Bitcoin networks. */
    public String defaultEndpoint() { return defaultEndpoint; }

    @Override
    public String toString() {
        return tag;
    }
}
