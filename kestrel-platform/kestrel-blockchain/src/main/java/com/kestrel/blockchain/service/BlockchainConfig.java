package com.kestrel.blockchain.service;

import com.kestrel.vault.address.Network;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration for blockchain connectivity.
 */
@Configuration
@ConfigurationProperties(prefix = "kestrel.blockchain")
public class BlockchainConfig {

    private Map<String, String> rpcEndpoints = new HashMap<>();
    private Duration rpcTimeout = Duration.ofSeconds(10);
    private int rpcThreads = 4;
    private String bitcoinIndexerUrl;
    private String bitcoinNetwork = "btc";
    private long feeRateSatPerByte = 10;
    private long gasLimit = 21_000L;

    /**
     * Configured endpoint for the network tag, or the network's built-in default.
     */
    public String resolveEndpoint(Network network) {
        String configured = rpcEndpoints.get(network.tag());
        return configured != null && !configured.isBlank() ? configured : network.defaultEndpoint();
    }

    /**
     * Esplora base URL for the configured Bitcoin network.
     */
    public String resolveIndexerUrl(Network network) {
        return bitcoinIndexerUrl != null && !bitcoinIndexerUrl.isBlank()
                ? bitcoinIndexerUrl
                : resolveEndpoint(network);
    }

    public Map<String, String> getRpcEndpoints() { return rpcEndpoints; }
    public void setRpcEndpoints(Map<String, String> rpcEndpoints) { this.rpcEndpoints = rpcEndpoints; }
    public Duration getRpcTimeout() { return rpcTimeout; }
    public void setRpcTimeout(Duration rpcTimeout) { this.rpcTimeout = rpcTimeout; }
    public int getRpcThreads() { return rpcThreads; }
    public void setRpcThreads(int rpcThreads) { this.rpcThreads = rpcThreads; }
    public String getBitcoinIndexerUrl() { return bitcoinIndexerUrl; }
    public void setBitcoinIndexerUrl(String url) { this.bitcoinIndexerUrl = url; }
    public String getBitcoinNetwork() { return bitcoinNetwork; }
    public void setBitcoinNetwork(String bitcoinNetwork) { this.bitcoinNetwork = bitcoinNetwork; }
    public long getFeeRateSatPerByte() { return feeRateSatPerByte; }
    public void setFeeRateSatPerByte(long feeRate) { this.feeRateSatPerByte = feeRate; }
    public long getGasLimit() { return gasLimit; }
    public void setGasLimit(long gasLimit) { this.gasLimit = gasLimit; }
}
