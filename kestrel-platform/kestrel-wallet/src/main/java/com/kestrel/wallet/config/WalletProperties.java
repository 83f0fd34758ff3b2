package com.kestrel.wallet.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Wallet service settings.
 */
@Configuration
@ConfigurationProperties(prefix = "kestrel.wallet")
public class WalletProperties {

    /** {@code memory} or {@code sql}. */
    private String storage = "memory";
    private int multisigSignerSetSize = 5;
    private String multisigNetwork = "eth";
    /** Uses of one signing-key version before a rotation is advised; 0 disables the check. */
    private long rotationUsageThreshold = 0;

    public String getStorage() { return storage; }
    public void setStorage(String storage) { this.storage = storage; }
    public int getMultisigSignerSetSize() { return multisigSignerSetSize; }
    public void setMultisigSignerSetSize(int size) { this.multisigSignerSetSize = size; }
    public String getMultisigNetwork() { return multisigNetwork; }
    public void setMultisigNetwork(String multisigNetwork) { this.multisigNetwork = multisigNetwork; }
    public long getRotationUsageThreshold() { return rotationUsageThreshold; }
    public void setRotationUsageThreshold(long threshold) { this.rotationUsageThreshold = threshold; }
}
