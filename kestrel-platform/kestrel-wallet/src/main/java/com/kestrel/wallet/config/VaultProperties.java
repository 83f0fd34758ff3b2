package com.kestrel.wallet.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Key-custody settings.
 */
@Configuration
@ConfigurationProperties(prefix = "kestrel.vault")
public class VaultProperties {

    /** Hex or base64 encoded 256-bit root KEK. */
    private String rootKek;
    private boolean testMode = false;
    private int pbkdf2Iterations = 100_000;
    private String passwordPolicy = "default";

    public String getRootKek() { return rootKek; }
    public void setRootKek(String rootKek) { this.rootKek = rootKek; }
    public boolean isTestMode() { return testMode; }
    public void setTestMode(boolean testMode) { this.testMode = testMode; }
    public int getPbkdf2Iterations() { return pbkdf2Iterations; }
    public void setPbkdf2Iterations(int pbkdf2Iterations) { this.pbkdf2Iterations = pbkdf2Iterations; }
    public String getPasswordPolicy() { return passwordPolicy; }
    public void setPasswordPolicy(String passwordPolicy) { this.passwordPolicy = passwordPolicy; }
}
