package com.kestrel.wallet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Kestrel self-custody wallet engine.
 */
@SpringBootApplication(scanBasePackages = "com.kestrel")
@EntityScan(basePackages = "com.kestrel.core.domain")
@EnableJpaRepositories(basePackages = "com.kestrel.core.repository")
public class KestrelWalletApplication {

    public static void main(String[] args) {
        SpringApplication.run(KestrelWalletApplication.class, args);
    }
}
