package com.kestrel.wallet.rotation;

import java.time.Instant;

/**
 * Read-only snapshot of one key version.
 */
public record KeyVersionView(
        String label,
        int version,
        String keyId,
        boolean retired,
        long usageCount,
        Instant createdAt
) {}
