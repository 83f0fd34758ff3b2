package com.kestrel.wallet.service;

import com.kestrel.vault.error.InternalException;
import com.kestrel.vault.error.StorageException;
import com.kestrel.vault.error.ValidationException;
import com.kestrel.vault.error.WalletException;
import com.kestrel.vault.security.ErrorSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

/**
 * Maps failures that escape the engine's own error types onto a {@link WalletException} kind.
 *
 * Callers only ever see sanitized messages; the original exception stays attached as the cause
 * and is logged here with key material redacted.
 */
class WalletErrorTranslator {

    private static final Logger log = LoggerFactory.getLogger(WalletErrorTranslator.class);

    WalletException translate(String operation, RuntimeException e) {
        if (e instanceof WalletException walletException) {
            return walletException;
        }
        if (e instanceof DataAccessException) {
            boolean retryable = e instanceof TransientDataAccessException
                    || e instanceof RecoverableDataAccessException;
            log.error("Storage failure during {}: {}", operation,
                    ErrorSanitizer.sanitizeForLogging(e.getMessage()), e);
            return new StorageException("Storage failure during " + operation, retryable, e);
        }
        if (e instanceof ArithmeticException) {
            log.warn("Arithmetic overflow during {}", operation);
            return new ValidationException("Amount or balance out of range", e);
        }
        if (e instanceof IllegalArgumentException) {
            log.warn("Invalid argument during {}: {}", operation, ErrorSanitizer.sanitizeForLogging(e.getMessage()));
            return new ValidationException(e.getMessage(), e);
        }
        if (e instanceof IllegalStateException) {
            log.error("Inconsistent storage state during {}: {}", operation,
                    ErrorSanitizer.sanitizeForLogging(e.getMessage()), e);
            return new StorageException("Storage state inconsistent during " + operation, false, e);
        }
        log.error("Unexpected failure during {}: {}", operation,
                ErrorSanitizer.sanitizeForLogging(e.getMessage()), e);
        return new InternalException("Internal error during " + operation, e);
    }
}
