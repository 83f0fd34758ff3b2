package com.kestrel.vault.security;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Redacts sensitive fragments from error and log messages.
 *
 * {@link #sanitize(String)} is applied to every message that crosses the wallet boundary;
 * {@link #sanitizeForLogging(String)} keeps more detail for internal logs but still hides
 * private keys, mnemonic phrases and JWTs.
 */
public final class ErrorSanitizer {

    private static final Pattern PRIVATE_KEY = Pattern.compile("0x[0-9a-fA-F]{64}");
    private static final Pattern MNEMONIC = Pattern.compile("\\b([a-z]{3,8}\\s+){11,23}[a-z]{3,8}\\b");
    private static final Pattern JWT = Pattern.compile("eyJ[a-zA-Z0-9_-]*\\.eyJ[a-zA-Z0-9_-]*\\.[a-zA-Z0-9_-]*");

    private static final List<Redaction> BOUNDARY_REDACTIONS = List.of(
            new Redaction(PRIVATE_KEY, "[REDACTED_PRIVATE_KEY]"),
            new Redaction(MNEMONIC, "[REDACTED_MNEMONIC]"),
            new Redaction(Pattern.compile(
                    "(?i)api[_-]?key['\"]?\\s*[:=]\\s*['\"]?[a-zA-Z0-9_-]{20,}"), "api_key=[REDACTED]"),
            new Redaction(JWT, "[REDACTED_JWT]"),
            new Redaction(Pattern.compile(
                    "(?i)password['\"]?\\s*[:=]\\s*['\"]?[^\\s'\"]{6,}"), "password=[REDACTED]"),
            new Redaction(Pattern.compile(
                    "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"), "[REDACTED_EMAIL]"),
            new Redaction(Pattern.compile(
                    "\\b\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\b"), "xxx.xxx.xxx.xxx"),
            new Redaction(Pattern.compile(
                    "(?i)(?:postgres(?:ql)?|mysql|mongodb)://\\S+|jdbc:\\S+"), "[DATABASE_URL_REDACTED]"),
            new Redaction(Pattern.compile(
                    "(?i)\\b[a-z]:\\\\\\S+|/home/\\S+|/root/\\S+"), "[REDACTED_PATH]")
    );

    private static final List<Redaction> LOG_REDACTIONS = List.of(
            new Redaction(PRIVATE_KEY, "0x[REDACTED_64_CHARS]"),
            new Redaction(MNEMONIC, "[MNEMONIC_PHRASE]"),
            new Redaction(JWT, "eyJ...[JWT]")
    );

    private ErrorSanitizer() {}

    /**
     * Full redaction for messages returned to callers.
     */
    public static String sanitize(String message) {
        return apply(message, BOUNDARY_REDACTIONS);
    }

    /**
     * Reduced redaction for internal log lines.
     */
    public static String sanitizeForLogging(String message) {
        return apply(message, LOG_REDACTIONS);
    }

    private static String apply(String message, List<Redaction> redactions) {
        if (message == null || message.isEmpty()) {
            return message;
        }
        String result = message;
        for (Redaction redaction : redactions) {
            result = redaction.pattern().matcher(result).replaceAll(redaction.replacement());
        }
        return result;
    }

    private record Redaction(Pattern pattern, String replacement) {}
}
