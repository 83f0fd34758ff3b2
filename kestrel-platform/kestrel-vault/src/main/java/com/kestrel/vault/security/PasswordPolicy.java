package com.kestrel.vault.security;

import com.kestrel.vault.error.ValidationException;

import java.util.List;
import java.util.Locale;

/**
 * Password acceptance rules applied before any cryptographic work.
 *
 * The password is a gate only; it never feeds key derivation.
 */
public record PasswordPolicy(
        int minLength,
        boolean requireUppercase,
        boolean requireLowercase,
        boolean requireDigit,
        boolean requireSpecial,
        PasswordStrength minStrength
) {

    private static final String SPECIAL_CHARACTERS = "!@#$%^&*()-_=+[]{}|;:'\"<>,.?/~`";

    private static final List<String> WEAK_FRAGMENTS = List.of(
            "password", "123456", "12345678", "qwerty", "abc123",
            "password123", "admin", "letmein", "welcome", "monkey");

    public static PasswordPolicy defaults() {
        return new PasswordPolicy(8, true, true, true, false, PasswordStrength.MEDIUM);
    }

    public static PasswordPolicy strict() {
        return new PasswordPolicy(12, true, true, true, true, PasswordStrength.STRONG);
    }

    public static PasswordPolicy lenient() {
        return new PasswordPolicy(6, false, true, false, false, PasswordStrength.WEAK);
    }

    /**
     * Validates the password and returns its strength.
     *
     * @throws ValidationException when any rule is violated; the message names the rule, never the password
     */
    public PasswordStrength validate(String password) {
        if (password == null || password.isEmpty()) {
            throw new ValidationException("Password cannot be empty");
        }
        if (password.length() < minLength) {
            throw new ValidationException("Password must be at least " + minLength + " characters");
        }
        if (requireUppercase && password.chars().noneMatch(PasswordPolicy::isAsciiUpper)) {
            throw new ValidationException("Password must contain an uppercase letter");
        }
        if (requireLowercase && password.chars().noneMatch(PasswordPolicy::isAsciiLower)) {
            throw new ValidationException("Password must contain a lowercase letter");
        }
        if (requireDigit && password.chars().noneMatch(PasswordPolicy::isAsciiDigit)) {
            throw new ValidationException("Password must contain a digit");
        }
        if (requireSpecial && password.chars().noneMatch(c -> SPECIAL_CHARACTERS.indexOf(c) >= 0)) {
            throw new ValidationException("Password must contain a special character");
        }

        String lower = password.toLowerCase(Locale.ROOT);
        if (WEAK_FRAGMENTS.stream().anyMatch(lower::contains)) {
            throw new ValidationException("Password is too common");
        }

        PasswordStrength strength = strengthOf(password);
        if (!strength.atLeast(minStrength)) {
            throw new ValidationException("Password strength must be at least " + minStrength);
        }
        return strength;
    }

    /**
     * Scores a password: length bucket (0..3), one point per lower/upper/digit class,
     * two points for any non-alphanumeric character.
     */
    public static PasswordStrength strengthOf(String password) {
        int length = password.length();
        int score;
        if (length <= 7) {
            score = 0;
        } else if (length <= 11) {
            score = 1;
        } else if (length <= 15) {
            score = 2;
        } else {
            score = 3;
        }

        if (password.chars().anyMatch(PasswordPolicy::isAsciiLower)) score++;
        if (password.chars().anyMatch(PasswordPolicy::isAsciiUpper)) score++;
        if (password.chars().anyMatch(PasswordPolicy::isAsciiDigit)) score++;
        if (password.chars().anyMatch(c -> !Character.isLetterOrDigit(c))) score += 2;

        if (score <= 3) return PasswordStrength.WEAK;
        if (score <= 5) return PasswordStrength.MEDIUM;
        if (score <= 7) return PasswordStrength.STRONG;
        return PasswordStrength.VERY_STRONG;
    }

    private static boolean isAsciiUpper(int c) { return c >= 'A' && c <= 'Z'; }
    private static boolean isAsciiLower(int c) { return c >= 'a' && c <= 'z'; }
    private static boolean isAsciiDigit(int c) { return c >= '0' && c <= '9'; }
}
