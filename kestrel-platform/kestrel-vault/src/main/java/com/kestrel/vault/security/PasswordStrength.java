package com.kestrel.vault.security;

public enum PasswordStrength {
    WEAK,
    MEDIUM,
    STRONG,
    VERY_STRONG;

    public boolean atLeast(PasswordStrength required) {
        return compareTo(required) >= 0;
    }
}
