package com.kestrel.vault.mnemonic;

import com.kestrel.vault.error.ValidationException;
import com.kestrel.vault.secret.SecretBuffer;
import org.bitcoinj.crypto.MnemonicCode;
import org.bitcoinj.crypto.MnemonicException;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * BIP-39 recovery phrases and master-key derivation.
 */
public class MnemonicService {

    private static final Set<Integer> VALID_WORD_COUNTS = Set.of(12, 15, 18, 21, 24);
    private static final int ENTROPY_BYTES = 32;

    private final SecureRandom secureRandom;
    private final MnemonicCode mnemonicCode;

    public MnemonicService(SecureRandom secureRandom) {
        if (secureRandom == null) {
            throw new IllegalArgumentException("SecureRandom cannot be null");
        }
        this.secureRandom = secureRandom;
        this.mnemonicCode = MnemonicCode.INSTANCE;
    }

    public MnemonicService() {
        this(new SecureRandom());
    }

    /**
     * A fresh 24-word phrase from 256 bits of entropy.
     */
    public String generate() {
        byte[] entropy = new byte[ENTROPY_BYTES];
        secureRandom.nextBytes(entropy);
        try {
            return String.join(" ", mnemonicCode.toMnemonic(entropy));
        } catch (MnemonicException.MnemonicLengthException e) {
            throw new IllegalStateException("Invalid entropy length", e);
        } finally {
            SecretBuffer.wipe(entropy);
        }
    }

    /**
     * Splits on whitespace and checks only the word count (12/15/18/21/24).
     */
    public List<String> validateWordCount(String mnemonic) {
        if (mnemonic == null || mnemonic.isBlank()) {
            throw new ValidationException("Mnemonic cannot be null or blank");
        }
        List<String> words = Arrays.asList(mnemonic.trim().toLowerCase(Locale.ROOT).split("\\s+"));
        if (!VALID_WORD_COUNTS.contains(words.size())) {
            throw new ValidationException("Mnemonic must have 12, 15, 18, 21 or 24 words, got " + words.size());
        }
        return words;
    }

    /**
     * Word count, wordlist membership and checksum.
     */
    public List<String> validate(String mnemonic) {
        List<String> words = validateWordCount(mnemonic);
        try {
            mnemonicCode.check(words);
        } catch (MnemonicException.MnemonicWordException e) {
            throw new ValidationException("Mnemonic contains an unknown word");
        } catch (MnemonicException.MnemonicChecksumException e) {
            throw new ValidationException("Mnemonic checksum mismatch");
        } catch (MnemonicException e) {
            throw new ValidationException("Invalid mnemonic");
        }
        return words;
    }

    /**
     * The master key is the first 32 bytes of the BIP-39 seed (empty passphrase).
     * The full 64-byte seed is wiped before returning.
     */
    public SecretBuffer deriveMasterKey(String mnemonic) {
        List<String> words = validate(mnemonic);
        byte[] seed = MnemonicCode.toSeed(words, "");
        try {
            return SecretBuffer.wrap(Arrays.copyOf(seed, 32));
        } finally {
            SecretBuffer.wipe(seed);
        }
    }
}
