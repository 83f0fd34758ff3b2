package com.kestrel.vault.mnemonic;

import com.kestrel.vault.error.ValidationException;
import com.kestrel.vault.secret.SecretBuffer;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import java.util.HexFormat;

import static org.assertj.core.api.Assertions.*;

class MnemonicServicePropertyTest {

    private static final String ABANDON_ABOUT = "abandon abandon abandon abandon abandon abandon "
            + "abandon abandon abandon abandon abandon about";

    private final MnemonicService mnemonicService = new MnemonicService();

    @Property(tries = 20)
    void generatedPhrasesHave24ValidWords(@ForAll("seeds") int ignored) {
        String mnemonic = mnemonicService.generate();

        assertThat(mnemonic.split(" ")).hasSize(24);
        assertThat(mnemonicService.validate(mnemonic)).hasSize(24);
    }

    @Property(tries = 20)
    void masterKeyDerivationIsDeterministic(@ForAll("seeds") int ignored) {
        String mnemonic = mnemonicService.generate();

        try (SecretBuffer first = mnemonicService.deriveMasterKey(mnemonic);
             SecretBuffer second = mnemonicService.deriveMasterKey(mnemonic)) {
            assertThat(first.bytes()).hasSize(32).isEqualTo(second.bytes());
        }
    }

    @Test
    void knownVectorMatchesBip39Seed() {
        try (SecretBuffer masterKey = mnemonicService.deriveMasterKey(ABANDON_ABOUT)) {
            assertThat(HexFormat.of().formatHex(masterKey.bytes()))
                    .isEqualTo("5eb00bbddcf069084889a8ab9155568165f5c453ccb85e70811aaed6f6da5fc1");
        }
    }

    @Test
    void thirteenWordsRejectedOnCount() {
        String thirteen = ABANDON_ABOUT + " abandon";

        assertThatThrownBy(() -> mnemonicService.validateWordCount(thirteen))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("13");
    }

    @Test
    void blankMnemonicRejected() {
        assertThatThrownBy(() -> mnemonicService.validateWordCount("  "))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void badChecksumRejected() {
        String badChecksum = ABANDON_ABOUT.replace("about", "abandon");

        assertThatThrownBy(() -> mnemonicService.validate(badChecksum))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Mnemonic checksum mismatch");
    }

    @Test
    void unknownWordRejected() {
        String unknown = ABANDON_ABOUT.replace("about", "kestrel");

        assertThatThrownBy(() -> mnemonicService.validate(unknown))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Mnemonic contains an unknown word");
    }

    @Test
    void extraWhitespaceAndCaseAreNormalized() {
        String messy = "  " + ABANDON_ABOUT.toUpperCase().replace(" ", "   ") + "\n";

        assertThat(mnemonicService.validate(messy)).hasSize(12);
    }

    @Provide
    Arbitrary<Integer> seeds() {
        return Arbitraries.integers().between(0, 1000);
    }
}
