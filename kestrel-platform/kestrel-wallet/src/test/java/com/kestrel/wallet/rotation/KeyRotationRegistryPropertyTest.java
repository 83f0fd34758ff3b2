package com.kestrel.wallet.rotation;

import com.kestrel.vault.error.NotFoundException;
import com.kestrel.vault.error.ValidationException;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for versioned key rotation.
 */
class KeyRotationRegistryPropertyTest {

    // ==================== Rotation ====================

    @Property(tries = 50)
    void exactlyOneCurrentVersionAfterAnyRotations(@ForAll("labels") String label,
                                                   @ForAll @IntRange(min = 0, max = 20) int rotations) {
        KeyRotationRegistry registry = new KeyRotationRegistry(new InMemoryKeyRotationStore());
        registry.register(label);

        for (int i = 0; i < rotations; i++) {
            RotationResult result = registry.rotate(label);
            assertThat(result.oldVersion()).isEqualTo(i + 1);
            assertThat(result.newVersion()).isEqualTo(i + 2);
            assertThat(registry.version(label, result.oldVersion()).retired()).isTrue();
        }

        List<KeyVersionView> versions = registry.versions(label);
        assertThat(versions).hasSize(rotations + 1);
        assertThat(versions).filteredOn(v -> !v.retired()).hasSize(1);
        assertThat(registry.current(label).version()).isEqualTo(rotations + 1);
        assertThat(registry.current(label).retired()).isFalse();
        assertThat(versions).extracting(KeyVersionView::keyId).doesNotHaveDuplicates();
    }

    @Property(tries = 30)
    void usageCountsOnlyTheCurrentVersion(@ForAll("labels") String label,
                                          @ForAll @IntRange(min = 1, max = 30) int before,
                                          @ForAll @IntRange(min = 0, max = 30) int after) {
        KeyRotationRegistry registry = new KeyRotationRegistry(new InMemoryKeyRotationStore());
        registry.register(label);
        for (int i = 0; i < before; i++) {
            registry.recordUsage(label);
        }
        registry.rotate(label);
        for (int i = 0; i < after; i++) {
            registry.recordUsage(label);
        }

        assertThat(registry.version(label, 1).usageCount()).isEqualTo(before);
        assertThat(registry.current(label).usageCount()).isEqualTo(after);
        assertThat(registry.needsRotation(label, before)).isEqualTo(after >= before);
    }

    @Property(tries = 20)
    void registerIsIdempotent(@ForAll("labels") String label) {
        KeyRotationRegistry registry = new KeyRotationRegistry(new InMemoryKeyRotationStore());
        KeyVersionView first = registry.register(label);
        registry.rotate(label);
        KeyVersionView again = registry.register(label);

        assertThat(first.version()).isEqualTo(1);
        assertThat(again.version()).isEqualTo(2);
        assertThat(registry.versions(label)).hasSize(2);
    }

    @Provide
    Arbitrary<String> labels() {
        return Arbitraries.strings().alpha().numeric().withChars('/', '-').ofMinLength(1).ofMaxLength(40)
                .filter(s -> !s.isBlank());
    }

    // ==================== Errors ====================

    @Test
    void rotateUnknownLabelFails() {
        KeyRotationRegistry registry = new KeyRotationRegistry(new InMemoryKeyRotationStore());

        assertThatThrownBy(() -> registry.rotate("wallet/nope/signing"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("wallet/nope/signing");
        assertThatThrownBy(() -> registry.current("wallet/nope/signing"))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void blankLabelAndBadThresholdAreRejected() {
        KeyRotationRegistry registry = new KeyRotationRegistry(new InMemoryKeyRotationStore());
        registry.register("wallet/a/signing");

        assertThatThrownBy(() -> registry.register(" ")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> registry.needsRotation("wallet/a/signing", 0))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void purgeRemovesAllVersions() {
        KeyRotationRegistry registry = new KeyRotationRegistry(new InMemoryKeyRotationStore());
        registry.register("wallet/a/signing");
        registry.rotate("wallet/a/signing");

        registry.purge("wallet/a/signing");

        assertThat(registry.versions("wallet/a/signing")).isEmpty();
        assertThatThrownBy(() -> registry.version("wallet/a/signing", 1))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void rotationResultMustAdvanceByOne() {
        assertThatThrownBy(() -> new RotationResult("l", 1, 3, "id"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
