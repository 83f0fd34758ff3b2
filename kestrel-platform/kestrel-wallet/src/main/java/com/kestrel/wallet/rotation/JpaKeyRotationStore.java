package com.kestrel.wallet.rotation;

import com.kestrel.core.domain.KeyLabel;
import com.kestrel.core.domain.KeyVersion;
import com.kestrel.core.repository.KeyLabelRepository;
import com.kestrel.core.repository.KeyVersionRepository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * {@link KeyRotationStore} over the {@code key_labels} and {@code key_versions} tables.
 *
 * Rotation locks the label row, so concurrent rotations of one label run one after another.
 */
public class JpaKeyRotationStore implements KeyRotationStore {

    private final KeyLabelRepository labelRepository;
    private final KeyVersionRepository versionRepository;

    public JpaKeyRotationStore(KeyLabelRepository labelRepository, KeyVersionRepository versionRepository) {
        this.labelRepository = labelRepository;
        this.versionRepository = versionRepository;
    }

    @Override
    @Transactional
    public boolean register(String label, String keyId) {
        if (labelRepository.existsById(label)) {
            return false;
        }
        versionRepository.save(KeyVersion.create(label, 1, keyId));
        labelRepository.save(KeyLabel.create(label, 1, keyId));
        return true;
    }

    @Override
    @Transactional
    public Optional<RotationResult> rotate(String label, String newKeyId) {
        Optional<KeyLabel> pointer = labelRepository.findForUpdate(label);
        if (pointer.isEmpty()) {
            return Optional.empty();
        }
        KeyLabel keyLabel = pointer.get();
        int oldVersion = keyLabel.getCurrentVersion();
        int newVersion = oldVersion + 1;

        versionRepository.save(KeyVersion.create(label, newVersion, newKeyId));
        versionRepository.findByLabelAndVersion(label, oldVersion)
                .orElseThrow(() -> new IllegalStateException("Current key version missing: " + label + " v" + oldVersion))
                .retire();
        keyLabel.advance(newVersion, newKeyId);
        return Optional.of(new RotationResult(label, oldVersion, newVersion, newKeyId));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<KeyVersionView> current(String label) {
        return labelRepository.findById(label)
                .flatMap(pointer -> versionRepository.findByLabelAndVersion(label, pointer.getCurrentVersion()))
                .map(JpaKeyRotationStore::toView);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<KeyVersionView> version(String label, int version) {
        return versionRepository.findByLabelAndVersion(label, version).map(JpaKeyRotationStore::toView);
    }

    @Override
    @Transactional(readOnly = true)
    public List<KeyVersionView> versions(String label) {
        return versionRepository.findByLabelOrderByVersionAsc(label).stream()
                .map(JpaKeyRotationStore::toView)
                .toList();
    }

    @Override
    @Transactional
    public boolean incrementUsage(String label, int version) {
        return versionRepository.incrementUsage(label, version) > 0;
    }

    @Override
    @Transactional
    public void purge(String label) {
        versionRepository.deleteByLabel(label);
        labelRepository.deleteById(label);
    }

    private static KeyVersionView toView(KeyVersion version) {
        return new KeyVersionView(version.getLabel(), version.getVersion(), version.getKeyId(),
                version.isRetired(), version.getUsageCount(), version.getCreatedAt());
    }
}
