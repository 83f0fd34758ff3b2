package com.kestrel.wallet.rotation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link KeyRotationStore} held in memory; every method is synchronized on the store.
 */
public class InMemoryKeyRotationStore implements KeyRotationStore {

    private final Map<String, List<KeyVersionView>> versionsByLabel = new HashMap<>();

    @Override
    public synchronized boolean register(String label, String keyId) {
        if (versionsByLabel.containsKey(label)) {
            return false;
        }
        List<KeyVersionView> versions = new ArrayList<>();
        versions.add(new KeyVersionView(label, 1, keyId, false, 0, Instant.now()));
        versionsByLabel.put(label, versions);
        return true;
    }

    @Override
    public synchronized Optional<RotationResult> rotate(String label, String newKeyId) {
        List<KeyVersionView> versions = versionsByLabel.get(label);
        if (versions == null) {
            return Optional.empty();
        }
        int currentIndex = versions.size() - 1;
        KeyVersionView current = versions.get(currentIndex);
        int newVersion = current.version() + 1;
        versions.set(currentIndex, new KeyVersionView(label, current.version(), current.keyId(), true,
                current.usageCount(), current.createdAt()));
        versions.add(new KeyVersionView(label, newVersion, newKeyId, false, 0, Instant.now()));
        return Optional.of(new RotationResult(label, current.version(), newVersion, newKeyId));
    }

    @Override
    public synchronized Optional<KeyVersionView> current(String label) {
        List<KeyVersionView> versions = versionsByLabel.get(label);
        return versions == null ? Optional.empty() : Optional.of(versions.get(versions.size() - 1));
    }

    @Override
    public synchronized Optional<KeyVersionView> version(String label, int version) {
        return versionsByLabel.getOrDefault(label, List.of()).stream()
                .filter(v -> v.version() == version)
                .findFirst();
    }

    @Override
    public synchronized List<KeyVersionView> versions(String label) {
        return List.copyOf(versionsByLabel.getOrDefault(label, List.of()));
    }

    @Override
    public synchronized boolean incrementUsage(String label, int version) {
        List<KeyVersionView> versions = versionsByLabel.get(label);
        if (versions == null) {
            return false;
        }
        for (int i = 0; i < versions.size(); i++) {
            KeyVersionView v = versions.get(i);
            if (v.version() == version && !v.retired()) {
                versions.set(i, new KeyVersionView(label, version, v.keyId(), false,
                        Math.addExact(v.usageCount(), 1L), v.createdAt()));
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized void purge(String label) {
        versionsByLabel.remove(label);
    }
}
