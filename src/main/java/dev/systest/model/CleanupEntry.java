package dev.systest.model;

import java.util.Objects;

/**
 * A teardown obligation registered by a step: release the resource {@code key} of the given {@code kind}.
 */
public record CleanupEntry(String kind, Object key) {

    public CleanupEntry {
        Objects.requireNonNull(kind, "kind");
    }
}
