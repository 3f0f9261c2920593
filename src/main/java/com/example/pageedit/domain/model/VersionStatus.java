package com.example.pageedit.domain.model;

/**
 * Lifecycle state of a {@link DocumentVersion}.
 * A version starts {@code PENDING}, becomes {@code CURRENT} on commit and is {@code ARCHIVED}
 * once a newer version of the same document is committed.
 */
public enum VersionStatus {
    PENDING,
    CURRENT,
    ARCHIVED;

    public boolean acceptsSideData() {
        return this != ARCHIVED;
    }
}
