package com.example.pageedit.domain.model;

import java.util.Optional;
import java.util.UUID;

/**
 * Container node that documents are filed under.
 */
public record Folder(UUID id, String title, UUID parentId) {

    public static Folder create(String title, UUID parentId) {
        return new Folder(UUID.randomUUID(), title, parentId);
    }

    public Optional<UUID> parent() {
        return Optional.ofNullable(parentId);
    }
}
